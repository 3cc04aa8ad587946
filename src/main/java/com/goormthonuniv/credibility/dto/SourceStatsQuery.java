package com.goormthonuniv.credibility.dto;

import com.goormthonuniv.credibility.exception.InvalidQueryParameterException;

/**
 * 매체 통계 조회 조건. null 필드는 기본값으로 채운다.
 */
public record SourceStatsQuery(
        Integer minArticles,     // 기본 1
        TimeRange timeRange,     // 기본 ALL
        String articleType,      // null = 전체
        SortBy sortBy,           // 기본 GRADE
        SortOrder sortOrder,     // 기본 DESC
        Integer limit,           // 기본 DEFAULT_LIMIT
        Integer offset           // 기본 0
) {
    public static final int DEFAULT_LIMIT = 50;

    public SourceStatsQuery {
        if (minArticles == null) minArticles = 1;
        if (timeRange == null) timeRange = TimeRange.ALL;
        if (articleType != null && articleType.isBlank()) articleType = null;
        if (sortBy == null) sortBy = SortBy.GRADE;
        if (sortOrder == null) sortOrder = SortOrder.DESC;
        if (limit == null) limit = DEFAULT_LIMIT;
        if (offset == null) offset = 0;

        if (limit < 0) throw new InvalidQueryParameterException("limit must not be negative: " + limit);
        if (offset < 0) throw new InvalidQueryParameterException("offset must not be negative: " + offset);
    }

    public static SourceStatsQuery defaults() {
        return new SourceStatsQuery(null, null, null, null, null, null, null);
    }
}
