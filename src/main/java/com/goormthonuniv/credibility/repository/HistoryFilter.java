package com.goormthonuniv.credibility.repository;

import java.time.Instant;

/**
 * 분석 이력 조회 조건.
 *
 * @param since       이 시각 이후 분석만 (null = 전체)
 * @param articleType 특정 기사 유형만 (null = 전체)
 */
public record HistoryFilter(
        Instant since,
        String articleType
) {
    public static final HistoryFilter ALL = new HistoryFilter(null, null);
}
