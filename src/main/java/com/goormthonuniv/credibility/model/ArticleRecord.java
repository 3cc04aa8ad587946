package com.goormthonuniv.credibility.model;

import java.util.List;
import java.util.Objects;

/** 매체(publication)에 속한 기사와 그 분석 이력 */
public record ArticleRecord(
        String id,
        String publication,
        String articleType,
        List<AnalysisRecord> analyses
) {
    public ArticleRecord {
        Objects.requireNonNull(publication, "publication");
        analyses = analyses == null ? List.of() : List.copyOf(analyses);
    }
}
