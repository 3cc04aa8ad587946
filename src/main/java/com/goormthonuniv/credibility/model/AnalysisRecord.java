package com.goormthonuniv.credibility.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 업스트림이 만든 분석 결과 한 건. 엔진은 읽기만 한다.
 */
public record AnalysisRecord(
        String id,
        double truthScore,                       // 0~100
        Instant createdAt,
        CredibilityLevel credibility,
        ScoreBreakdown scoreBreakdown,
        List<DeceptionInstance> deceptionInstances,
        List<FallacyInstance> fallacyInstances,
        List<FactCheckResult> factCheckResults
) {
    public AnalysisRecord {
        if (Double.isNaN(truthScore) || truthScore < 0 || truthScore > 100) {
            throw new IllegalArgumentException("truthScore must be within [0, 100]: " + truthScore);
        }
        Objects.requireNonNull(createdAt, "createdAt");
        if (credibility == null) credibility = CredibilityLevel.fromScore(truthScore);
        if (scoreBreakdown == null) scoreBreakdown = ScoreBreakdown.MIDPOINT;
        deceptionInstances = deceptionInstances == null ? List.of() : List.copyOf(deceptionInstances);
        fallacyInstances = fallacyInstances == null ? List.of() : List.copyOf(fallacyInstances);
        factCheckResults = factCheckResults == null ? List.of() : List.copyOf(factCheckResults);
    }
}
