package com.goormthonuniv.credibility.stats;

/**
 * 매체 하나에 대한 베이지안 추정 결과. 매 조회마다 다시 계산하며 캐시하지 않는다.
 */
public record BayesianSourceScore(
        double rawMean,
        double rawVariance,
        int sampleSize,
        double shrunkScore,
        CredibleInterval credibleInterval,
        double effectiveSampleSize,
        GradeConfidence gradeConfidence
) {}
