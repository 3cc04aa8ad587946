package com.goormthonuniv.credibility.stats;

import java.util.List;

/**
 * 전체 분석 이력의 truth score 평균/분산. 데이터를 보기 전 "모르는 매체"에 대한 믿음.
 */
public record GlobalPrior(
        double mean,
        double variance
) {
    public static final double DEFAULT_MEAN = 50.0;
    /** 표준편차 15 */
    public static final double DEFAULT_VARIANCE = 225.0;

    public static final GlobalPrior DEFAULT = new GlobalPrior(DEFAULT_MEAN, DEFAULT_VARIANCE);

    public GlobalPrior {
        if (Double.isNaN(mean) || mean < 0 || mean > 100) {
            throw new IllegalArgumentException("prior mean must be within [0, 100]: " + mean);
        }
        if (variance <= 0) throw new IllegalArgumentException("prior variance must be positive: " + variance);
    }

    public static GlobalPrior fromScores(List<Double> scores) {
        return fromScores(scores, DEFAULT);
    }

    /** 점수가 없으면 기본 평균, 2개 미만이면 기본 분산을 쓴다. */
    public static GlobalPrior fromScores(List<Double> scores, GlobalPrior defaults) {
        int n = scores == null ? 0 : scores.size();
        double mean = n > 0 ? StatisticsUtils.mean(scores) : defaults.mean();
        double variance = n > 1 ? StatisticsUtils.variance(scores) : defaults.variance();
        if (variance <= 0) variance = defaults.variance();
        return new GlobalPrior(mean, variance);
    }
}
