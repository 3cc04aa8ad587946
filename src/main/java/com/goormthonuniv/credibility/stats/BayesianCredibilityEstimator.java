package com.goormthonuniv.credibility.stats;

import java.util.List;

import static com.goormthonuniv.credibility.stats.StatisticsUtils.clamp;
import static com.goormthonuniv.credibility.stats.StatisticsUtils.round1;

/**
 * 매체의 평균 truth score를 전체 prior 쪽으로 수축(shrinkage)시키는 추정기.
 *
 * <p>Bühlmann credibility 가중치를 쓴다.
 * <pre>
 *   K = σ²(표본) / σ²(prior)
 *   Z = m / (m + K)              m = 유효 표본 크기
 *   shrunk = Z·rawMean + (1 − Z)·priorMean
 * </pre>
 * 신용구간은 정규-정규 사후분산 {@code 1 / (1/σ²prior + m/σ²표본)} 의 95% 구간을 shrunk 중심에 놓는다.
 * 표본분산이 0이면(전부 같은 값이거나 n = 1) prior 분산으로 대체한다.
 *
 * <p>상태가 없고 스레드 안전하다.
 */
public final class BayesianCredibilityEstimator {

    private static final double Z_95 = 1.96;

    static final double HIGH_CONFIDENCE_MIN_ESS = 30;
    static final double MEDIUM_CONFIDENCE_MIN_ESS = 10;

    private BayesianCredibilityEstimator() {}

    /** 시점 정보가 없는 점수 목록. 유효 표본 크기 = n. */
    public static BayesianSourceScore estimate(List<Double> scores, GlobalPrior prior) {
        if (scores == null || scores.isEmpty()) return empty(prior);
        return compute(scores, EffectiveSampleSize.countOnly(scores), prior);
    }

    /** 시점 정보가 있는 관측. 몰려 들어온 분석은 유효 표본 크기가 줄어 더 강하게 수축된다. */
    public static BayesianSourceScore estimateTimed(List<TimedScore> observations, GlobalPrior prior) {
        if (observations == null || observations.isEmpty()) return empty(prior);
        List<Double> scores = observations.stream().map(TimedScore::truthScore).toList();
        return compute(scores, EffectiveSampleSize.temporal(observations), prior);
    }

    private static BayesianSourceScore empty(GlobalPrior prior) {
        return new BayesianSourceScore(
                prior.mean(),
                prior.variance(),
                0,
                prior.mean(),
                CredibleInterval.FULL,
                0,
                GradeConfidence.INSUFFICIENT
        );
    }

    private static BayesianSourceScore compute(List<Double> scores, double ess, GlobalPrior prior) {
        int n = scores.size();
        double rawMean = StatisticsUtils.mean(scores);
        double rawVariance = StatisticsUtils.variance(scores);

        // 분산 0이면 사후 분포 폭을 만들 수 없으므로 prior 분산으로 대체
        double observedVariance = rawVariance > 0 ? rawVariance : prior.variance();

        double k = observedVariance / prior.variance();
        double z = ess / (ess + k);
        double blended = z * rawMean + (1 - z) * prior.mean();

        // 반올림으로 [prior, raw] 구간을 벗어나지 않게
        double lo = Math.min(rawMean, prior.mean());
        double hi = Math.max(rawMean, prior.mean());
        double shrunk = clamp(round1(blended), lo, hi);

        double posteriorVariance = 1.0 / (1.0 / prior.variance() + ess / observedVariance);
        double halfWidth = Z_95 * Math.sqrt(posteriorVariance);
        CredibleInterval interval = new CredibleInterval(
                Math.min(shrunk, round1(clamp(shrunk - halfWidth, 0, 100))),
                Math.max(shrunk, round1(clamp(shrunk + halfWidth, 0, 100)))
        );

        return new BayesianSourceScore(
                rawMean,
                rawVariance,
                n,
                shrunk,
                interval,
                ess,
                confidence(ess, rawVariance, prior)
        );
    }

    static GradeConfidence confidence(double ess, double rawVariance, GlobalPrior prior) {
        if (ess <= 1) return GradeConfidence.INSUFFICIENT;
        if (ess < MEDIUM_CONFIDENCE_MIN_ESS) return GradeConfidence.LOW;
        if (ess >= HIGH_CONFIDENCE_MIN_ESS && rawVariance <= prior.variance()) return GradeConfidence.HIGH;
        return GradeConfidence.MEDIUM;
    }
}
