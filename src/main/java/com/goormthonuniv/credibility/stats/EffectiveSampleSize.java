package com.goormthonuniv.credibility.stats;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * 유효 표본 크기(effective sample size) 계산.
 * 짧은 간격으로 몰려 들어온 분석은 서로 독립적이지 않다고 보고 가중치를 깎는다.
 *
 * 직전 관측과의 간격별 가중치:
 * - 1일 미만: 0.3
 * - 1~7일: 0.6
 * - 7~30일: 0.85
 * - 30일 이상: 1.0
 */
public final class EffectiveSampleSize {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private EffectiveSampleSize() {}

    /** 타임스탬프가 없을 때의 폴백: 개수 그대로 */
    public static double countOnly(List<Double> scores) {
        return scores == null ? 0 : scores.size();
    }

    public static double temporal(List<TimedScore> observations) {
        if (observations == null || observations.isEmpty()) return 0;
        if (observations.size() == 1) return 1;

        List<TimedScore> sorted = observations.stream()
                .sorted(Comparator.comparing(TimedScore::createdAt))
                .toList();

        double ess = 1.0;
        for (int i = 1; i < sorted.size(); i++) {
            long gapMillis = Duration.between(sorted.get(i - 1).createdAt(), sorted.get(i).createdAt()).toMillis();
            ess += gapWeight(gapMillis / MILLIS_PER_DAY);
        }
        return StatisticsUtils.round1(ess);
    }

    static double gapWeight(double gapDays) {
        if (gapDays < 1) return 0.3;
        if (gapDays < 7) return 0.6;
        if (gapDays < 30) return 0.85;
        return 1.0;
    }
}
