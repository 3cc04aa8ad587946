package com.goormthonuniv.credibility.stats;

import java.util.Arrays;
import java.util.List;

/**
 * 기초 통계 함수 모음. 입력은 절대 변경하지 않으며, 빈 입력은 0을 반환한다.
 */
public final class StatisticsUtils {

    private StatisticsUtils() {}

    public static double mean(List<Double> xs) {
        return mean(toArray(xs));
    }

    public static double mean(double[] xs) {
        if (xs == null || xs.length == 0) return 0.0;
        double sum = 0;
        for (double x : xs) sum += x;
        return sum / xs.length;
    }

    /** 표본분산 (n-1로 나눔). n <= 1 이면 0. */
    public static double variance(List<Double> xs) {
        return variance(toArray(xs));
    }

    public static double variance(double[] xs) {
        if (xs == null || xs.length <= 1) return 0.0;
        double m = mean(xs);
        double ss = 0;
        for (double x : xs) {
            double d = x - m;
            ss += d * d;
        }
        return ss / (xs.length - 1);
    }

    public static double standardDeviation(List<Double> xs) {
        return Math.sqrt(variance(xs));
    }

    public static double median(List<Double> xs) {
        double[] sorted = sortedCopy(xs);
        int n = sorted.length;
        if (n == 0) return 0.0;
        int mid = n / 2;
        return (n % 2 == 0) ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    /**
     * 선형 보간 백분위수.
     *
     * @param p 0 ~ 100
     */
    public static double percentile(List<Double> xs, double p) {
        double[] sorted = sortedCopy(xs);
        int n = sorted.length;
        if (n == 0) return 0.0;
        if (n == 1) return sorted[0];

        double index = (p / 100.0) * (n - 1);
        int lo = (int) Math.floor(index);
        int hi = (int) Math.ceil(index);
        if (lo == hi) return sorted[lo];
        double frac = index - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    /** 소수점 첫째 자리 반올림 (half-up) */
    public static double round1(double x) {
        return Math.round(x * 10.0) / 10.0;
    }

    public static double clamp(double v, double lo, double hi) {
        if (v < lo) return lo;
        if (v > hi) return hi;
        return v;
    }

    private static double[] sortedCopy(List<Double> xs) {
        double[] copy = toArray(xs);
        Arrays.sort(copy);
        return copy;
    }

    private static double[] toArray(List<Double> xs) {
        if (xs == null) return new double[0];
        return xs.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
