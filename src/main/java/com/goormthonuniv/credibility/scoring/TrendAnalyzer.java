package com.goormthonuniv.credibility.scoring;

import com.goormthonuniv.credibility.stats.StatisticsUtils;
import com.goormthonuniv.credibility.stats.TimedScore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * 최근 30일 평균과 그 이전(30일/90일 이전) 평균을 비교해 추세를 낸다.
 */
@Component
public class TrendAnalyzer {

    static final int MIN_ANALYSES = 5;
    static final int SPARKLINE_SIZE = 20;
    static final double DIRECTION_THRESHOLD = 3;

    private final Clock clock;

    public TrendAnalyzer(Clock clock) {
        this.clock = clock;
    }

    public Trend analyze(List<TimedScore> observations) {
        List<TimedScore> sorted = observations.stream()
                .sorted(Comparator.comparing(TimedScore::createdAt))
                .toList();

        if (sorted.size() < MIN_ANALYSES) {
            return new Trend(TrendDirection.STABLE, null, null, scores(sorted));
        }

        Instant now = clock.instant();
        Instant thirtyDaysAgo = now.minus(Duration.ofDays(30));
        Instant ninetyDaysAgo = now.minus(Duration.ofDays(90));

        Double recentAvg = bucketMean(sorted, o -> o.createdAt().isAfter(thirtyDaysAgo));
        Double older30Avg = bucketMean(sorted, o -> !o.createdAt().isAfter(thirtyDaysAgo));
        Double older90Avg = bucketMean(sorted, o -> !o.createdAt().isAfter(ninetyDaysAgo));

        Double change30 = delta(recentAvg, older30Avg);
        Double change90 = delta(recentAvg, older90Avg);

        List<TimedScore> tail = sorted.subList(Math.max(0, sorted.size() - SPARKLINE_SIZE), sorted.size());
        return new Trend(direction(change30), change30, change90, scores(tail));
    }

    static TrendDirection direction(Double change30Days) {
        if (change30Days == null) return TrendDirection.STABLE;
        if (change30Days > DIRECTION_THRESHOLD) return TrendDirection.IMPROVING;
        if (change30Days < -DIRECTION_THRESHOLD) return TrendDirection.DECLINING;
        return TrendDirection.STABLE;
    }

    private static Double bucketMean(List<TimedScore> sorted, Predicate<TimedScore> inBucket) {
        List<Double> bucket = sorted.stream().filter(inBucket).map(TimedScore::truthScore).toList();
        return bucket.isEmpty() ? null : StatisticsUtils.mean(bucket);
    }

    private static Double delta(Double recent, Double older) {
        if (recent == null || older == null) return null;
        return StatisticsUtils.round1(recent - older);
    }

    private static List<Double> scores(List<TimedScore> observations) {
        return observations.stream().map(TimedScore::truthScore).toList();
    }
}
