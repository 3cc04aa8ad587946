package com.goormthonuniv.credibility.scoring;

import com.goormthonuniv.credibility.stats.TimedScore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TrendAnalyzer}.
 */
class TrendAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    private final TrendAnalyzer analyzer = new TrendAnalyzer(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void analyze_fewerThanFive_isStableWithChronologicalSparkline() {
        Trend trend = analyzer.analyze(List.of(
                at(2, 70), at(40, 50), at(10, 60)));

        assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
        assertThat(trend.change30Days()).isNull();
        assertThat(trend.change90Days()).isNull();
        assertThat(trend.sparklineData()).containsExactly(50.0, 60.0, 70.0);
    }

    @Test
    void analyze_risingScores_isImproving() {
        Trend trend = analyzer.analyze(List.of(
                at(100, 50), at(95, 50), at(60, 55), at(5, 70), at(3, 70)));

        assertThat(trend.direction()).isEqualTo(TrendDirection.IMPROVING);
        assertThat(trend.change30Days()).isEqualTo(18.3);
        assertThat(trend.change90Days()).isEqualTo(20.0);
    }

    @Test
    void analyze_fallingScores_isDeclining() {
        Trend trend = analyzer.analyze(List.of(
                at(100, 80), at(95, 80), at(60, 80), at(5, 60), at(3, 60)));

        assertThat(trend.direction()).isEqualTo(TrendDirection.DECLINING);
        assertThat(trend.change30Days()).isEqualTo(-20.0);
    }

    @Test
    void analyze_noRecentAnalyses_hasNullDeltas() {
        Trend trend = analyzer.analyze(List.of(
                at(200, 50), at(150, 60), at(120, 70), at(100, 80), at(60, 90)));

        assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
        assertThat(trend.change30Days()).isNull();
        assertThat(trend.change90Days()).isNull();
    }

    @Test
    void analyze_noAnalysesOlderThan90Days_hasNullNinetyDayDelta() {
        Trend trend = analyzer.analyze(List.of(
                at(50, 60), at(40, 60), at(20, 60), at(10, 60), at(5, 60)));

        assertThat(trend.change30Days()).isEqualTo(0.0);
        assertThat(trend.change90Days()).isNull();
        assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void analyze_exactlyThirtyDaysOld_countsAsOlder() {
        Trend trend = analyzer.analyze(List.of(
                at(30, 40), at(2, 80), at(2, 80), at(1, 80), at(1, 80)));

        assertThat(trend.change30Days()).isEqualTo(40.0);
    }

    @Test
    void analyze_sparklineKeepsLastTwenty() {
        List<TimedScore> observations = IntStream.range(0, 25)
                .mapToObj(i -> at(25 - i, i))
                .toList();

        Trend trend = analyzer.analyze(observations);

        assertThat(trend.sparklineData()).hasSize(20);
        assertThat(trend.sparklineData().get(0)).isEqualTo(5.0);
        assertThat(trend.sparklineData().get(19)).isEqualTo(24.0);
    }

    @Test
    void direction_usesThreePointThreshold() {
        assertThat(TrendAnalyzer.direction(4.0)).isEqualTo(TrendDirection.IMPROVING);
        assertThat(TrendAnalyzer.direction(-4.0)).isEqualTo(TrendDirection.DECLINING);
        assertThat(TrendAnalyzer.direction(3.0)).isEqualTo(TrendDirection.STABLE);
        assertThat(TrendAnalyzer.direction(0.0)).isEqualTo(TrendDirection.STABLE);
        assertThat(TrendAnalyzer.direction(null)).isEqualTo(TrendDirection.STABLE);
    }

    private static TimedScore at(long daysAgo, double score) {
        return new TimedScore(NOW.minus(Duration.ofDays(daysAgo)), score);
    }
}
