package com.goormthonuniv.credibility.stats;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link StatisticsUtils}.
 */
class StatisticsUtilsTest {

    @Test
    void mean_emptyInput_returnsZero() {
        assertThat(StatisticsUtils.mean(List.of())).isZero();
        assertThat(StatisticsUtils.mean((List<Double>) null)).isZero();
    }

    @Test
    void mean_returnsArithmeticMean() {
        assertThat(StatisticsUtils.mean(List.of(1.0, 2.0, 3.0, 4.0, 5.0))).isEqualTo(3.0);
    }

    @Test
    void variance_usesBesselCorrection() {
        assertThat(StatisticsUtils.variance(List.of(1.0, 2.0, 3.0, 4.0, 5.0))).isEqualTo(2.5);
    }

    @Test
    void variance_identicalValues_returnsZero() {
        assertThat(StatisticsUtils.variance(List.of(3.0, 3.0, 3.0, 3.0))).isZero();
    }

    @Test
    void variance_singleValue_returnsZero() {
        assertThat(StatisticsUtils.variance(List.of(42.0))).isZero();
        assertThat(StatisticsUtils.variance(List.of())).isZero();
    }

    @Test
    void standardDeviation_isSquareRootOfVariance() {
        assertThat(StatisticsUtils.standardDeviation(List.of(1.0, 2.0, 3.0, 4.0, 5.0)))
                .isCloseTo(Math.sqrt(2.5), within(1e-9));
    }

    @Test
    void median_evenCount_averagesMiddleValues() {
        assertThat(StatisticsUtils.median(List.of(1.0, 2.0, 3.0, 4.0))).isEqualTo(2.5);
    }

    @Test
    void median_oddCount_returnsMiddleValue() {
        assertThat(StatisticsUtils.median(List.of(9.0, 1.0, 5.0))).isEqualTo(5.0);
    }

    @Test
    void median_doesNotMutateInput() {
        List<Double> input = new ArrayList<>(List.of(4.0, 1.0, 3.0, 2.0));

        StatisticsUtils.median(input);

        assertThat(input).containsExactly(4.0, 1.0, 3.0, 2.0);
    }

    @Test
    void median_emptyInput_returnsZero() {
        assertThat(StatisticsUtils.median(List.of())).isZero();
    }

    @Test
    void percentile_interpolatesLinearly() {
        assertThat(StatisticsUtils.percentile(List.of(1.0, 2.0, 3.0, 4.0, 5.0), 25)).isEqualTo(2.0);
        assertThat(StatisticsUtils.percentile(List.of(10.0, 20.0, 30.0, 40.0), 40)).isCloseTo(22.0, within(1e-9));
    }

    @Test
    void percentile_unsortedInput_sortsCopy() {
        List<Double> input = new ArrayList<>(List.of(5.0, 1.0, 4.0, 2.0, 3.0));

        assertThat(StatisticsUtils.percentile(input, 50)).isEqualTo(3.0);
        assertThat(input).containsExactly(5.0, 1.0, 4.0, 2.0, 3.0);
    }

    @Test
    void percentile_singleElement_returnsValueAtAnyPercentile() {
        assertThat(StatisticsUtils.percentile(List.of(7.0), 0)).isEqualTo(7.0);
        assertThat(StatisticsUtils.percentile(List.of(7.0), 99)).isEqualTo(7.0);
    }

    @Test
    void percentile_emptyInput_returnsZero() {
        assertThat(StatisticsUtils.percentile(List.of(), 50)).isZero();
    }

    @Test
    void round1_roundsHalfUpToOneDecimal() {
        assertThat(StatisticsUtils.round1(2.25)).isEqualTo(2.3);
        assertThat(StatisticsUtils.round1(3.44)).isEqualTo(3.4);
        assertThat(StatisticsUtils.round1(50.0)).isEqualTo(50.0);
    }
}
