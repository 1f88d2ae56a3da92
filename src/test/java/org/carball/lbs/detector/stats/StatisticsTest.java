package org.carball.lbs.detector.stats;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticsTest {

    @Test
    void shouldDropNullAndNonFiniteValues() {
        // Given
        List<Double> values = Arrays.asList(1.0, null, Double.NaN, 3.0, Double.POSITIVE_INFINITY);

        // When
        double[] clean = Statistics.finite(values);

        // Then
        assertThat(clean).containsExactly(1.0, 3.0);
    }

    @Test
    void shouldComputeSampleStandardDeviation() {
        // Given
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        // Then - population std is 2, sample std uses n - 1
        assertThat(Statistics.mean(values)).isEqualTo(5.0);
        assertThat(Statistics.sampleStd(values)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
        assertThat(Statistics.sampleStd(new double[]{42})).isZero();
    }

    @Test
    void shouldInterpolatePercentilesLinearly() {
        // Given
        double[] values = {1, 2, 3, 4};

        // Then
        assertThat(Statistics.percentile(values, 25)).isCloseTo(1.75, within(1e-12));
        assertThat(Statistics.percentile(values, 75)).isCloseTo(3.25, within(1e-12));
        assertThat(Statistics.median(values)).isCloseTo(2.5, within(1e-12));
        assertThat(Statistics.percentile(new double[0], 50)).isZero();
    }

    @Test
    void shouldRejectPercentileOutOfRange() {
        assertThatThrownBy(() -> Statistics.percentile(new double[]{1, 2}, 101))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 0 and 100");
    }

    @Test
    void shouldDescribeEmptyInputWithZeros() {
        // When
        SummaryStatistics summary = Statistics.describe(new double[]{Double.NaN});

        // Then
        assertThat(summary.count()).isZero();
        assertThat(summary.mean()).isZero();
        assertThat(summary.std()).isZero();
    }

    @Test
    void shouldCenterRollingWindows() {
        // Given
        double[] series = {1, 2, 3, 4, 5, 6, 7};

        // When
        double[] odd = Statistics.rollingMean(series, 3);
        double[] even = Statistics.rollingMean(series, 4);

        // Then - odd windows are symmetric, even windows lean one element earlier
        assertThat(odd[0]).isNaN();
        assertThat(odd[1]).isEqualTo(2.0);
        assertThat(odd[5]).isEqualTo(6.0);
        assertThat(odd[6]).isNaN();

        assertThat(even[1]).isNaN();
        assertThat(even[2]).isEqualTo(2.5);
        assertThat(even[5]).isEqualTo(5.5);
        assertThat(even[6]).isNaN();
    }

    @Test
    void shouldComputeRollingStandardDeviation() {
        // When
        double[] std = Statistics.rollingStd(new double[]{1, 1, 1, 5, 1, 1, 1}, 3);

        // Then
        assertThat(std[1]).isZero();
        assertThat(std[3]).isCloseTo(Statistics.sampleStd(new double[]{1, 5, 1}), within(1e-12));
    }
}
