package com.ensemblesentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link WindowStatistics}.
 */
class WindowStatisticsTest {

    @Test
    @DisplayName("Should compute mean and population standard deviation")
    void shouldComputeMeanAndStdDev() {
        double[] values = { 2, 4, 4, 4, 5, 5, 7, 9 };
        double mean = WindowStatistics.mean(values, 0, values.length);

        assertThat(mean).isEqualTo(5.0);
        assertThat(WindowStatistics.stdDev(values, 0, values.length, mean)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should honour the half-open range")
    void shouldComputeOverSubRange() {
        double[] values = { 1, 3, 1000 };
        assertThat(WindowStatistics.mean(values, 0, 2)).isEqualTo(2.0);
        assertThat(WindowStatistics.stdDev(values, 0, 2, 2.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should interpolate percentiles between ranks")
    void shouldInterpolatePercentiles() {
        double[] quartiles = WindowStatistics.percentiles(new double[] { 4, 1, 3, 2 }, 25, 75);

        assertThat(quartiles[0]).isCloseTo(1.75, within(1e-12));
        assertThat(quartiles[1]).isCloseTo(3.25, within(1e-12));
    }

    @Test
    @DisplayName("Should return exact ranks without interpolation")
    void shouldReturnExactRanks() {
        double[] result = WindowStatistics.percentiles(new double[] { 5, 1, 4, 2, 3 }, 0, 25, 50, 100);
        assertThat(result).containsExactly(1, 2, 3, 5);
    }

    @Test
    @DisplayName("Should not reorder the caller's array")
    void shouldNotMutateInput() {
        double[] values = { 3, 1, 2 };
        WindowStatistics.percentiles(values, 50);
        assertThat(values).containsExactly(3, 1, 2);
    }
}
