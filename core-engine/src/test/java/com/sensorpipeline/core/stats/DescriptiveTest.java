package com.sensorpipeline.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Descriptive}.
 */
class DescriptiveTest {

    @Test
    @DisplayName("Median of odd and even series")
    void shouldComputeMedian() {
        assertThat(Descriptive.median(new double[] {1, 3, 9})).isEqualTo(3.0);
        assertThat(Descriptive.median(new double[] {1, 2, 3, 10})).isEqualTo(2.5);
        assertThat(Descriptive.median(new double[] {4})).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Percentiles interpolate linearly between ranks")
    void shouldInterpolatePercentiles() {
        double[] sorted = {10, 20, 30, 40, 50};
        assertThat(Descriptive.percentile(sorted, 0)).isEqualTo(10.0);
        assertThat(Descriptive.percentile(sorted, 25)).isEqualTo(20.0);
        assertThat(Descriptive.percentile(sorted, 75)).isEqualTo(40.0);
        assertThat(Descriptive.percentile(sorted, 100)).isEqualTo(50.0);
        assertThat(Descriptive.percentile(new double[] {1, 2}, 25)).isCloseTo(1.25, within(1e-12));
    }

    @Test
    @DisplayName("Percentile rejects empty input and out-of-range p")
    void shouldRejectInvalidPercentileArguments() {
        assertThatThrownBy(() -> Descriptive.percentile(new double[0], 50))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Descriptive.percentile(new double[] {1}, 101))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Population standard deviation")
    void shouldComputePopulationStd() {
        assertThat(Descriptive.std(new double[] {2, 4, 4, 4, 5, 5, 7, 9})).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("OLS slope against index")
    void shouldComputeSlope() {
        assertThat(Descriptive.slope(new double[] {1, 3, 5, 7})).isCloseTo(2.0, within(1e-12));
        assertThat(Descriptive.slope(new double[] {5, 5})).isZero();
        assertThat(Descriptive.slope(new double[] {0, 2, 1})).isCloseTo(0.5, within(1e-12));
    }

    @Test
    @DisplayName("Successive differences")
    void shouldComputeDifferences() {
        assertThat(Descriptive.differences(new double[] {1, 4, 9, 16})).containsExactly(3, 5, 7);
    }
}
