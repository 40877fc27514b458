package com.sensorpipeline.core.window;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link WindowState}.
 */
class WindowStateTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private static Instant at(int seconds) {
        return T0.plusSeconds(seconds);
    }

    @Test
    @DisplayName("Window holds min(N, W) most recent readings with aggregates matching a recomputation")
    void shouldKeepMostRecentReadingsAndMatchRecomputation() {
        Random random = new Random(42);
        int capacity = 7;
        WindowState window = new WindowState(capacity, null);
        double[] all = new double[50];

        for (int n = 0; n < all.length; n++) {
            all[n] = 1_000 + random.nextGaussian() * 25;
            window.insert(at(n), all[n]);

            int expectedSize = Math.min(n + 1, capacity);
            double[] expected = Arrays.copyOfRange(all, n + 1 - expectedSize, n + 1);
            WindowSnapshot snapshot = window.snapshot();

            assertThat(snapshot.count()).isEqualTo(expectedSize);
            assertThat(snapshot.values()).containsExactly(expected);
            assertThat(window.mean()).isCloseTo(mean(expected), within(1e-9));
            assertThat(window.populationStd()).isCloseTo(std(expected), within(1e-9));
            assertThat(window.min()).isEqualTo(Arrays.stream(expected).min().getAsDouble());
            assertThat(window.max()).isEqualTo(Arrays.stream(expected).max().getAsDouble());
        }
    }

    @Test
    @DisplayName("Inserting W+1 readings yields aggregates of readings 2..W+1")
    void shouldEvictOldestReading() {
        WindowState window = new WindowState(3, null);
        window.insert(at(0), 10);
        window.insert(at(1), 20);
        window.insert(at(2), 30);
        window.insert(at(3), 40);

        assertThat(window.snapshot().values()).containsExactly(20, 30, 40);
        assertThat(window.mean()).isCloseTo(30.0, within(1e-12));
        assertThat(window.populationStd()).isCloseTo(Math.sqrt(200.0 / 3), within(1e-12));
        assertThat(window.min()).isEqualTo(20.0);
        assertThat(window.max()).isEqualTo(40.0);
    }

    @Test
    @DisplayName("Evicting the current maximum rescans the window")
    void shouldRescanExtremesWhenEvictingMaximum() {
        WindowState window = new WindowState(3, null);
        window.insert(at(0), 99);
        window.insert(at(1), 5);
        window.insert(at(2), 7);
        window.insert(at(3), 6);

        assertThat(window.max()).isEqualTo(7.0);
        assertThat(window.min()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Insertion reports the baseline and the chronological predecessor")
    void shouldReportBaselineAndPredecessor() {
        WindowState window = new WindowState(5, null);
        WindowInsertion first = window.insert(at(0), 70);
        assertThat(first.getBaselineCount()).isZero();
        assertThat(first.getPreviousValue()).isNull();

        window.insert(at(10), 71);
        WindowInsertion third = window.insert(at(20), 130);

        assertThat(third.isInserted()).isTrue();
        assertThat(third.isLate()).isFalse();
        assertThat(third.getBaselineCount()).isEqualTo(2);
        assertThat(third.getBaselineMean()).isCloseTo(70.5, within(1e-12));
        assertThat(third.getBaselineStd()).isCloseTo(0.5, within(1e-12));
        assertThat(third.getPreviousValue()).isEqualTo(71.0);
        assertThat(third.getPreviousTimestamp()).isEqualTo(at(10));
    }

    @Test
    @DisplayName("Late reading is inserted at its chronological position")
    void shouldInsertLateReadingInOrder() {
        WindowState window = new WindowState(5, null);
        window.insert(at(0), 1);
        window.insert(at(20), 3);
        WindowInsertion late = window.insert(at(10), 2);

        assertThat(late.isLate()).isTrue();
        assertThat(late.isInserted()).isTrue();
        assertThat(late.getPreviousValue()).isEqualTo(1.0);
        assertThat(window.snapshot().values()).containsExactly(1, 2, 3);
        assertThat(window.snapshot().timestamps()).containsExactly(at(0), at(10), at(20));
    }

    @Test
    @DisplayName("Late reading older than a full window is not inserted")
    void shouldDiscardReadingBeyondRetentionHorizon() {
        WindowState window = new WindowState(2, null);
        window.insert(at(10), 1);
        window.insert(at(20), 2);
        WindowInsertion tooOld = window.insert(at(5), 100);

        assertThat(tooOld.isLate()).isTrue();
        assertThat(tooOld.isInserted()).isFalse();
        assertThat(tooOld.getBaselineCount()).isEqualTo(2);
        assertThat(window.snapshot().values()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Late reading in a full window evicts the oldest and keeps order")
    void shouldEvictOldestWhenLateReadingFitsFullWindow() {
        WindowState window = new WindowState(3, null);
        window.insert(at(0), 1);
        window.insert(at(10), 2);
        window.insert(at(30), 4);
        window.insert(at(20), 3);

        assertThat(window.snapshot().values()).containsExactly(2, 3, 4);
        assertThat(window.mean()).isCloseTo(3.0, within(1e-12));
    }

    @Test
    @DisplayName("Time-bounded window drops readings older than maxAge")
    void shouldEvictByAge() {
        WindowState window = new WindowState(10, Duration.ofSeconds(60));
        window.insert(at(0), 1);
        window.insert(at(30), 2);
        window.insert(at(90), 3);

        assertThat(window.snapshot().values()).containsExactly(2, 3);
        WindowInsertion stale = window.insert(at(10), 9);
        assertThat(stale.isInserted()).isFalse();
    }

    @Test
    @DisplayName("Aggregates stay exact across many recompute cycles")
    void shouldStayAccurateOverLongStreams() {
        WindowState window = new WindowState(4, null);
        for (int i = 0; i < 10_000; i++) {
            window.insert(at(i), 1e9 + (i % 4));
        }
        assertThat(window.mean()).isCloseTo(1e9 + 1.5, within(1e-6));
        assertThat(window.populationStd()).isCloseTo(Math.sqrt(1.25), within(1e-6));
    }

    @Test
    @DisplayName("Clear empties the window")
    void shouldClear() {
        WindowState window = new WindowState(3, null);
        window.insert(at(0), 5);
        window.clear();

        assertThat(window.isEmpty()).isTrue();
        assertThat(window.mean()).isNaN();
        window.insert(at(1), 8);
        assertThat(window.mean()).isEqualTo(8.0);
        assertThat(window.populationStd()).isZero();
    }

    @Test
    @DisplayName("Should reject non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new WindowState(0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }

    private static double mean(double[] values) {
        return Arrays.stream(values).average().orElseThrow();
    }

    private static double std(double[] values) {
        double m = mean(values);
        return Math.sqrt(Arrays.stream(values).map(v -> (v - m) * (v - m)).sum() / values.length);
    }
}
