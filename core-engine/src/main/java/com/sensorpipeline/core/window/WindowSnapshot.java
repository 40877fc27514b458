package com.sensorpipeline.core.window;

import java.time.Instant;
import java.util.Arrays;

/**
 * Immutable copy of a {@link WindowState} at one point in time.
 *
 * <p>
 * Values and timestamps are in chronological order. Aggregates are
 * {@code NaN} for an empty window.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowSnapshot {

    private final double[] values;
    private final Instant[] timestamps;
    private final double mean;
    private final double std;
    private final double min;
    private final double max;

    WindowSnapshot(double[] values, Instant[] timestamps,
            double mean, double std, double min, double max) {
        this.values = values;
        this.timestamps = timestamps;
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.max = max;
    }

    public int count() {
        return values.length;
    }

    /**
     * @return a copy of the windowed values, oldest first
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * @return a copy of the windowed values sorted ascending
     */
    public double[] sortedValues() {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    /**
     * @return a copy of the timestamps, oldest first
     */
    public Instant[] timestamps() {
        return timestamps.clone();
    }

    public double mean() {
        return mean;
    }

    /**
     * @return population standard deviation
     */
    public double std() {
        return std;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    @Override
    public String toString() {
        return "WindowSnapshot{" +
                "count=" + values.length +
                ", mean=" + mean +
                ", std=" + std +
                ", min=" + min +
                ", max=" + max +
                '}';
    }
}
