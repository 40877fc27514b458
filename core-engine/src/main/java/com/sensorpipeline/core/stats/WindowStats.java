package com.sensorpipeline.core.stats;

/**
 * Summary of a key's current window, for inspection.
 *
 * @since 1.0.0
 */
public final class WindowStats {

    private final int count;
    private final double mean;
    private final double std;
    private final double min;
    private final double max;

    WindowStats(int count, double mean, double std, double min, double max) {
        this.count = count;
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.max = max;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "WindowStats{count=" + count + ", mean=" + mean + ", std=" + std
                + ", min=" + min + ", max=" + max + '}';
    }
}
