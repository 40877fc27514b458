package com.sensorpipeline.core.stats;

import java.util.Objects;

/**
 * Descriptive statistics over small in-memory series.
 *
 * <p>
 * All methods are pure. Callers pass arrays they own; nothing is retained.
 * Standard deviations are population standard deviations.
 * </p>
 *
 * @since 1.0.0
 */
public final class Descriptive {

    private Descriptive() {
        // utility class, not instantiable
    }

    /**
     * Median of an ascending-sorted array.
     *
     * @param sorted values sorted ascending; must not be empty
     * @return the median
     */
    public static double median(double[] sorted) {
        return percentile(sorted, 50.0);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * <p>
     * The rank is {@code p / 100 * (n - 1)}; the result interpolates between
     * the values at the floor and ceiling of that rank.
     * </p>
     *
     * @param sorted values sorted ascending; must not be empty
     * @param p      percentile in [0, 100]
     * @return the interpolated percentile
     * @throws IllegalArgumentException if the array is empty or {@code p} is
     *                                  out of range
     */
    public static double percentile(double[] sorted, double p) {
        Objects.requireNonNull(sorted, "values must not be null");
        if (sorted.length == 0) {
            throw new IllegalArgumentException("percentile of an empty series is undefined");
        }
        if (p < 0 || p > 100) {
            throw new IllegalArgumentException("percentile must be in [0, 100], got: " + p);
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * @param values values; must not be empty
     * @return arithmetic mean
     */
    public static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * @param values values; must not be empty
     * @return population standard deviation
     */
    public static double std(double[] values) {
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Slope of the ordinary-least-squares line of value against index.
     *
     * @param series values in order; at least 2
     * @return slope per step
     */
    public static double slope(double[] series) {
        int n = series.length;
        double meanX = (n - 1) / 2.0;
        double meanY = mean(series);
        double covariance = 0;
        double varianceX = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            covariance += dx * (series[i] - meanY);
            varianceX += dx * dx;
        }
        return covariance / varianceX;
    }

    /**
     * @param series values in order; at least 2
     * @return successive differences {@code series[i] - series[i - 1]}
     */
    public static double[] differences(double[] series) {
        double[] diffs = new double[series.length - 1];
        for (int i = 1; i < series.length; i++) {
            diffs[i - 1] = series[i] - series[i - 1];
        }
        return diffs;
    }
}
