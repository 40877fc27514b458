package com.sensorpipeline.core.window;

import java.time.Instant;

/**
 * Outcome of {@link WindowState#insert(Instant, double)}.
 *
 * <p>
 * The baseline fields describe the window before the reading was added, so
 * point metrics (deviation, z-score) are not influenced by the value being
 * evaluated. Baseline mean and standard deviation are {@code NaN} when the
 * window was empty.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowInsertion {

    private final boolean inserted;
    private final boolean late;
    private final int baselineCount;
    private final double baselineMean;
    private final double baselineStd;
    private final Double previousValue;
    private final Instant previousTimestamp;

    private WindowInsertion(boolean inserted, boolean late, int baselineCount,
            double baselineMean, double baselineStd,
            Double previousValue, Instant previousTimestamp) {
        this.inserted = inserted;
        this.late = late;
        this.baselineCount = baselineCount;
        this.baselineMean = baselineMean;
        this.baselineStd = baselineStd;
        this.previousValue = previousValue;
        this.previousTimestamp = previousTimestamp;
    }

    static WindowInsertion inserted(boolean late, int baselineCount, double baselineMean,
            double baselineStd, Double previousValue, Instant previousTimestamp) {
        return new WindowInsertion(true, late, baselineCount, baselineMean, baselineStd,
                previousValue, previousTimestamp);
    }

    static WindowInsertion discarded(int baselineCount, double baselineMean, double baselineStd) {
        return new WindowInsertion(false, true, baselineCount, baselineMean, baselineStd,
                null, null);
    }

    /**
     * @return {@code false} if the reading fell outside the retention horizon
     *         and was left out of the window
     */
    public boolean isInserted() {
        return inserted;
    }

    /**
     * @return {@code true} if the reading was older than the newest retained one
     */
    public boolean isLate() {
        return late;
    }

    public int getBaselineCount() {
        return baselineCount;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getBaselineStd() {
        return baselineStd;
    }

    /**
     * @return value of the chronological predecessor, or {@code null} if none
     */
    public Double getPreviousValue() {
        return previousValue;
    }

    /**
     * @return timestamp of the chronological predecessor, or {@code null} if none
     */
    public Instant getPreviousTimestamp() {
        return previousTimestamp;
    }

    @Override
    public String toString() {
        return "WindowInsertion{" +
                "inserted=" + inserted +
                ", late=" + late +
                ", baselineCount=" + baselineCount +
                ", baselineMean=" + baselineMean +
                ", baselineStd=" + baselineStd +
                ", previousValue=" + previousValue +
                '}';
    }
}
