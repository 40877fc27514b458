package com.sensorpipeline.core.stats;

/**
 * Point-in-time metrics for one reading against its window.
 *
 * <p>
 * Window statistics ({@code mean} … {@code range}) describe the window after
 * the reading was inserted and are {@code null} while the window holds fewer
 * than two readings. Point metrics ({@code changeFromMean},
 * {@code changePercent}, {@code zScore}) compare the value with the window as
 * it was before insertion. Degenerate cases yield {@code null}, never a
 * computed-but-meaningless number.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatFeatures {

    private final int windowCount;
    private final Double mean;
    private final Double median;
    private final Double std;
    private final Double min;
    private final Double max;
    private final Double range;
    private final Double changeFromMean;
    private final Double changePercent;
    private final Double rateOfChange;
    private final Double zScore;
    private final boolean anomaly;

    private StatFeatures(Builder b) {
        this.windowCount = b.windowCount;
        this.mean = b.mean;
        this.median = b.median;
        this.std = b.std;
        this.min = b.min;
        this.max = b.max;
        this.range = b.range;
        this.changeFromMean = b.changeFromMean;
        this.changePercent = b.changePercent;
        this.rateOfChange = b.rateOfChange;
        this.zScore = b.zScore;
        this.anomaly = b.anomaly;
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private int windowCount;
        private Double mean;
        private Double median;
        private Double std;
        private Double min;
        private Double max;
        private Double range;
        private Double changeFromMean;
        private Double changePercent;
        private Double rateOfChange;
        private Double zScore;
        private boolean anomaly;

        Builder windowCount(int v) {
            this.windowCount = v;
            return this;
        }

        Builder mean(Double v) {
            this.mean = v;
            return this;
        }

        Builder median(Double v) {
            this.median = v;
            return this;
        }

        Builder std(Double v) {
            this.std = v;
            return this;
        }

        Builder min(Double v) {
            this.min = v;
            return this;
        }

        Builder max(Double v) {
            this.max = v;
            return this;
        }

        Builder range(Double v) {
            this.range = v;
            return this;
        }

        Builder changeFromMean(Double v) {
            this.changeFromMean = v;
            return this;
        }

        Builder changePercent(Double v) {
            this.changePercent = v;
            return this;
        }

        Builder rateOfChange(Double v) {
            this.rateOfChange = v;
            return this;
        }

        Builder zScore(Double v) {
            this.zScore = v;
            return this;
        }

        Builder anomaly(boolean v) {
            this.anomaly = v;
            return this;
        }

        StatFeatures build() {
            return new StatFeatures(this);
        }
    }

    public int getWindowCount() {
        return windowCount;
    }

    public Double getMean() {
        return mean;
    }

    public Double getMedian() {
        return median;
    }

    public Double getStd() {
        return std;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public Double getRange() {
        return range;
    }

    public Double getChangeFromMean() {
        return changeFromMean;
    }

    public Double getChangePercent() {
        return changePercent;
    }

    /**
     * @return change per second relative to the chronological predecessor
     */
    public Double getRateOfChange() {
        return rateOfChange;
    }

    public Double getZScore() {
        return zScore;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    @Override
    public String toString() {
        return "StatFeatures{" +
                "windowCount=" + windowCount +
                ", mean=" + mean +
                ", std=" + std +
                ", zScore=" + zScore +
                ", anomaly=" + anomaly +
                '}';
    }
}
