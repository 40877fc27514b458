package com.sensorpipeline.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration of one pipeline instance.
 *
 * <p>
 * Use the {@link Builder} for programmatic / test scenarios, or
 * {@link PipelineConfigLoader} to read it from YAML. The builder validates
 * every value at {@link Builder#build()} time, so an instance is always
 * legal.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Source
    // ---------------------------------------------------------------
    private final String topic;
    private final int workerCount;
    private final Duration pollTimeout;

    // ---------------------------------------------------------------
    // Window / statistics
    // ---------------------------------------------------------------
    private final int windowSize;
    private final Duration windowMaxAge;
    private final double anomalyThreshold;

    // ---------------------------------------------------------------
    // Write buffer
    // ---------------------------------------------------------------
    private final int batchSize;
    private final Duration flushInterval;
    private final int retryLimit;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final int backpressureFactor;
    private final Duration appendTimeout;

    // ---------------------------------------------------------------
    // Lifecycle / health
    // ---------------------------------------------------------------
    private final Duration shutdownTimeout;
    private final double errorRateThreshold;
    private final Duration rateInterval;

    private PipelineConfig(Builder b) {
        this.topic = b.topic;
        this.workerCount = b.workerCount;
        this.pollTimeout = b.pollTimeout;
        this.windowSize = b.windowSize;
        this.windowMaxAge = b.windowMaxAge;
        this.anomalyThreshold = b.anomalyThreshold;
        this.batchSize = b.batchSize;
        this.flushInterval = b.flushInterval;
        this.retryLimit = b.retryLimit;
        this.backoffBase = b.backoffBase;
        this.backoffMax = b.backoffMax;
        this.backpressureFactor = b.backpressureFactor;
        this.appendTimeout = b.appendTimeout;
        this.shutdownTimeout = b.shutdownTimeout;
        this.errorRateThreshold = b.errorRateThreshold;
        this.rateInterval = b.rateInterval;
    }

    /**
     * @return a configuration with every default applied
     */
    public static PipelineConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .topic(topic)
                .workerCount(workerCount)
                .pollTimeout(pollTimeout)
                .windowSize(windowSize)
                .windowMaxAge(windowMaxAge)
                .anomalyThreshold(anomalyThreshold)
                .batchSize(batchSize)
                .flushInterval(flushInterval)
                .retryLimit(retryLimit)
                .backoffBase(backoffBase)
                .backoffMax(backoffMax)
                .backpressureFactor(backpressureFactor)
                .appendTimeout(appendTimeout)
                .shutdownTimeout(shutdownTimeout)
                .errorRateThreshold(errorRateThreshold)
                .rateInterval(rateInterval);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getTopic() {
        return topic;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * @return age bound of each window, or {@code null} for count-only windows
     */
    public Duration getWindowMaxAge() {
        return windowMaxAge;
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public int getRetryLimit() {
        return retryLimit;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public int getBackpressureFactor() {
        return backpressureFactor;
    }

    /**
     * @return maximum number of records the write buffer holds before
     *         {@code append} blocks
     */
    public int getMaxBufferedRecords() {
        return batchSize * backpressureFactor;
    }

    public Duration getAppendTimeout() {
        return appendTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public double getErrorRateThreshold() {
        return errorRateThreshold;
    }

    public Duration getRateInterval() {
        return rateInterval;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link PipelineConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (positive sizes and durations, error-rate threshold in
     * (0, 1], non-blank topic).
     * </p>
     */
    public static class Builder {
        private String topic = "sensor-data";
        private int workerCount = 1;
        private Duration pollTimeout = Duration.ofMillis(500);
        private int windowSize = 60;
        private Duration windowMaxAge;
        private double anomalyThreshold = 3.0;
        private int batchSize = 100;
        private Duration flushInterval = Duration.ofSeconds(5);
        private int retryLimit = 3;
        private Duration backoffBase = Duration.ofMillis(100);
        private Duration backoffMax = Duration.ofSeconds(5);
        private int backpressureFactor = 4;
        private Duration appendTimeout = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private double errorRateThreshold = 0.01;
        private Duration rateInterval = Duration.ofSeconds(10);

        public Builder topic(String v) {
            this.topic = v;
            return this;
        }

        public Builder workerCount(int v) {
            this.workerCount = v;
            return this;
        }

        public Builder pollTimeout(Duration v) {
            this.pollTimeout = v;
            return this;
        }

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder windowMaxAge(Duration v) {
            this.windowMaxAge = v;
            return this;
        }

        public Builder anomalyThreshold(double v) {
            this.anomalyThreshold = v;
            return this;
        }

        public Builder batchSize(int v) {
            this.batchSize = v;
            return this;
        }

        public Builder flushInterval(Duration v) {
            this.flushInterval = v;
            return this;
        }

        public Builder retryLimit(int v) {
            this.retryLimit = v;
            return this;
        }

        public Builder backoffBase(Duration v) {
            this.backoffBase = v;
            return this;
        }

        public Builder backoffMax(Duration v) {
            this.backoffMax = v;
            return this;
        }

        public Builder backpressureFactor(int v) {
            this.backpressureFactor = v;
            return this;
        }

        public Builder appendTimeout(Duration v) {
            this.appendTimeout = v;
            return this;
        }

        public Builder shutdownTimeout(Duration v) {
            this.shutdownTimeout = v;
            return this;
        }

        public Builder errorRateThreshold(double v) {
            this.errorRateThreshold = v;
            return this;
        }

        public Builder rateInterval(Duration v) {
            this.rateInterval = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link PipelineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public PipelineConfig build() {
            if (topic == null || topic.isBlank()) {
                throw new IllegalArgumentException("topic must not be null or blank");
            }
            requireAtLeast(workerCount, 1, "workerCount");
            requireAtLeast(windowSize, 1, "windowSize");
            requireAtLeast(batchSize, 1, "batchSize");
            requireAtLeast(retryLimit, 1, "retryLimit");
            requireAtLeast(backpressureFactor, 1, "backpressureFactor");

            requirePositive(pollTimeout, "pollTimeout");
            requirePositive(flushInterval, "flushInterval");
            requirePositive(backoffBase, "backoffBase");
            requirePositive(backoffMax, "backoffMax");
            requirePositive(appendTimeout, "appendTimeout");
            requirePositive(shutdownTimeout, "shutdownTimeout");
            requirePositive(rateInterval, "rateInterval");
            if (windowMaxAge != null) {
                requirePositive(windowMaxAge, "windowMaxAge");
            }
            if (backoffMax.compareTo(backoffBase) < 0) {
                throw new IllegalArgumentException(
                        "backoffMax must be >= backoffBase, got: " + backoffMax + " < " + backoffBase);
            }
            if (rateInterval.toSeconds() < 1) {
                throw new IllegalArgumentException(
                        "rateInterval must be at least one second, got: " + rateInterval);
            }

            if (!(anomalyThreshold > 0) || Double.isInfinite(anomalyThreshold)) {
                throw new IllegalArgumentException(
                        "anomalyThreshold must be a finite value > 0, got: " + anomalyThreshold);
            }
            if (!(errorRateThreshold > 0 && errorRateThreshold <= 1)) {
                throw new IllegalArgumentException(
                        "errorRateThreshold must be in (0, 1], got: " + errorRateThreshold);
            }
            return new PipelineConfig(this);
        }

        private static void requireAtLeast(int value, int min, String name) {
            if (value < min) {
                throw new IllegalArgumentException(name + " must be >= " + min + ", got: " + value);
            }
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "topic='" + topic + '\'' +
                ", workerCount=" + workerCount +
                ", windowSize=" + windowSize +
                ", windowMaxAge=" + windowMaxAge +
                ", anomalyThreshold=" + anomalyThreshold +
                ", batchSize=" + batchSize +
                ", flushInterval=" + flushInterval +
                ", retryLimit=" + retryLimit +
                ", backoffBase=" + backoffBase +
                ", backpressureFactor=" + backpressureFactor +
                ", shutdownTimeout=" + shutdownTimeout +
                ", errorRateThreshold=" + errorRateThreshold +
                '}';
    }
}
