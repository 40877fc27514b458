package com.sensorpipeline.core.config;

import java.time.Duration;

/**
 * Mutable bean mirroring the pipeline YAML document.
 *
 * <p>
 * Expected YAML structure (every key optional, durations in milliseconds):
 * </p>
 *
 * <pre>
 * topic: sensor-data
 * workerCount: 2
 * windowSize: 60
 * windowMaxAgeMs: 3600000
 * anomalyThreshold: 3.0
 * batchSize: 100
 * flushIntervalMs: 5000
 * retryLimit: 3
 * </pre>
 *
 * <p>
 * Unset keys keep the defaults of {@link PipelineConfig.Builder}. Call
 * {@link #toConfig()} to obtain the validated, immutable form.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineSettings {

    private String topic;
    private Integer workerCount;
    private Long pollTimeoutMs;
    private Integer windowSize;
    private Long windowMaxAgeMs;
    private Double anomalyThreshold;
    private Integer batchSize;
    private Long flushIntervalMs;
    private Integer retryLimit;
    private Long backoffBaseMs;
    private Long backoffMaxMs;
    private Integer backpressureFactor;
    private Long appendTimeoutMs;
    private Long shutdownTimeoutMs;
    private Double errorRateThreshold;
    private Long rateIntervalMs;

    /**
     * Convert to a validated {@link PipelineConfig}.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public PipelineConfig toConfig() {
        PipelineConfig.Builder b = PipelineConfig.builder();
        if (topic != null) {
            b.topic(topic);
        }
        if (workerCount != null) {
            b.workerCount(workerCount);
        }
        if (pollTimeoutMs != null) {
            b.pollTimeout(Duration.ofMillis(pollTimeoutMs));
        }
        if (windowSize != null) {
            b.windowSize(windowSize);
        }
        if (windowMaxAgeMs != null) {
            b.windowMaxAge(Duration.ofMillis(windowMaxAgeMs));
        }
        if (anomalyThreshold != null) {
            b.anomalyThreshold(anomalyThreshold);
        }
        if (batchSize != null) {
            b.batchSize(batchSize);
        }
        if (flushIntervalMs != null) {
            b.flushInterval(Duration.ofMillis(flushIntervalMs));
        }
        if (retryLimit != null) {
            b.retryLimit(retryLimit);
        }
        if (backoffBaseMs != null) {
            b.backoffBase(Duration.ofMillis(backoffBaseMs));
        }
        if (backoffMaxMs != null) {
            b.backoffMax(Duration.ofMillis(backoffMaxMs));
        }
        if (backpressureFactor != null) {
            b.backpressureFactor(backpressureFactor);
        }
        if (appendTimeoutMs != null) {
            b.appendTimeout(Duration.ofMillis(appendTimeoutMs));
        }
        if (shutdownTimeoutMs != null) {
            b.shutdownTimeout(Duration.ofMillis(shutdownTimeoutMs));
        }
        if (errorRateThreshold != null) {
            b.errorRateThreshold(errorRateThreshold);
        }
        if (rateIntervalMs != null) {
            b.rateInterval(Duration.ofMillis(rateIntervalMs));
        }
        return b.build();
    }

    // ---------------------------------------------------------------
    // Getters / setters (SnakeYAML bean access)
    // ---------------------------------------------------------------

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public Integer getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(Integer workerCount) {
        this.workerCount = workerCount;
    }

    public Long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(Long pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public Integer getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(Integer windowSize) {
        this.windowSize = windowSize;
    }

    public Long getWindowMaxAgeMs() {
        return windowMaxAgeMs;
    }

    public void setWindowMaxAgeMs(Long windowMaxAgeMs) {
        this.windowMaxAgeMs = windowMaxAgeMs;
    }

    public Double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public void setAnomalyThreshold(Double anomalyThreshold) {
        this.anomalyThreshold = anomalyThreshold;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(Integer batchSize) {
        this.batchSize = batchSize;
    }

    public Long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public void setFlushIntervalMs(Long flushIntervalMs) {
        this.flushIntervalMs = flushIntervalMs;
    }

    public Integer getRetryLimit() {
        return retryLimit;
    }

    public void setRetryLimit(Integer retryLimit) {
        this.retryLimit = retryLimit;
    }

    public Long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(Long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public Long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public void setBackoffMaxMs(Long backoffMaxMs) {
        this.backoffMaxMs = backoffMaxMs;
    }

    public Integer getBackpressureFactor() {
        return backpressureFactor;
    }

    public void setBackpressureFactor(Integer backpressureFactor) {
        this.backpressureFactor = backpressureFactor;
    }

    public Long getAppendTimeoutMs() {
        return appendTimeoutMs;
    }

    public void setAppendTimeoutMs(Long appendTimeoutMs) {
        this.appendTimeoutMs = appendTimeoutMs;
    }

    public Long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(Long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public Double getErrorRateThreshold() {
        return errorRateThreshold;
    }

    public void setErrorRateThreshold(Double errorRateThreshold) {
        this.errorRateThreshold = errorRateThreshold;
    }

    public Long getRateIntervalMs() {
        return rateIntervalMs;
    }

    public void setRateIntervalMs(Long rateIntervalMs) {
        this.rateIntervalMs = rateIntervalMs;
    }
}
