package com.sensorpipeline.core.pipeline;

import java.util.List;

/**
 * Result of {@link PipelineOrchestrator#healthCheck()}.
 *
 * <p>
 * The pipeline is healthy when the source is connected and the error rate
 * stays below the configured threshold. A stopped pipeline is never healthy.
 * </p>
 */
public final class HealthSnapshot {

    public static final String STATUS_HEALTHY = "healthy";
    public static final String STATUS_DEGRADED = "degraded";
    public static final String STATUS_STOPPED = "stopped";

    private final boolean healthy;
    private final String status;
    private final PipelineState state;
    private final double errorRate;
    private final boolean sourceConnected;
    private final List<String> reasons;

    HealthSnapshot(boolean healthy, String status, PipelineState state, double errorRate,
            boolean sourceConnected, List<String> reasons) {
        this.healthy = healthy;
        this.status = status;
        this.state = state;
        this.errorRate = errorRate;
        this.sourceConnected = sourceConnected;
        this.reasons = List.copyOf(reasons);
    }

    public boolean isHealthy() {
        return healthy;
    }

    public String getStatus() {
        return status;
    }

    public PipelineState getState() {
        return state;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public boolean isSourceConnected() {
        return sourceConnected;
    }

    /**
     * @return why the pipeline is not healthy; empty when it is
     */
    public List<String> getReasons() {
        return reasons;
    }

    @Override
    public String toString() {
        return "HealthSnapshot{status=" + status + ", errorRate=" + errorRate + ", reasons=" + reasons + '}';
    }
}
