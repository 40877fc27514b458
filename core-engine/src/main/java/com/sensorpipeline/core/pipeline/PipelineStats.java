package com.sensorpipeline.core.pipeline;

import com.sensorpipeline.core.buffer.WriterStats;

import java.time.Instant;

/**
 * Snapshot of orchestrator counters returned by
 * {@link PipelineOrchestrator#getStats()}.
 *
 * @since 1.0.0
 */
public final class PipelineStats {

    private final PipelineState state;
    private final long totalProcessed;
    private final long totalErrors;
    private final long validationErrors;
    private final long anomaliesDetected;
    private final double processingRate;
    private final Instant lastProcessedTime;
    private final boolean sourceConnected;
    private final int activeKeys;
    private final WriterStats writer;

    PipelineStats(PipelineState state, long totalProcessed, long totalErrors, long validationErrors,
            long anomaliesDetected, double processingRate, Instant lastProcessedTime,
            boolean sourceConnected, int activeKeys, WriterStats writer) {
        this.state = state;
        this.totalProcessed = totalProcessed;
        this.totalErrors = totalErrors;
        this.validationErrors = validationErrors;
        this.anomaliesDetected = anomaliesDetected;
        this.processingRate = processingRate;
        this.lastProcessedTime = lastProcessedTime;
        this.sourceConnected = sourceConnected;
        this.activeKeys = activeKeys;
        this.writer = writer;
    }

    public PipelineState getState() {
        return state;
    }

    /**
     * @return records taken from the source, whether or not they were valid
     */
    public long getTotalProcessed() {
        return totalProcessed;
    }

    /**
     * @return records that failed in the pipeline (validation, full buffer,
     *         unexpected errors); storage losses are in {@link #getWriter()}
     */
    public long getTotalErrors() {
        return totalErrors;
    }

    public long getValidationErrors() {
        return validationErrors;
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected;
    }

    /**
     * @return readings per second over the configured rate interval
     */
    public double getProcessingRate() {
        return processingRate;
    }

    public Instant getLastProcessedTime() {
        return lastProcessedTime;
    }

    public boolean isSourceConnected() {
        return sourceConnected;
    }

    public int getActiveKeys() {
        return activeKeys;
    }

    public WriterStats getWriter() {
        return writer;
    }

    @Override
    public String toString() {
        return "PipelineStats{state=" + state + ", processed=" + totalProcessed + ", errors=" + totalErrors
                + ", rate=" + processingRate + ", writer=" + writer + '}';
    }
}
