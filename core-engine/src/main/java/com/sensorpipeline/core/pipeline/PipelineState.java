package com.sensorpipeline.core.pipeline;

/**
 * Lifecycle of a {@link PipelineOrchestrator}:
 * {@code STOPPED -> RUNNING <-> PAUSED -> STOPPED}.
 */
public enum PipelineState {
    STOPPED,
    RUNNING,
    PAUSED
}
