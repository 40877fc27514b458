package com.sensorpipeline.core.pipeline;

/**
 * Creates one {@link ReadingSource} per pipeline worker.
 */
@FunctionalInterface
public interface ReadingSourceFactory {

    /**
     * @param workerIndex zero-based index of the worker that will own the
     *                    source
     */
    ReadingSource open(int workerIndex);
}
