package com.sensorpipeline.core.buffer;

import com.sensorpipeline.core.model.FeatureVector;

import java.util.List;

/**
 * Destination of flushed feature vectors.
 * <p>
 * A bulk insert is all-or-nothing: on failure the implementation must leave
 * storage as if the call never happened, so the whole batch can be retried.
 * Implementations should upsert on {@code (well_id, sensor_type, timestamp)}
 * since at-least-once delivery can hand them the same record twice.
 * </p>
 */
public interface StorageWriter {

    /**
     * Persist a batch of feature vectors atomically.
     *
     * @param records non-empty batch
     * @throws StorageException if the batch could not be written
     */
    void bulkInsert(List<FeatureVector> records) throws StorageException;
}
