/**
 * Batched, retrying writes of feature vectors to storage.
 *
 * <p>
 * {@link com.sensorpipeline.core.buffer.BatchWriteBuffer} is the only
 * mutable state shared by all pipeline workers. Storage back ends plug in
 * through {@link com.sensorpipeline.core.buffer.StorageWriter}.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorpipeline.core.buffer;
