package com.sensorpipeline.core.pipeline;

import java.time.Duration;
import java.util.List;

/**
 * Pull-based adapter over the upstream message stream.
 * <p>
 * Each pipeline worker owns one source; implementations need not be
 * thread-safe. Records must be delivered in partition order, and a record is
 * acknowledged only once the pipeline has buffered (or rejected) it, which
 * gives at-least-once delivery to storage.
 * </p>
 * <p>
 * Reconnection is the source's own concern: {@link #poll} keeps trying and
 * {@link #isConnected()} reports the outcome of the latest attempt.
 * </p>
 */
public interface ReadingSource extends AutoCloseable {

    void subscribe(String topic);

    /**
     * Fetch the next records, waiting up to {@code timeout}.
     *
     * @return records in delivery order; empty when none arrived in time
     * @throws InterruptedException if the calling worker was interrupted
     */
    List<SourceRecord> poll(Duration timeout) throws InterruptedException;

    /**
     * Mark a record as fully processed.
     */
    void ack(SourceRecord record);

    /**
     * Stop delivering records without leaving the upstream subscription.
     * Until {@link #resume()}, {@link #poll} returns no records but keeps the
     * connection alive and still commits acknowledged positions.
     */
    void pause();

    void resume();

    boolean isConnected();

    /**
     * Release the subscription. Acknowledged positions should be committed
     * before the underlying connection is closed.
     */
    @Override
    void close();
}
