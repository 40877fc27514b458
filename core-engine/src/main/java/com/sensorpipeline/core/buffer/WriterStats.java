package com.sensorpipeline.core.buffer;

import java.time.Instant;

/**
 * Point-in-time counters of a {@link BatchWriteBuffer}.
 *
 * @since 1.0.0
 */
public final class WriterStats {

    private final long totalWritten;
    private final long totalErrors;
    private final int bufferSize;
    private final Instant lastWriteTime;
    private final long droppedBatches;
    private final long droppedRecords;
    private final long flushCount;

    WriterStats(long totalWritten, long totalErrors, int bufferSize, Instant lastWriteTime,
            long droppedBatches, long droppedRecords, long flushCount) {
        this.totalWritten = totalWritten;
        this.totalErrors = totalErrors;
        this.bufferSize = bufferSize;
        this.lastWriteTime = lastWriteTime;
        this.droppedBatches = droppedBatches;
        this.droppedRecords = droppedRecords;
        this.flushCount = flushCount;
    }

    public long getTotalWritten() {
        return totalWritten;
    }

    /**
     * @return records that exhausted their retries and were dropped
     */
    public long getTotalErrors() {
        return totalErrors;
    }

    /**
     * @return records waiting for a flush, including a batch currently being
     *         written or retried
     */
    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * @return time of the last successful bulk insert, or {@code null}
     */
    public Instant getLastWriteTime() {
        return lastWriteTime;
    }

    public long getDroppedBatches() {
        return droppedBatches;
    }

    /**
     * @return records lost, either in dropped batches or discarded at shutdown
     */
    public long getDroppedRecords() {
        return droppedRecords;
    }

    /**
     * @return successful bulk inserts
     */
    public long getFlushCount() {
        return flushCount;
    }

    @Override
    public String toString() {
        return "WriterStats{written=" + totalWritten + ", errors=" + totalErrors
                + ", buffered=" + bufferSize + ", lastWrite=" + lastWriteTime + '}';
    }
}
