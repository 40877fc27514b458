package com.sensorpipeline.core.buffer;

import java.util.Optional;

/**
 * Outcome of one flush: how many records reached storage, and the last
 * storage error if any batch was dropped.
 */
public final class FlushResult {

    private static final FlushResult EMPTY = new FlushResult(0, null);

    private final int writtenCount;
    private final StorageException error;

    FlushResult(int writtenCount, StorageException error) {
        this.writtenCount = writtenCount;
        this.error = error;
    }

    static FlushResult empty() {
        return EMPTY;
    }

    public int getWrittenCount() {
        return writtenCount;
    }

    public Optional<StorageException> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return "FlushResult{written=" + writtenCount + ", error=" + (error == null ? "none" : error.getMessage()) + '}';
    }
}
