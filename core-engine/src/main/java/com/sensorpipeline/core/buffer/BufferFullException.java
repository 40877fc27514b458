package com.sensorpipeline.core.buffer;

/**
 * Thrown by {@link BatchWriteBuffer#append} when the buffer stayed at its
 * upper bound for longer than the configured append timeout.
 */
public class BufferFullException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int bufferedRecords;

    public BufferFullException(int bufferedRecords) {
        super("Write buffer full with " + bufferedRecords + " buffered record(s)");
        this.bufferedRecords = bufferedRecords;
    }

    public int getBufferedRecords() {
        return bufferedRecords;
    }
}
