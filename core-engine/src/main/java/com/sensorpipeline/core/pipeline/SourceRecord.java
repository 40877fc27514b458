package com.sensorpipeline.core.pipeline;

import com.sensorpipeline.core.model.RawReading;

import java.util.Objects;

/**
 * One message pulled from a {@link ReadingSource}: either a decoded
 * {@link RawReading} or the reason it could not be decoded, plus the position
 * used to acknowledge it.
 */
public final class SourceRecord {

    private final String topic;
    private final int partition;
    private final long offset;
    private final RawReading reading;
    private final String decodeError;

    private SourceRecord(String topic, int partition, long offset, RawReading reading, String decodeError) {
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.partition = partition;
        this.offset = offset;
        this.reading = reading;
        this.decodeError = decodeError;
    }

    public static SourceRecord of(String topic, int partition, long offset, RawReading reading) {
        return new SourceRecord(topic, partition, offset,
                Objects.requireNonNull(reading, "reading must not be null"), null);
    }

    public static SourceRecord undecodable(String topic, int partition, long offset, String error) {
        return new SourceRecord(topic, partition, offset, null,
                Objects.requireNonNull(error, "error must not be null"));
    }

    public String getTopic() {
        return topic;
    }

    public int getPartition() {
        return partition;
    }

    public long getOffset() {
        return offset;
    }

    /**
     * @return the decoded reading, or {@code null} when {@link #isDecoded()}
     *         is {@code false}
     */
    public RawReading getReading() {
        return reading;
    }

    public String getDecodeError() {
        return decodeError;
    }

    public boolean isDecoded() {
        return reading != null;
    }

    @Override
    public String toString() {
        return topic + "-" + partition + "@" + offset;
    }
}
