package com.sensorpipeline.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One validated sensor observation.
 *
 * <p>
 * Instances are immutable and produced by
 * {@link com.sensorpipeline.core.validation.ReadingValidator} from a
 * {@link RawReading}. A reading is consumed exactly once by the statistics
 * engine and is not retained beyond the feature vector it yields.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code wellId}, {@code sensorType} and
 * {@code timestamp} are required; the value must be finite.
 * </p>
 *
 * @since 1.0.0
 */
public final class Reading implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String wellId;
    private final SensorType sensorType;
    private final double value;
    private final String unit;
    private final Integer quality;
    private final Instant timestamp;
    private final boolean outOfRange;

    private Reading(Builder builder) {
        this.wellId = Objects.requireNonNull(builder.wellId, "wellId must not be null");
        this.sensorType = Objects.requireNonNull(builder.sensorType, "sensorType must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        if (!Double.isFinite(builder.value)) {
            throw new IllegalArgumentException("value must be finite, got: " + builder.value);
        }
        this.value = builder.value;
        this.unit = builder.unit;
        this.quality = builder.quality;
        this.outOfRange = builder.outOfRange;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Reading} instances.
     */
    public static class Builder {
        private String wellId;
        private SensorType sensorType;
        private double value;
        private String unit;
        private Integer quality;
        private Instant timestamp;
        private boolean outOfRange;

        public Builder wellId(String wellId) {
            this.wellId = wellId;
            return this;
        }

        public Builder sensorType(SensorType sensorType) {
            this.sensorType = sensorType;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder quality(Integer quality) {
            this.quality = quality;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder outOfRange(boolean outOfRange) {
            this.outOfRange = outOfRange;
            return this;
        }

        /**
         * @return a new {@link Reading}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if the value is not finite
         */
        public Reading build() {
            return new Reading(this);
        }
    }

    public WindowKey key() {
        return WindowKey.of(wellId, sensorType);
    }

    public String getWellId() {
        return wellId;
    }

    public SensorType getSensorType() {
        return sensorType;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return measurement unit, or {@code null} if unknown
     */
    public String getUnit() {
        return unit;
    }

    /**
     * @return data quality score in [0, 100], or {@code null} if unknown
     */
    public Integer getQuality() {
        return quality;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return {@code true} if the value lies outside the sensor's nominal range
     */
    public boolean isOutOfRange() {
        return outOfRange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Reading that))
            return false;
        return Double.compare(value, that.value) == 0
                && wellId.equals(that.wellId)
                && sensorType == that.sensorType
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(wellId, sensorType, value, timestamp);
    }

    @Override
    public String toString() {
        return "Reading{" +
                "wellId='" + wellId + '\'' +
                ", sensorType=" + sensorType +
                ", value=" + value +
                ", unit='" + unit + '\'' +
                ", quality=" + quality +
                ", timestamp=" + timestamp +
                '}';
    }
}
