package com.sensorpipeline.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite identity (well, sensor type) that partitions all per-stream state.
 *
 * @since 1.0.0
 */
public final class WindowKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String wellId;
    private final SensorType sensorType;

    private WindowKey(String wellId, SensorType sensorType) {
        this.wellId = Objects.requireNonNull(wellId, "wellId must not be null");
        this.sensorType = Objects.requireNonNull(sensorType, "sensorType must not be null");
    }

    public static WindowKey of(String wellId, SensorType sensorType) {
        return new WindowKey(wellId, sensorType);
    }

    public String getWellId() {
        return wellId;
    }

    public SensorType getSensorType() {
        return sensorType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowKey that))
            return false;
        return wellId.equals(that.wellId) && sensorType == that.sensorType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(wellId, sensorType);
    }

    @Override
    public String toString() {
        return wellId + "/" + sensorType.getCode();
    }
}
