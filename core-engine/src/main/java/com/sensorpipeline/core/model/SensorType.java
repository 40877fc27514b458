package com.sensorpipeline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Sensor categories installed on a well, with their nominal operating range.
 *
 * <p>
 * The wire code (e.g. {@code motor_temperature}) is the lowercase name used by
 * producers and by the storage layer. Values outside the nominal range are
 * still accepted; they are only flagged as out of range.
 * </p>
 *
 * @since 1.0.0
 */
public enum SensorType {

    MOTOR_TEMPERATURE("motor_temperature", "C", 65, 120),
    INTAKE_PRESSURE("intake_pressure", "psi", 450, 600),
    DISCHARGE_PRESSURE("discharge_pressure", "psi", 800, 1200),
    VIBRATION("vibration", "g", 0.5, 5.0),
    CURRENT("current", "A", 30, 80),
    FLOW_RATE("flow_rate", "bpd", 1500, 2500);

    private final String code;
    private final String unit;
    private final double nominalMin;
    private final double nominalMax;

    SensorType(String code, String unit, double nominalMin, double nominalMax) {
        this.code = code;
        this.unit = unit;
        this.nominalMin = nominalMin;
        this.nominalMax = nominalMax;
    }

    /**
     * Resolve a sensor type from its wire code. Matching is case-insensitive.
     *
     * @param code wire code such as {@code motor_temperature}
     * @return the matching type, or empty if the code is unknown or {@code null}
     */
    public static Optional<SensorType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT);
        for (SensorType type : values()) {
            if (type.code.equals(normalised)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getUnit() {
        return unit;
    }

    public double getNominalMin() {
        return nominalMin;
    }

    public double getNominalMax() {
        return nominalMax;
    }

    /**
     * @param value a measured value
     * @return {@code true} if the value lies inside the nominal range (inclusive)
     */
    public boolean isWithinNominalRange(double value) {
        return value >= nominalMin && value <= nominalMax;
    }

    @Override
    public String toString() {
        return code;
    }
}
