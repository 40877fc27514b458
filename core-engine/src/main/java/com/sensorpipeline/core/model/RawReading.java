package com.sensorpipeline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Untrusted reading as it arrives on the wire.
 *
 * <p>
 * Every field is optional at this stage; nothing is checked until the
 * reading passes through
 * {@link com.sensorpipeline.core.validation.ReadingValidator}. The JSON
 * property names follow the producers' snake_case format:
 * </p>
 *
 * <pre>
 * {"well_id":"Well_01","sensor_type":"motor_temperature","sensor_value":78.4,
 *  "measurement_unit":"C","data_quality":98,"timestamp":"2024-03-01T10:15:00Z"}
 * </pre>
 *
 * <p>
 * Some producers only stamp the envelope ({@code "_metadata":{"timestamp":...}});
 * {@link #resolveTimestamp()} falls back to that value.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. An instance belongs to the worker that decoded it.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawReading implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("well_id")
    private String wellId;

    @JsonProperty("sensor_type")
    private String sensorType;

    @JsonProperty("sensor_value")
    private Double sensorValue;

    @JsonProperty("measurement_unit")
    private String measurementUnit;

    @JsonProperty("data_quality")
    private Integer dataQuality;

    /** ISO-8601 date-time, e.g. {@code 2024-03-01T10:15:00Z}; UTC when the offset is omitted. */
    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("_metadata")
    private Metadata metadata;

    /** No-arg constructor required by Jackson. */
    public RawReading() {
    }

    public RawReading(String wellId, String sensorType, Double sensorValue, String timestamp) {
        this.wellId = wellId;
        this.sensorType = sensorType;
        this.sensorValue = sensorValue;
        this.timestamp = timestamp;
    }

    public String getWellId() {
        return wellId;
    }

    public void setWellId(String wellId) {
        this.wellId = wellId;
    }

    public String getSensorType() {
        return sensorType;
    }

    public void setSensorType(String sensorType) {
        this.sensorType = sensorType;
    }

    public Double getSensorValue() {
        return sensorValue;
    }

    public void setSensorValue(Double sensorValue) {
        this.sensorValue = sensorValue;
    }

    public String getMeasurementUnit() {
        return measurementUnit;
    }

    public void setMeasurementUnit(String measurementUnit) {
        this.measurementUnit = measurementUnit;
    }

    public Integer getDataQuality() {
        return dataQuality;
    }

    public void setDataQuality(Integer dataQuality) {
        this.dataQuality = dataQuality;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public void setMetadata(Metadata metadata) {
        this.metadata = metadata;
    }

    /**
     * @return {@code timestamp} when present, otherwise the envelope
     *         timestamp, or {@code null} when neither is set
     */
    public String resolveTimestamp() {
        if (timestamp != null && !timestamp.isBlank()) {
            return timestamp;
        }
        return metadata != null ? metadata.getTimestamp() : null;
    }

    @Override
    public String toString() {
        return "RawReading{" +
                "wellId='" + wellId + '\'' +
                ", sensorType='" + sensorType + '\'' +
                ", sensorValue=" + sensorValue +
                ", measurementUnit='" + measurementUnit + '\'' +
                ", dataQuality=" + dataQuality +
                ", timestamp='" + timestamp + '\'' +
                (metadata != null ? ", metadata.timestamp='" + metadata.getTimestamp() + '\'' : "") +
                '}';
    }

    /**
     * Producer envelope. Only the timestamp is read.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata implements Serializable {

        private static final long serialVersionUID = 1L;

        @JsonProperty("timestamp")
        private String timestamp;

        public Metadata() {
        }

        public Metadata(String timestamp) {
            this.timestamp = timestamp;
        }

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }
    }
}
