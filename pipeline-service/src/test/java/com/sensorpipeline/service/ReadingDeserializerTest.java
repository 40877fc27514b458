package com.sensorpipeline.service;

import com.sensorpipeline.core.model.RawReading;
import com.sensorpipeline.core.model.Reading;
import com.sensorpipeline.core.validation.ReadingValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ReadingDeserializer}.
 */
class ReadingDeserializerTest {

    private final ReadingDeserializer deserializer = new ReadingDeserializer();

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should decode a snake_case reading")
    void shouldDecodeReading() throws IOException {
        RawReading reading = deserializer.deserialize(bytes("{"
                + "\"well_id\":\"Well_01\","
                + "\"sensor_type\":\"motor_temperature\","
                + "\"sensor_value\":85.5,"
                + "\"measurement_unit\":\"C\","
                + "\"data_quality\":95,"
                + "\"timestamp\":\"2024-01-15T10:00:00Z\","
                + "\"gateway\":\"gw-7\"}"));

        assertThat(reading.getWellId()).isEqualTo("Well_01");
        assertThat(reading.getSensorType()).isEqualTo("motor_temperature");
        assertThat(reading.getSensorValue()).isEqualTo(85.5);
        assertThat(reading.getMeasurementUnit()).isEqualTo("C");
        assertThat(reading.getDataQuality()).isEqualTo(95);
        assertThat(reading.getTimestamp()).isEqualTo("2024-01-15T10:00:00Z");
    }

    @Test
    @DisplayName("Offset-less producer timestamps decode and validate as UTC")
    void shouldAcceptLocalTimestamp() throws Exception {
        RawReading reading = deserializer.deserialize(bytes("{"
                + "\"well_id\":\"Well_01\","
                + "\"sensor_type\":\"motor_temperature\","
                + "\"sensor_value\":85.5,"
                + "\"timestamp\":\"2024-01-15T10:30:00.123456\"}"));

        Reading validated = new ReadingValidator().validate(reading);

        assertThat(validated.getTimestamp()).isEqualTo(Instant.parse("2024-01-15T10:30:00.123456Z"));
    }

    @Test
    @DisplayName("Envelope timestamp fills in a missing reading timestamp")
    void shouldDecodeMetadataTimestamp() throws Exception {
        RawReading reading = deserializer.deserialize(bytes("{"
                + "\"well_id\":\"Well_01\","
                + "\"sensor_type\":\"vibration\","
                + "\"sensor_value\":2.1,"
                + "\"_metadata\":{\"timestamp\":\"2024-01-15T10:30:00\",\"source\":\"mqtt\"}}"));

        assertThat(reading.getTimestamp()).isNull();
        assertThat(reading.resolveTimestamp()).isEqualTo("2024-01-15T10:30:00");
        assertThat(new ReadingValidator().validate(reading).getTimestamp())
                .isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @Test
    @DisplayName("Missing fields stay null for the validator to report")
    void shouldLeaveMissingFieldsNull() throws IOException {
        RawReading reading = deserializer.deserialize(bytes("{\"well_id\":\"Well_01\"}"));

        assertThat(reading.getSensorType()).isNull();
        assertThat(reading.getSensorValue()).isNull();
        assertThat(reading.getTimestamp()).isNull();
    }

    @Test
    @DisplayName("Should reject empty, null and malformed payloads")
    void shouldRejectNonObjects() {
        assertThatThrownBy(() -> deserializer.deserialize(new byte[0]))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> deserializer.deserialize(null))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> deserializer.deserialize(bytes("null")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("null");
        assertThatThrownBy(() -> deserializer.deserialize(bytes("{\"well_id\":")))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> deserializer.deserialize(bytes("[1, 2, 3]")))
                .isInstanceOf(IOException.class);
    }
}
