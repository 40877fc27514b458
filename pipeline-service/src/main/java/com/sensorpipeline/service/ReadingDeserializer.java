package com.sensorpipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorpipeline.core.model.RawReading;

import java.io.IOException;

/**
 * Converts raw message bytes into a {@link RawReading}.
 * <p>
 * Field-level checks are left to the validator; this class only rejects
 * payloads that are not a JSON object.
 * </p>
 */
public class ReadingDeserializer {

    private final ObjectMapper mapper;

    public ReadingDeserializer() {
        this(JsonSupport.newObjectMapper());
    }

    ReadingDeserializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param message JSON payload
     * @return the decoded reading, never {@code null}
     * @throws IOException if the payload is empty or not a JSON object
     */
    public RawReading deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            throw new IOException("empty message");
        }
        RawReading reading = mapper.readValue(message, RawReading.class);
        if (reading == null) {
            throw new IOException("message is JSON null");
        }
        return reading;
    }
}
