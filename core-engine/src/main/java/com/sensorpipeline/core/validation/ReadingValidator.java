package com.sensorpipeline.core.validation;

import com.sensorpipeline.core.model.RawReading;
import com.sensorpipeline.core.model.Reading;
import com.sensorpipeline.core.model.SensorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates and normalises {@link RawReading}s.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>{@code well_id} present and matching {@code [A-Za-z0-9_-]+}</li>
 * <li>{@code sensor_type} present and a known {@link SensorType}</li>
 * <li>{@code sensor_value} present and finite</li>
 * <li>{@code timestamp} (or {@code _metadata.timestamp}) present and
 * ISO-8601; without an offset it is read as UTC</li>
 * <li>{@code data_quality}, when present, within [0, 100]</li>
 * </ul>
 *
 * <p>
 * All violations are collected and reported together. Values outside the
 * sensor's nominal range are accepted and flagged. A missing unit defaults
 * to the sensor's nominal unit; a missing quality score is derived from the
 * flags of the reading.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReadingValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ReadingValidator.class);

    private static final Pattern WELL_ID = Pattern.compile("^[A-Za-z0-9_-]+$");

    static final int OUT_OF_RANGE_PENALTY = 20;
    static final int MISSING_UNIT_PENALTY = 5;

    /**
     * Validate a raw reading.
     *
     * @param raw the raw reading; must not be {@code null}
     * @return the validated reading
     * @throws ReadingValidationException if one or more rules are violated
     */
    public Reading validate(RawReading raw) throws ReadingValidationException {
        Objects.requireNonNull(raw, "RawReading must not be null");
        List<String> errors = new ArrayList<>();

        String wellId = raw.getWellId();
        if (wellId == null || wellId.isBlank()) {
            errors.add("Missing required field: well_id");
        } else if (!WELL_ID.matcher(wellId).matches()) {
            errors.add("Invalid well_id format: '" + wellId + "'");
        }

        SensorType sensorType = null;
        if (raw.getSensorType() == null || raw.getSensorType().isBlank()) {
            errors.add("Missing required field: sensor_type");
        } else {
            Optional<SensorType> resolved = SensorType.fromCode(raw.getSensorType());
            if (resolved.isEmpty()) {
                errors.add("Unknown sensor_type: '" + raw.getSensorType() + "'");
            } else {
                sensorType = resolved.get();
            }
        }

        Double value = raw.getSensorValue();
        if (value == null) {
            errors.add("Missing required field: sensor_value");
        } else if (!Double.isFinite(value)) {
            errors.add("sensor_value must be finite, got: " + value);
        }

        Instant timestamp = null;
        String rawTimestamp = raw.resolveTimestamp();
        if (rawTimestamp == null || rawTimestamp.isBlank()) {
            errors.add("Missing required field: timestamp");
        } else {
            try {
                timestamp = parseTimestamp(rawTimestamp.trim());
            } catch (DateTimeParseException e) {
                errors.add("Invalid timestamp format: '" + rawTimestamp + "'");
            }
        }

        Integer quality = raw.getDataQuality();
        if (quality != null && (quality < 0 || quality > 100)) {
            errors.add("data_quality must be in [0, 100], got: " + quality);
        }

        if (!errors.isEmpty()) {
            throw new ReadingValidationException(errors);
        }

        boolean outOfRange = !sensorType.isWithinNominalRange(value);
        if (outOfRange) {
            LOG.debug("Reading out of nominal range: well={} sensor={} value={} range=[{}, {}]",
                    wellId, sensorType, value, sensorType.getNominalMin(), sensorType.getNominalMax());
        }

        boolean unitMissing = raw.getMeasurementUnit() == null || raw.getMeasurementUnit().isBlank();
        String unit = unitMissing ? sensorType.getUnit() : raw.getMeasurementUnit();
        if (quality == null) {
            quality = qualityScore(outOfRange, unitMissing);
        }

        return Reading.builder()
                .wellId(wellId)
                .sensorType(sensorType)
                .value(value)
                .unit(unit)
                .quality(quality)
                .timestamp(timestamp)
                .outOfRange(outOfRange)
                .build();
    }

    /**
     * ISO-8601 date-time with or without an offset; a local date-time is
     * taken as UTC.
     */
    static Instant parseTimestamp(String text) {
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
                OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    static int qualityScore(boolean outOfRange, boolean unitMissing) {
        int score = 100;
        if (outOfRange) {
            score -= OUT_OF_RANGE_PENALTY;
        }
        if (unitMissing) {
            score -= MISSING_UNIT_PENALTY;
        }
        return Math.max(0, Math.min(100, score));
    }
}
