package com.sensorpipeline.core.validation;

import java.util.List;

/**
 * Thrown when a raw reading cannot be turned into a {@link com.sensorpipeline.core.model.Reading}.
 *
 * <p>
 * This is a per-reading, recoverable condition: the pipeline counts it and
 * skips the reading.
 * </p>
 *
 * @since 1.0.0
 */
public class ReadingValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ReadingValidationException(List<String> violations) {
        super("Invalid reading: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ReadingValidationException(String violation) {
        this(List.of(violation));
    }

    /**
     * @return unmodifiable list of violated rules
     */
    public List<String> getViolations() {
        return violations;
    }
}
