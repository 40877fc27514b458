package com.sensorpipeline.core.stats;

import com.sensorpipeline.core.model.Reading;
import com.sensorpipeline.core.window.WindowSnapshot;

import java.util.Objects;

/**
 * Result of {@link StreamStatisticsEngine#process(Reading)}: the window as it
 * stands after the reading, the derived metrics, and how the reading was
 * placed in the window.
 *
 * @since 1.0.0
 */
public final class StatisticsResult {

    private final Reading reading;
    private final WindowSnapshot window;
    private final StatFeatures features;
    private final boolean late;
    private final boolean inWindow;

    StatisticsResult(Reading reading, WindowSnapshot window, StatFeatures features,
            boolean late, boolean inWindow) {
        this.reading = Objects.requireNonNull(reading, "reading must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.features = Objects.requireNonNull(features, "features must not be null");
        this.late = late;
        this.inWindow = inWindow;
    }

    public Reading getReading() {
        return reading;
    }

    public WindowSnapshot getWindow() {
        return window;
    }

    public StatFeatures getFeatures() {
        return features;
    }

    /**
     * @return {@code true} if the reading arrived after a newer reading of the same key
     */
    public boolean isLate() {
        return late;
    }

    /**
     * @return {@code false} if the reading was beyond the retention horizon
     *         and excluded from the window aggregates
     */
    public boolean isInWindow() {
        return inWindow;
    }
}
