package com.sensorpipeline.core.stats;

import com.sensorpipeline.core.model.RawReading;
import com.sensorpipeline.core.model.Reading;
import com.sensorpipeline.core.model.WindowKey;
import com.sensorpipeline.core.validation.ReadingValidationException;
import com.sensorpipeline.core.validation.ReadingValidator;
import com.sensorpipeline.core.window.WindowInsertion;
import com.sensorpipeline.core.window.WindowSnapshot;
import com.sensorpipeline.core.window.WindowStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Consumes readings one at a time, updates the window of the reading's key
 * and derives point-in-time metrics.
 *
 * <h3>Anomaly flag</h3>
 * <p>
 * A reading is flagged when {@code |z| > anomalyThreshold}; a z-score exactly
 * at the threshold is not an anomaly. The z-score is measured against the
 * window before insertion and is undefined (and the flag {@code false}) when
 * that baseline holds fewer than two readings or has zero variance.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Per-key serialisation is provided by the
 * {@link WindowStateStore}.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamStatisticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StreamStatisticsEngine.class);

    /** Minimum number of readings for window statistics to be defined. */
    static final int MIN_STATISTICS_SIZE = 2;

    private final WindowStateStore store;
    private final ReadingValidator validator;
    private final double anomalyThreshold;

    /**
     * @param store            per-key window store; must not be {@code null}
     * @param anomalyThreshold z-score magnitude above which a reading is an
     *                         anomaly; must be &gt; 0
     */
    public StreamStatisticsEngine(WindowStateStore store, double anomalyThreshold) {
        this(store, new ReadingValidator(), anomalyThreshold);
    }

    public StreamStatisticsEngine(WindowStateStore store, ReadingValidator validator,
            double anomalyThreshold) {
        this.store = Objects.requireNonNull(store, "WindowStateStore must not be null");
        this.validator = Objects.requireNonNull(validator, "ReadingValidator must not be null");
        if (!(anomalyThreshold > 0)) {
            throw new IllegalArgumentException(
                    "anomalyThreshold must be > 0, got: " + anomalyThreshold);
        }
        this.anomalyThreshold = anomalyThreshold;
    }

    /**
     * Validate a raw reading and process it.
     *
     * @param raw the raw reading
     * @return statistics for the reading
     * @throws ReadingValidationException if the reading is malformed
     */
    public StatisticsResult process(RawReading raw) throws ReadingValidationException {
        return process(validator.validate(raw));
    }

    /**
     * Insert a reading into its window and compute its metrics.
     *
     * @param reading a validated reading; must not be {@code null}
     * @return statistics for the reading
     */
    public StatisticsResult process(Reading reading) {
        Objects.requireNonNull(reading, "Reading must not be null");
        WindowKey key = reading.key();

        StatisticsResult result = store.withState(key, state -> {
            WindowInsertion insertion = state.insert(reading.getTimestamp(), reading.getValue());
            WindowSnapshot snapshot = state.snapshot();
            StatFeatures features = computeFeatures(reading, insertion, snapshot);
            return new StatisticsResult(reading, snapshot, features,
                    insertion.isLate(), insertion.isInserted());
        });

        if (!result.isInWindow()) {
            LOG.debug("Late reading for {} at {} is beyond the retention horizon; window unchanged",
                    key, reading.getTimestamp());
        }
        if (result.getFeatures().isAnomaly()) {
            LOG.debug("Anomaly for {}: value={} z={} threshold={}",
                    key, reading.getValue(), result.getFeatures().getZScore(), anomalyThreshold);
        }
        return result;
    }

    /**
     * @param key window key
     * @return summary of the key's current window, or empty if unknown or empty
     */
    public Optional<WindowStats> windowStats(WindowKey key) {
        return store.snapshot(key)
                .filter(s -> s.count() > 0)
                .map(s -> new WindowStats(s.count(), s.mean(), s.std(), s.min(), s.max()));
    }

    /**
     * Empty the window of one key.
     *
     * @param key window key
     * @return {@code true} if the key was known
     */
    public boolean clearWindow(WindowKey key) {
        return store.clear(key);
    }

    /**
     * @return number of keys with window state
     */
    public int activeKeys() {
        return store.size();
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    // ---------------------------------------------------------------
    // Metric derivation
    // ---------------------------------------------------------------

    private StatFeatures computeFeatures(Reading reading, WindowInsertion insertion,
            WindowSnapshot window) {
        double value = reading.getValue();
        StatFeatures.Builder b = StatFeatures.builder().windowCount(window.count());

        if (window.count() >= MIN_STATISTICS_SIZE) {
            b.mean(window.mean())
                    .median(Descriptive.median(window.sortedValues()))
                    .std(window.std())
                    .min(window.min())
                    .max(window.max())
                    .range(window.max() - window.min());
        }

        Double changeFromMean = null;
        if (insertion.getBaselineCount() >= 1) {
            double baselineMean = insertion.getBaselineMean();
            changeFromMean = value - baselineMean;
            b.changeFromMean(changeFromMean);
            if (baselineMean != 0) {
                b.changePercent(changeFromMean / baselineMean * 100.0);
            }
        }

        if (insertion.getPreviousValue() != null) {
            Duration elapsed = Duration.between(insertion.getPreviousTimestamp(), reading.getTimestamp());
            double seconds = elapsed.getSeconds() + elapsed.getNano() / 1_000_000_000.0;
            if (seconds > 0) {
                b.rateOfChange((value - insertion.getPreviousValue()) / seconds);
            }
        }

        if (changeFromMean != null
                && insertion.getBaselineCount() >= MIN_STATISTICS_SIZE
                && insertion.getBaselineStd() > 0) {
            double z = changeFromMean / insertion.getBaselineStd();
            b.zScore(z).anomaly(Math.abs(z) > anomalyThreshold);
        }

        return b.build();
    }
}
