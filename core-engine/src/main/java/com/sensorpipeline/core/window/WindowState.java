package com.sensorpipeline.core.window;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bounded, chronologically ordered window of recent readings for one key,
 * with incrementally maintained aggregates.
 *
 * <h3>Implementation</h3>
 * <p>
 * Values and timestamps live in a fixed-size ring. Appending a reading and
 * evicting the oldest one are O(1): the evicted contribution is subtracted
 * from the running sums. The sums are kept relative to a shift value
 * {@code K} (shifted-data variance), which keeps the variance numerically
 * stable when readings are large relative to their spread. After every
 * {@code capacity} evictions the sums are recomputed exactly from the ring
 * contents so rounding error cannot accumulate.
 * </p>
 *
 * <h3>Extremes</h3>
 * <p>
 * {@code min}/{@code max} are updated on insert. When an evicted value equals
 * the current extremum, the window is rescanned.
 * </p>
 *
 * <h3>Late data</h3>
 * <p>
 * A reading older than the newest retained one is inserted at its
 * chronological position. A reading older than the retention horizon (the
 * oldest entry of a full window, or {@code newest - maxAge}) is not inserted.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. {@link WindowStateStore} serialises access per key.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowState {

    private final int capacity;
    private final Duration maxAge;

    private final double[] values;
    private final Instant[] timestamps;
    private int head;
    private int size;

    private double shift;
    private double shiftedSum;
    private double shiftedSumSq;
    private double min;
    private double max;
    private int evictionsSinceRecompute;

    /**
     * @param capacity maximum number of readings retained; must be &gt;= 1
     * @param maxAge   optional maximum age relative to the newest reading, or
     *                 {@code null} for a purely count-based window
     * @throws IllegalArgumentException if {@code capacity < 1} or
     *                                  {@code maxAge} is not positive
     */
    public WindowState(int capacity, Duration maxAge) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        if (maxAge != null && (maxAge.isZero() || maxAge.isNegative())) {
            throw new IllegalArgumentException("maxAge must be positive, got: " + maxAge);
        }
        this.capacity = capacity;
        this.maxAge = maxAge;
        this.values = new double[capacity];
        this.timestamps = new Instant[capacity];
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    /**
     * Insert a reading into the window.
     *
     * <p>
     * The returned {@link WindowInsertion} describes the window as it was
     * <em>before</em> this call (the baseline) and the reading's chronological
     * predecessor.
     * </p>
     *
     * @param timestamp reading timestamp; must not be {@code null}
     * @param value     finite reading value
     * @return description of the insertion
     */
    public WindowInsertion insert(Instant timestamp, double value) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");

        int baselineCount = size;
        double baselineMean = size > 0 ? mean() : Double.NaN;
        double baselineStd = size > 0 ? populationStd() : Double.NaN;

        boolean late = size > 0 && timestamp.isBefore(newestTimestamp());
        if (late && isBeyondHorizon(timestamp)) {
            return WindowInsertion.discarded(baselineCount, baselineMean, baselineStd);
        }

        int position = late ? insertionPoint(timestamp) : size;
        Double previousValue = null;
        Instant previousTimestamp = null;
        if (position > 0) {
            previousValue = valueAt(position - 1);
            previousTimestamp = timestampAt(position - 1);
        }

        boolean rescan = false;
        if (size == capacity) {
            rescan = evictOldest();
            position--;
        }
        insertAt(Math.max(position, 0), timestamp, value);

        if (maxAge != null) {
            Instant horizon = newestTimestamp().minus(maxAge);
            while (size > 1 && timestampAt(0).isBefore(horizon)) {
                rescan |= evictOldest();
            }
        }
        if (rescan) {
            rescanExtremes();
        }
        if (evictionsSinceRecompute >= capacity) {
            recomputeAggregates();
        }

        return WindowInsertion.inserted(late, baselineCount, baselineMean, baselineStd,
                previousValue, previousTimestamp);
    }

    /**
     * Remove every reading and reset the aggregates.
     */
    public void clear() {
        for (int i = 0; i < capacity; i++) {
            timestamps[i] = null;
        }
        head = 0;
        size = 0;
        shift = 0;
        shiftedSum = 0;
        shiftedSumSq = 0;
        min = 0;
        max = 0;
        evictionsSinceRecompute = 0;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return arithmetic mean of the window, or {@code NaN} when empty
     */
    public double mean() {
        return size == 0 ? Double.NaN : shift + shiftedSum / size;
    }

    /**
     * @return population standard deviation, or {@code NaN} when empty
     */
    public double populationStd() {
        if (size == 0) {
            return Double.NaN;
        }
        double variance = (shiftedSumSq - (shiftedSum * shiftedSum) / size) / size;
        return Math.sqrt(Math.max(variance, 0.0));
    }

    public double min() {
        return size == 0 ? Double.NaN : min;
    }

    public double max() {
        return size == 0 ? Double.NaN : max;
    }

    /**
     * Capture an immutable copy of the current contents and aggregates.
     *
     * @return snapshot in chronological order
     */
    public WindowSnapshot snapshot() {
        double[] copyValues = new double[size];
        Instant[] copyTimestamps = new Instant[size];
        for (int i = 0; i < size; i++) {
            copyValues[i] = valueAt(i);
            copyTimestamps[i] = timestampAt(i);
        }
        return new WindowSnapshot(copyValues, copyTimestamps, mean(), populationStd(), min(), max());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean isBeyondHorizon(Instant timestamp) {
        if (size == capacity && timestamp.isBefore(timestampAt(0))) {
            return true;
        }
        return maxAge != null && timestamp.isBefore(newestTimestamp().minus(maxAge));
    }

    /** Logical index after the last entry whose timestamp is not after {@code timestamp}. */
    private int insertionPoint(Instant timestamp) {
        int i = size;
        while (i > 0 && timestampAt(i - 1).isAfter(timestamp)) {
            i--;
        }
        return i;
    }

    private void insertAt(int position, Instant timestamp, double value) {
        for (int i = size; i > position; i--) {
            int to = physical(i);
            int from = physical(i - 1);
            values[to] = values[from];
            timestamps[to] = timestamps[from];
        }
        int slot = physical(position);
        values[slot] = value;
        timestamps[slot] = timestamp;
        size++;

        if (size == 1) {
            shift = value;
            shiftedSum = 0;
            shiftedSumSq = 0;
            min = value;
            max = value;
        } else {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double d = value - shift;
        shiftedSum += d;
        shiftedSumSq += d * d;
    }

    /** @return {@code true} if the evicted value was an extremum and a rescan is needed */
    private boolean evictOldest() {
        double evicted = values[head];
        timestamps[head] = null;
        head = (head + 1) % capacity;
        size--;
        evictionsSinceRecompute++;

        double d = evicted - shift;
        shiftedSum -= d;
        shiftedSumSq -= d * d;
        return size > 0 && (evicted == min || evicted == max);
    }

    private void rescanExtremes() {
        if (size == 0) {
            return;
        }
        double lo = valueAt(0);
        double hi = lo;
        for (int i = 1; i < size; i++) {
            double v = valueAt(i);
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        min = lo;
        max = hi;
    }

    private void recomputeAggregates() {
        evictionsSinceRecompute = 0;
        if (size == 0) {
            shiftedSum = 0;
            shiftedSumSq = 0;
            return;
        }
        double total = 0;
        for (int i = 0; i < size; i++) {
            total += valueAt(i);
        }
        shift = total / size;
        double s = 0;
        double sq = 0;
        for (int i = 0; i < size; i++) {
            double d = valueAt(i) - shift;
            s += d;
            sq += d * d;
        }
        shiftedSum = s;
        shiftedSumSq = sq;
        rescanExtremes();
    }

    private Instant newestTimestamp() {
        return timestampAt(size - 1);
    }

    private double valueAt(int logicalIndex) {
        return values[physical(logicalIndex)];
    }

    private Instant timestampAt(int logicalIndex) {
        return timestamps[physical(logicalIndex)];
    }

    private int physical(int logicalIndex) {
        return (head + logicalIndex) % capacity;
    }
}
