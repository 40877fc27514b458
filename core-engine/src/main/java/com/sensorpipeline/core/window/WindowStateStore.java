package com.sensorpipeline.core.window;

import com.sensorpipeline.core.model.WindowKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Concurrent map of {@link WindowKey} to {@link WindowState}.
 *
 * <p>
 * States are created lazily on the first reading of a key and live for the
 * lifetime of the store. Access to a single state is serialised on that
 * state's monitor, so workers handling different keys never contend with
 * each other; there is no store-wide lock.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(WindowStateStore.class);

    private final int capacity;
    private final Duration maxAge;
    private final ConcurrentMap<WindowKey, WindowState> states = new ConcurrentHashMap<>();

    /**
     * @param capacity readings retained per key; must be &gt;= 1
     * @param maxAge   optional age bound per key, or {@code null}
     */
    public WindowStateStore(int capacity, Duration maxAge) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.maxAge = maxAge;
    }

    /**
     * Run {@code action} against the state for {@code key} while holding that
     * key's lock. The state is created if it does not exist yet.
     *
     * @param key    window key; must not be {@code null}
     * @param action operation on the state; must not be {@code null}
     * @param <T>    result type
     * @return the action's result
     */
    public <T> T withState(WindowKey key, Function<WindowState, T> action) {
        Objects.requireNonNull(key, "WindowKey must not be null");
        Objects.requireNonNull(action, "action must not be null");
        WindowState state = states.computeIfAbsent(key, k -> {
            LOG.debug("Creating window state for {}", k);
            return new WindowState(capacity, maxAge);
        });
        synchronized (state) {
            return action.apply(state);
        }
    }

    /**
     * @param key window key
     * @return snapshot of the key's window, or empty if the key was never seen
     */
    public Optional<WindowSnapshot> snapshot(WindowKey key) {
        WindowState state = states.get(key);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(state.snapshot());
        }
    }

    /**
     * Empty the window of one key. The state object itself is retained.
     *
     * @param key window key
     * @return {@code true} if the key was known
     */
    public boolean clear(WindowKey key) {
        WindowState state = states.get(key);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            state.clear();
        }
        LOG.info("Window cleared: {}", key);
        return true;
    }

    /**
     * @return number of keys with a window state
     */
    public int size() {
        return states.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getMaxAge() {
        return maxAge;
    }
}
