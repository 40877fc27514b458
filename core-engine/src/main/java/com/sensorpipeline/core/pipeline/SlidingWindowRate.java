package com.sensorpipeline.core.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.atomic.LongAdder;

/**
 * Events-per-second over a trailing interval, kept in one-second buckets.
 * Recording does not lock: each worker adds to the current bucket, and the
 * first writer of a new second swaps in a fresh one.
 */
final class SlidingWindowRate {

    private final Clock clock;
    private final int seconds;
    private final AtomicReferenceArray<Bucket> buckets;

    SlidingWindowRate(Duration interval, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.seconds = (int) Math.max(1, interval.toSeconds());
        this.buckets = new AtomicReferenceArray<>(seconds);
    }

    void record(long events) {
        long now = clock.millis() / 1000;
        int idx = (int) Math.floorMod(now, (long) seconds);
        while (true) {
            Bucket bucket = buckets.get(idx);
            if (bucket != null && bucket.second == now) {
                bucket.count.add(events);
                return;
            }
            if (buckets.compareAndSet(idx, bucket, new Bucket(now, events))) {
                return;
            }
        }
    }

    /**
     * @return average events per second over the trailing interval
     */
    double ratePerSecond() {
        long now = clock.millis() / 1000;
        long total = 0;
        for (int i = 0; i < seconds; i++) {
            Bucket bucket = buckets.get(i);
            if (bucket != null && bucket.second > now - seconds && bucket.second <= now) {
                total += bucket.count.sum();
            }
        }
        return (double) total / seconds;
    }

    private static final class Bucket {

        private final long second;
        private final LongAdder count = new LongAdder();

        private Bucket(long second, long initial) {
            this.second = second;
            this.count.add(initial);
        }
    }
}
