package com.sensorpipeline.core.pipeline;

import com.sensorpipeline.core.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SlidingWindowRateTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
    private final SlidingWindowRate rate = new SlidingWindowRate(Duration.ofSeconds(10), clock);

    @Test
    void averagesOverTheTrailingInterval() {
        rate.record(30);
        clock.advance(Duration.ofSeconds(1));
        rate.record(20);

        assertThat(rate.ratePerSecond()).isEqualTo(5.0);
    }

    @Test
    void forgetsEventsOlderThanTheInterval() {
        rate.record(100);
        clock.advance(Duration.ofSeconds(9));
        rate.record(10);
        assertThat(rate.ratePerSecond()).isEqualTo(11.0);

        clock.advance(Duration.ofSeconds(1));
        assertThat(rate.ratePerSecond()).isEqualTo(1.0);

        clock.advance(Duration.ofMinutes(5));
        assertThat(rate.ratePerSecond()).isZero();
    }

    @Test
    void reusesBucketsAfterWrapAround() {
        rate.record(50);
        clock.advance(Duration.ofSeconds(10));
        rate.record(5);

        assertThat(rate.ratePerSecond()).isEqualTo(0.5);
    }

    @Test
    void countsEveryEventRecordedConcurrently() throws InterruptedException {
        int threads = 8;
        int perThread = 10_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        rate.record(1);
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(rate.ratePerSecond()).isEqualTo(threads * perThread / 10.0);
    }
}
