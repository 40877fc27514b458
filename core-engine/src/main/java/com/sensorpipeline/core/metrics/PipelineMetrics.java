package com.sensorpipeline.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Micrometer meters for the sensor pipeline.
 *
 * <p>
 * The hosting process decides where the registry publishes (Prometheus,
 * JMX, …); the pipeline only defines the meters.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code sensor_pipeline.readings.processed}: readings taken from the source</li>
 * <li>{@code sensor_pipeline.readings.rejected}: readings that failed validation</li>
 * <li>{@code sensor_pipeline.anomalies.detected}: readings flagged as anomalies</li>
 * <li>{@code sensor_pipeline.processing.latency}: per-reading processing time</li>
 * <li>{@code sensor_pipeline.writer.records.written}: records committed to storage</li>
 * <li>{@code sensor_pipeline.writer.records.dropped}: records dropped after retries</li>
 * <li>{@code sensor_pipeline.writer.flush.failures}: failed bulk-insert attempts</li>
 * <li>{@code sensor_pipeline.writer.buffer.size}: records waiting in the write buffer</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PipelineMetrics {

    private static final String PREFIX = "sensor_pipeline";

    private final MeterRegistry registry;
    private final Counter readingsProcessed;
    private final Counter readingsRejected;
    private final Counter anomaliesDetected;
    private final Timer processingLatency;
    private final Counter recordsWritten;
    private final Counter recordsDropped;
    private final Counter flushFailures;
    private final AtomicReference<Supplier<Number>> bufferSize = new AtomicReference<>(() -> 0);

    public PipelineMetrics() {
        this(new SimpleMeterRegistry());
    }

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.readingsProcessed = registry.counter(PREFIX + ".readings.processed");
        this.readingsRejected = registry.counter(PREFIX + ".readings.rejected");
        this.anomaliesDetected = registry.counter(PREFIX + ".anomalies.detected");
        this.processingLatency = Timer.builder(PREFIX + ".processing.latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        this.recordsWritten = registry.counter(PREFIX + ".writer.records.written");
        this.recordsDropped = registry.counter(PREFIX + ".writer.records.dropped");
        this.flushFailures = registry.counter(PREFIX + ".writer.flush.failures");
        Gauge.builder(PREFIX + ".writer.buffer.size", bufferSize, ref -> ref.get().get().doubleValue())
                .register(registry);
    }

    /**
     * Point the buffer-size gauge at a write buffer. The latest binding wins.
     *
     * @param supplier supplier of the current buffer size
     */
    public void bindBufferSize(Supplier<Number> supplier) {
        bufferSize.set(Objects.requireNonNull(supplier, "supplier must not be null"));
    }

    public void incrementReadingsProcessed() {
        readingsProcessed.increment();
    }

    public void incrementReadingsRejected() {
        readingsRejected.increment();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.increment();
    }

    public void recordLatency(long nanos) {
        processingLatency.record(nanos, TimeUnit.NANOSECONDS);
    }

    public void recordWritten(int count) {
        recordsWritten.increment(count);
    }

    public void recordDropped(int count) {
        recordsDropped.increment(count);
    }

    public void incrementFlushFailures() {
        flushFailures.increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
