package com.sensorpipeline.core.pipeline;

import com.sensorpipeline.core.buffer.BatchWriteBuffer;
import com.sensorpipeline.core.buffer.BufferFullException;
import com.sensorpipeline.core.buffer.FlushResult;
import com.sensorpipeline.core.buffer.StorageWriter;
import com.sensorpipeline.core.buffer.WriterStats;
import com.sensorpipeline.core.config.PipelineConfig;
import com.sensorpipeline.core.features.FeatureEngineer;
import com.sensorpipeline.core.metrics.PipelineMetrics;
import com.sensorpipeline.core.model.FeatureVector;
import com.sensorpipeline.core.stats.StatisticsResult;
import com.sensorpipeline.core.stats.StreamStatisticsEngine;
import com.sensorpipeline.core.validation.ReadingValidationException;
import com.sensorpipeline.core.window.WindowStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the pipeline lifecycle and its worker threads.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   ReadingSource (one per worker)
 *     → StreamStatisticsEngine (validate, update window, point metrics)
 *     → FeatureEngineer
 *     → BatchWriteBuffer → StorageWriter
 *     → ack
 * </pre>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@code STOPPED -> RUNNING <-> PAUSED -> STOPPED}. {@link #start()} is a
 * no-op when already running; {@link #pause()} and {@link #resume()} throw
 * {@link IllegalStateException} from the wrong state; {@link #stop()} is
 * valid from any state. Window state survives a stop/start cycle.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * A bad reading is counted, logged and acknowledged; it never stops a
 * worker. Storage failures surface through the writer statistics and the
 * error rate used by {@link #healthCheck()}.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final long MIN_TIMER_PERIOD_MS = 10;
    private static final long MAX_TIMER_PERIOD_MS = 1_000;

    private final PipelineConfig config;
    private final ReadingSourceFactory sourceFactory;
    private final PipelineMetrics metrics;
    private final StreamStatisticsEngine engine;
    private final FeatureEngineer featureEngineer;
    private final BatchWriteBuffer buffer;
    private final SlidingWindowRate rate;

    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();
    private final AtomicLong validationErrors = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();
    private volatile Instant lastProcessedTime;

    private volatile PipelineState state = PipelineState.STOPPED;
    private final List<Worker> workers = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService flushTimer;

    public PipelineOrchestrator(PipelineConfig config, ReadingSourceFactory sourceFactory,
            StorageWriter storageWriter) {
        this(config, sourceFactory, storageWriter, new PipelineMetrics());
    }

    public PipelineOrchestrator(PipelineConfig config, ReadingSourceFactory sourceFactory,
            StorageWriter storageWriter, PipelineMetrics metrics) {
        this.config = Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "ReadingSourceFactory must not be null");
        Objects.requireNonNull(storageWriter, "StorageWriter must not be null");
        this.metrics = Objects.requireNonNull(metrics, "PipelineMetrics must not be null");
        this.engine = new StreamStatisticsEngine(
                new WindowStateStore(config.getWindowSize(), config.getWindowMaxAge()),
                config.getAnomalyThreshold());
        this.featureEngineer = new FeatureEngineer();
        this.buffer = new BatchWriteBuffer(storageWriter, config, metrics);
        this.rate = new SlidingWindowRate(config.getRateInterval(), Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Control interface
    // ---------------------------------------------------------------

    /**
     * Open one source per worker, subscribe, and start consuming.
     *
     * @throws IllegalStateException if a source cannot be opened or
     *                               subscribed; sources already opened are
     *                               closed again
     */
    public synchronized void start() {
        if (state == PipelineState.RUNNING) {
            LOG.debug("start() ignored, pipeline already running");
            return;
        }
        if (state == PipelineState.PAUSED) {
            resume();
            return;
        }

        List<Worker> started = new ArrayList<>();
        try {
            for (int i = 0; i < config.getWorkerCount(); i++) {
                ReadingSource source = Objects.requireNonNull(sourceFactory.open(i),
                        "ReadingSourceFactory returned null for worker " + i);
                started.add(new Worker(i, source));
                source.subscribe(config.getTopic());
            }
        } catch (RuntimeException e) {
            started.forEach(Worker::closeSource);
            throw new IllegalStateException("Failed to start pipeline: " + e.getMessage(), e);
        }

        state = PipelineState.RUNNING;
        workers.addAll(started);
        workers.forEach(Worker::start);

        long period = Math.max(MIN_TIMER_PERIOD_MS,
                Math.min(MAX_TIMER_PERIOD_MS, config.getFlushInterval().toMillis() / 2));
        flushTimer = Executors.newSingleThreadScheduledExecutor(namedThreads("sensor-pipeline-flush-timer"));
        flushTimer.scheduleAtFixedRate(this::timedFlush, period, period, TimeUnit.MILLISECONDS);

        LOG.info("Pipeline started with {} worker(s) on topic '{}'", workers.size(), config.getTopic());
    }

    /**
     * Stop pulling new readings. Each worker pauses its source and keeps
     * polling it, so the upstream subscription stays alive and acknowledged
     * positions are still committed. An in-flight flush is not interrupted
     * and the flush timer keeps draining the buffer.
     *
     * @throws IllegalStateException if the pipeline is not running
     */
    public synchronized void pause() {
        if (state != PipelineState.RUNNING) {
            throw new IllegalStateException("Cannot pause pipeline in state " + state);
        }
        state = PipelineState.PAUSED;
        LOG.info("Pipeline paused");
    }

    /**
     * @throws IllegalStateException if the pipeline is not paused
     */
    public synchronized void resume() {
        if (state != PipelineState.PAUSED) {
            throw new IllegalStateException("Cannot resume pipeline in state " + state);
        }
        state = PipelineState.RUNNING;
        LOG.info("Pipeline resumed");
    }

    /**
     * Stop the workers, drain the buffer with a final flush and release the
     * sources. Blocks until the drain completes or the shutdown timeout
     * elapses; records still buffered after that are discarded and logged as
     * lost.
     */
    public synchronized void stop() {
        if (state == PipelineState.STOPPED) {
            LOG.debug("stop() ignored, pipeline already stopped");
            return;
        }
        state = PipelineState.STOPPED;
        LOG.info("Stopping pipeline");
        long deadline = System.nanoTime() + config.getShutdownTimeout().toNanos();

        for (Worker worker : workers) {
            worker.requestStop();
        }
        boolean interrupted = false;
        for (Worker worker : workers) {
            try {
                worker.join(remainingMillis(deadline));
            } catch (InterruptedException e) {
                interrupted = true;
            }
            if (worker.isAlive()) {
                LOG.warn("Worker {} did not finish in time, interrupting", worker.index);
                worker.interrupt();
            }
        }

        flushTimer.shutdownNow();
        interrupted |= !drain(deadline);

        for (Worker worker : workers) {
            worker.closeSource();
        }
        workers.clear();
        flushTimer = null;

        LOG.info("Pipeline stopped: {}", getStats());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------

    public PipelineState getState() {
        return state;
    }

    public PipelineStats getStats() {
        return new PipelineStats(state, totalProcessed.get(), totalErrors.get(), validationErrors.get(),
                anomaliesDetected.get(), rate.ratePerSecond(), lastProcessedTime, isSourceConnected(),
                engine.activeKeys(), buffer.getStats());
    }

    /**
     * Healthy iff the source is connected and
     * {@code (pipeline errors + writer errors) / max(processed, 1)} is below
     * the configured threshold.
     */
    public HealthSnapshot healthCheck() {
        PipelineState current = state;
        WriterStats writer = buffer.getStats();
        long processed = totalProcessed.get();
        double errorRate = (double) (totalErrors.get() + writer.getTotalErrors()) / Math.max(processed, 1);
        boolean connected = isSourceConnected();

        List<String> reasons = new ArrayList<>();
        if (current == PipelineState.STOPPED) {
            reasons.add("pipeline is stopped");
            return new HealthSnapshot(false, HealthSnapshot.STATUS_STOPPED, current, errorRate, connected, reasons);
        }
        if (!connected) {
            reasons.add("source disconnected");
        }
        if (errorRate >= config.getErrorRateThreshold()) {
            reasons.add(String.format("error rate %.4f exceeds threshold %.4f",
                    errorRate, config.getErrorRateThreshold()));
        }
        boolean healthy = reasons.isEmpty();
        return new HealthSnapshot(healthy, healthy ? HealthSnapshot.STATUS_HEALTHY : HealthSnapshot.STATUS_DEGRADED,
                current, errorRate, connected, reasons);
    }

    /**
     * @return the engine holding the window state, for inspection and reset
     */
    public StreamStatisticsEngine getStatisticsEngine() {
        return engine;
    }

    public PipelineMetrics getMetrics() {
        return metrics;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean isSourceConnected() {
        if (workers.isEmpty()) {
            return false;
        }
        for (Worker worker : workers) {
            if (!worker.source.isConnected()) {
                return false;
            }
        }
        return true;
    }

    private void timedFlush() {
        try {
            FlushResult result = buffer.maybeFlush();
            if (!result.isSuccess()) {
                LOG.warn("Timed flush dropped records: {}", result);
            }
        } catch (RuntimeException e) {
            LOG.error("Timed flush failed", e);
        }
    }

    /**
     * Final flush bounded by the shutdown deadline.
     *
     * @return {@code false} if this thread was interrupted while waiting
     */
    private boolean drain(long deadline) {
        ExecutorService drainer = Executors.newSingleThreadExecutor(namedThreads("sensor-pipeline-drain"));
        Future<FlushResult> flush = drainer.submit(buffer::flush);
        try {
            FlushResult result = flush.get(remainingMillis(deadline), TimeUnit.MILLISECONDS);
            LOG.info("Final flush wrote {} record(s)", result.getWrittenCount());
            return true;
        } catch (TimeoutException e) {
            flush.cancel(true);
            int lost = buffer.discardPending();
            LOG.error("DATA LOSS: shutdown timeout of {} elapsed, discarded {} buffered record(s)",
                    config.getShutdownTimeout(), lost);
            return true;
        } catch (ExecutionException e) {
            LOG.error("Final flush failed", e.getCause());
            return true;
        } catch (InterruptedException e) {
            flush.cancel(true);
            int lost = buffer.discardPending();
            LOG.error("DATA LOSS: interrupted during shutdown, discarded {} buffered record(s)", lost);
            return false;
        } finally {
            drainer.shutdownNow();
        }
    }

    private void handle(ReadingSource source, SourceRecord record) {
        long started = System.nanoTime();
        totalProcessed.incrementAndGet();
        metrics.incrementReadingsProcessed();
        rate.record(1);
        try {
            if (!record.isDecoded()) {
                throw new ReadingValidationException("undecodable message: " + record.getDecodeError());
            }
            StatisticsResult statistics = engine.process(record.getReading());
            FeatureVector features = featureEngineer.engineer(statistics);
            buffer.append(features);
            if (features.isAnomaly()) {
                anomaliesDetected.incrementAndGet();
                metrics.incrementAnomaliesDetected();
            }
        } catch (ReadingValidationException e) {
            validationErrors.incrementAndGet();
            totalErrors.incrementAndGet();
            metrics.incrementReadingsRejected();
            LOG.warn("Rejected reading at {}: {}", record, e.getMessage());
        } catch (BufferFullException e) {
            totalErrors.incrementAndGet();
            LOG.error("DATA LOSS: write buffer full, dropped reading at {} ({} record(s) buffered)",
                    record, e.getBufferedRecords());
        } catch (InterruptedException e) {
            // not acked, so the source redelivers it
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException e) {
            totalErrors.incrementAndGet();
            LOG.error("Unexpected failure processing reading at {}", record, e);
        }
        source.ack(record);
        lastProcessedTime = Instant.now();
        metrics.recordLatency(System.nanoTime() - started);
    }

    private static long remainingMillis(long deadlineNanos) {
        return Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    private static ThreadFactory namedThreads(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    // ---------------------------------------------------------------
    // Worker
    // ---------------------------------------------------------------

    private final class Worker extends Thread {

        private final int index;
        private final ReadingSource source;
        private volatile boolean stopRequested;

        Worker(int index, ReadingSource source) {
            super("sensor-pipeline-worker-" + index);
            this.index = index;
            this.source = source;
        }

        void requestStop() {
            stopRequested = true;
        }

        @Override
        public void run() {
            LOG.debug("Worker {} started", index);
            Duration pollTimeout = config.getPollTimeout();
            boolean sourcePaused = false;
            while (!stopRequested && !isInterrupted()) {
                try {
                    // sources are confined to their worker thread
                    boolean pauseRequested = state == PipelineState.PAUSED;
                    if (pauseRequested != sourcePaused) {
                        if (pauseRequested) {
                            source.pause();
                        } else {
                            source.resume();
                        }
                        sourcePaused = pauseRequested;
                    }
                    List<SourceRecord> records = source.poll(pollTimeout);
                    for (SourceRecord record : records) {
                        handle(source, record);
                        if (isInterrupted()) {
                            break;
                        }
                    }
                } catch (InterruptedException e) {
                    interrupt();
                } catch (RuntimeException e) {
                    LOG.warn("Worker {} failed to poll source: {}", index, e.getMessage());
                    backOff(pollTimeout);
                }
            }
            LOG.debug("Worker {} finished", index);
        }

        private void backOff(Duration pollTimeout) {
            try {
                TimeUnit.MILLISECONDS.sleep(pollTimeout.toMillis());
            } catch (InterruptedException e) {
                interrupt();
            }
        }

        void closeSource() {
            try {
                source.close();
            } catch (RuntimeException e) {
                LOG.warn("Failed to close source of worker {}: {}", index, e.getMessage());
            }
        }
    }
}
