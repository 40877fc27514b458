package com.sensorpipeline.core.buffer;

import com.sensorpipeline.core.config.PipelineConfig;
import com.sensorpipeline.core.metrics.PipelineMetrics;
import com.sensorpipeline.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates feature vectors from all workers and writes them to a
 * {@link StorageWriter} in bulk.
 *
 * <h3>Triggers</h3>
 * <p>
 * A flush happens when {@code batchSize} records are pending (checked on
 * every {@link #append}) or when {@code flushInterval} has elapsed since the
 * last flush (checked by a timer calling {@link #maybeFlush()}). A single bulk
 * insert never carries more than {@code batchSize} records.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A failed bulk insert is retried up to {@code retryLimit} attempts in total,
 * sleeping {@code min(backoffBase * 2^(attempt-1), backoffMax)} between them.
 * When every attempt fails the batch is dropped, counted in
 * {@code totalErrors} and logged with a {@code DATA LOSS:} prefix.
 * </p>
 *
 * <h3>Backpressure</h3>
 * <p>
 * {@code append} blocks while {@code batchSize * backpressureFactor} records
 * are buffered (a batch being retried still counts) and throws
 * {@link BufferFullException} once {@code appendTimeout} elapses.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * One lock guards the pending queue and the flush-trigger check; a second
 * lock serialises flushes so batches reach storage one at a time.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchWriteBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(BatchWriteBuffer.class);

    /** Blocking pause between attempts. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final StorageWriter writer;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    private final int batchSize;
    private final int maxBuffered;
    private final Duration flushInterval;
    private final int retryLimit;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final Duration appendTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final ReentrantLock flushLock = new ReentrantLock();

    // guarded by lock
    private final Deque<FeatureVector> pending = new ArrayDeque<>();
    private int inFlight;
    private Instant lastFlushTime;

    private final AtomicLong totalWritten = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();
    private final AtomicLong droppedBatches = new AtomicLong();
    private final AtomicLong droppedRecords = new AtomicLong();
    private final AtomicLong flushCount = new AtomicLong();
    private volatile Instant lastWriteTime;

    public BatchWriteBuffer(StorageWriter writer, PipelineConfig config, PipelineMetrics metrics) {
        this(writer, config, metrics, Clock.systemUTC(), BatchWriteBuffer::sleep);
    }

    BatchWriteBuffer(StorageWriter writer, PipelineConfig config, PipelineMetrics metrics,
            Clock clock, Sleeper sleeper) {
        this.writer = Objects.requireNonNull(writer, "StorageWriter must not be null");
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.metrics = Objects.requireNonNull(metrics, "PipelineMetrics must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "Sleeper must not be null");
        this.batchSize = config.getBatchSize();
        this.maxBuffered = config.getMaxBufferedRecords();
        this.flushInterval = config.getFlushInterval();
        this.retryLimit = config.getRetryLimit();
        this.backoffBase = config.getBackoffBase();
        this.backoffMax = config.getBackoffMax();
        this.appendTimeout = config.getAppendTimeout();
        this.lastFlushTime = clock.instant();
        metrics.bindBufferSize(this::size);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Buffer one record, flushing full batches when {@code batchSize} is
     * reached.
     *
     * @param record record to buffer; must not be {@code null}
     * @throws BufferFullException  if the buffer stays full for
     *                              {@code appendTimeout}
     * @throws InterruptedException if interrupted while waiting for space
     */
    public void append(FeatureVector record) throws InterruptedException {
        Objects.requireNonNull(record, "record must not be null");
        boolean batchReady;
        lock.lockInterruptibly();
        try {
            long remaining = appendTimeout.toNanos();
            while (pending.size() + inFlight >= maxBuffered) {
                if (remaining <= 0) {
                    throw new BufferFullException(pending.size() + inFlight);
                }
                remaining = notFull.awaitNanos(remaining);
            }
            pending.addLast(record);
            batchReady = pending.size() >= batchSize;
        } finally {
            lock.unlock();
        }
        if (batchReady) {
            drainFullBatches();
        }
    }

    /**
     * Write every pending record, in chunks of at most {@code batchSize}.
     * Flushing an empty buffer performs no storage call.
     *
     * <p>
     * If interrupted while backing off, the unwritten batch goes back to the
     * front of the buffer and the interrupt flag is restored.
     * </p>
     *
     * @return records written and the last error, if a batch was dropped
     */
    public FlushResult flush() {
        flushLock.lock();
        try {
            int written = 0;
            StorageException lastError = null;
            List<FeatureVector> batch;
            while (!(batch = takeBatch()).isEmpty()) {
                StorageException error;
                try {
                    error = writeWithRetry(batch);
                } catch (InterruptedException e) {
                    requeue(batch);
                    Thread.currentThread().interrupt();
                    LOG.warn("Flush interrupted, {} record(s) returned to the buffer", batch.size());
                    break;
                }
                if (error == null) {
                    written += batch.size();
                } else {
                    lastError = error;
                }
            }
            markFlushed();
            return written == 0 && lastError == null ? FlushResult.empty() : new FlushResult(written, lastError);
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Flush if either trigger fired: {@code batchSize} records pending, or
     * {@code flushInterval} elapsed since the last flush with records pending.
     *
     * @return the flush outcome, or an empty result when nothing was due
     */
    public FlushResult maybeFlush() {
        lock.lock();
        try {
            boolean intervalElapsed = Duration.between(lastFlushTime, clock.instant())
                    .compareTo(flushInterval) >= 0;
            if (pending.isEmpty()) {
                if (intervalElapsed) {
                    lastFlushTime = clock.instant();
                }
                return FlushResult.empty();
            }
            if (pending.size() < batchSize && !intervalElapsed) {
                return FlushResult.empty();
            }
        } finally {
            lock.unlock();
        }
        LOG.debug("Flush triggered by timer");
        return flush();
    }

    /**
     * Drop every pending record without writing it. Used when the shutdown
     * drain times out.
     *
     * @return number of records discarded
     */
    public int discardPending() {
        lock.lock();
        try {
            int discarded = pending.size();
            pending.clear();
            if (discarded > 0) {
                droppedRecords.addAndGet(discarded);
                metrics.recordDropped(discarded);
            }
            notFull.signalAll();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return records pending plus any batch currently being written
     */
    public int size() {
        lock.lock();
        try {
            return pending.size() + inFlight;
        } finally {
            lock.unlock();
        }
    }

    public WriterStats getStats() {
        return new WriterStats(totalWritten.get(), totalErrors.get(), size(), lastWriteTime,
                droppedBatches.get(), droppedRecords.get(), flushCount.get());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Flush full batches from the appending thread. If another thread holds
     * the flush lock it will pick the batches up; the loop re-checks after
     * release so a batch completed during that flush is not left waiting for
     * the timer.
     */
    private void drainFullBatches() {
        while (flushLock.tryLock()) {
            try {
                while (pendingSize() >= batchSize) {
                    List<FeatureVector> batch = takeBatch();
                    try {
                        writeWithRetry(batch);
                    } catch (InterruptedException e) {
                        requeue(batch);
                        Thread.currentThread().interrupt();
                        return;
                    }
                }
                markFlushed();
            } finally {
                flushLock.unlock();
            }
            if (pendingSize() < batchSize) {
                return;
            }
        }
    }

    private List<FeatureVector> takeBatch() {
        lock.lock();
        try {
            int n = Math.min(batchSize, pending.size());
            List<FeatureVector> batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                batch.add(pending.pollFirst());
            }
            inFlight += n;
            return batch;
        } finally {
            lock.unlock();
        }
    }

    private void requeue(List<FeatureVector> batch) {
        lock.lock();
        try {
            ListIterator<FeatureVector> it = batch.listIterator(batch.size());
            while (it.hasPrevious()) {
                pending.addFirst(it.previous());
            }
            inFlight -= batch.size();
        } finally {
            lock.unlock();
        }
    }

    private void release(int count) {
        lock.lock();
        try {
            inFlight -= count;
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private int pendingSize() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private void markFlushed() {
        lock.lock();
        try {
            lastFlushTime = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code null} on success, otherwise the last error after the
     *         batch was dropped
     */
    private StorageException writeWithRetry(List<FeatureVector> batch) throws InterruptedException {
        StorageException lastError = null;
        for (int attempt = 1; attempt <= retryLimit; attempt++) {
            try {
                writer.bulkInsert(batch);
                totalWritten.addAndGet(batch.size());
                flushCount.incrementAndGet();
                lastWriteTime = clock.instant();
                metrics.recordWritten(batch.size());
                release(batch.size());
                LOG.info("Flushed {} record(s) to storage", batch.size());
                return null;
            } catch (StorageException e) {
                lastError = e;
            } catch (RuntimeException e) {
                lastError = new StorageException("Unexpected storage failure", e);
            }
            metrics.incrementFlushFailures();
            if (attempt < retryLimit) {
                Duration delay = backoff(attempt);
                LOG.warn("Bulk insert of {} record(s) failed (attempt {}/{}), retrying in {} ms: {}",
                        batch.size(), attempt, retryLimit, delay.toMillis(), lastError.getMessage());
                sleeper.sleep(delay);
            }
        }

        totalErrors.addAndGet(batch.size());
        droppedBatches.incrementAndGet();
        droppedRecords.addAndGet(batch.size());
        metrics.recordDropped(batch.size());
        release(batch.size());
        LOG.error("DATA LOSS: dropped batch of {} record(s) after {} failed attempt(s)",
                batch.size(), retryLimit, lastError);
        return lastError;
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    Duration backoff(int attempt) {
        long baseMs = backoffBase.toMillis();
        int shift = Math.min(attempt - 1, 30);
        long delayMs = baseMs > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseMs << shift;
        return delayMs >= backoffMax.toMillis() ? backoffMax : Duration.ofMillis(delayMs);
    }

    private static void sleep(Duration duration) throws InterruptedException {
        TimeUnit.MILLISECONDS.sleep(duration.toMillis());
    }
}
