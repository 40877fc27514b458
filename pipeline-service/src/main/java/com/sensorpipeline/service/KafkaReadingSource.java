package com.sensorpipeline.service;

import com.sensorpipeline.core.pipeline.ReadingSource;
import com.sensorpipeline.core.pipeline.SourceRecord;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Metric;
import org.apache.kafka.common.MetricName;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ReadingSource} backed by a Kafka consumer in a shared consumer
 * group, so each partition (and therefore each well/sensor key) is read by a
 * single worker.
 *
 * <h3>Offsets</h3>
 * <p>
 * Auto-commit is off. Acknowledged positions are committed synchronously at
 * the start of the next {@link #poll} and on {@link #close()}, which gives
 * at-least-once delivery: a crash between buffering and commit replays the
 * records and the storage upsert absorbs the duplicates.
 * </p>
 *
 * <h3>Connectivity</h3>
 * <p>
 * The Kafka client reconnects on its own and a poll against an unreachable
 * broker simply returns nothing, so connectivity is read from the client:
 * records received, or a non-zero {@code consumer-metrics connection-count}.
 * When the client reports no such metric and the consumer still holds no
 * assignment after {@value #CHECK_AFTER_EMPTY_POLLS} empty polls, a bounded
 * {@code listTopics} call decides. A failed poll marks the source
 * disconnected.
 * </p>
 *
 * <h3>Pausing</h3>
 * <p>
 * {@link #pause()} pauses the assigned partitions instead of stopping the
 * poll loop, so the consumer stays in its group and acknowledged offsets
 * keep being committed while no records are returned.
 * </p>
 *
 * <p>
 * Not thread-safe, like the underlying consumer: one instance per worker.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaReadingSource implements ReadingSource {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaReadingSource.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    static final String METRICS_GROUP = "consumer-metrics";
    static final String CONNECTION_COUNT = "connection-count";
    static final int CHECK_AFTER_EMPTY_POLLS = 3;
    static final Duration METADATA_TIMEOUT = Duration.ofSeconds(2);

    private final Consumer<String, byte[]> consumer;
    private final ReadingDeserializer deserializer;
    private final Map<TopicPartition, OffsetAndMetadata> acknowledged = new HashMap<>();
    private volatile boolean connected;
    private boolean paused;
    private int emptyPolls;

    public KafkaReadingSource(Consumer<String, byte[]> consumer, ReadingDeserializer deserializer) {
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.deserializer = Objects.requireNonNull(deserializer, "deserializer must not be null");
    }

    @Override
    public void subscribe(String topic) {
        consumer.subscribe(List.of(topic));
        connected = true;
        LOG.info("Subscribed to topic '{}'", topic);
    }

    @Override
    public List<SourceRecord> poll(Duration timeout) throws InterruptedException {
        commitAcknowledged();
        ConsumerRecords<String, byte[]> records;
        try {
            if (paused) {
                // partitions assigned by a rebalance since pause() are not paused yet
                consumer.pause(consumer.assignment());
            }
            records = consumer.poll(timeout);
        } catch (InterruptException e) {
            throw interrupted(e);
        } catch (KafkaException e) {
            if (connected) {
                LOG.warn("Kafka poll failed, marking source disconnected: {}", e.getMessage());
            }
            connected = false;
            return List.of();
        }

        if (records.isEmpty()) {
            updateConnectivityWhileIdle();
            return List.of();
        }
        emptyPolls = 0;
        markConnected(true);
        if (paused) {
            rewind(records);
            return List.of();
        }

        List<SourceRecord> result = new ArrayList<>(records.count());
        for (ConsumerRecord<String, byte[]> record : records) {
            result.add(decode(record));
        }
        return result;
    }

    @Override
    public void pause() {
        paused = true;
        consumer.pause(consumer.assignment());
        LOG.info("Kafka source paused on {}", consumer.assignment());
    }

    @Override
    public void resume() {
        paused = false;
        consumer.resume(consumer.paused());
        LOG.info("Kafka source resumed");
    }

    @Override
    public void ack(SourceRecord record) {
        TopicPartition tp = new TopicPartition(record.getTopic(), record.getPartition());
        long next = record.getOffset() + 1;
        acknowledged.merge(tp, new OffsetAndMetadata(next),
                (current, candidate) -> candidate.offset() > current.offset() ? candidate : current);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void close() {
        try {
            commitAcknowledged();
        } finally {
            connected = false;
            consumer.close(CLOSE_TIMEOUT);
            LOG.info("Kafka source closed");
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void updateConnectivityWhileIdle() throws InterruptedException {
        emptyPolls++;
        Optional<Boolean> reported = reportedConnections();
        if (reported.isPresent()) {
            markConnected(reported.get());
        } else if (emptyPolls >= CHECK_AFTER_EMPTY_POLLS && consumer.assignment().isEmpty()) {
            emptyPolls = 0;
            markConnected(brokerReachable());
        }
    }

    /**
     * @return whether the client holds any broker connection, or empty when
     *         the client does not report {@value #CONNECTION_COUNT}
     */
    private Optional<Boolean> reportedConnections() {
        for (Map.Entry<MetricName, ? extends Metric> entry : consumer.metrics().entrySet()) {
            MetricName name = entry.getKey();
            if (CONNECTION_COUNT.equals(name.name()) && METRICS_GROUP.equals(name.group())) {
                Object value = entry.getValue().metricValue();
                if (value instanceof Number) {
                    return Optional.of(((Number) value).doubleValue() > 0);
                }
            }
        }
        return Optional.empty();
    }

    private boolean brokerReachable() throws InterruptedException {
        try {
            consumer.listTopics(METADATA_TIMEOUT);
            return true;
        } catch (InterruptException e) {
            throw interrupted(e);
        } catch (KafkaException e) {
            LOG.debug("Broker metadata request failed: {}", e.getMessage());
            return false;
        }
    }

    private void markConnected(boolean now) {
        if (now && !connected) {
            LOG.info("Kafka source connected");
        } else if (!now && connected) {
            LOG.warn("Kafka source lost its broker connection");
        }
        connected = now;
    }

    /**
     * Seek back to the first returned offset of each partition so records
     * fetched while paused are delivered again after {@link #resume()}.
     */
    private void rewind(ConsumerRecords<String, byte[]> records) {
        for (TopicPartition tp : records.partitions()) {
            consumer.seek(tp, records.records(tp).get(0).offset());
        }
        consumer.pause(records.partitions());
    }

    private static InterruptedException interrupted(InterruptException cause) {
        Thread.interrupted();
        InterruptedException interrupted = new InterruptedException("Kafka call interrupted");
        interrupted.initCause(cause);
        return interrupted;
    }

    private SourceRecord decode(ConsumerRecord<String, byte[]> record) {
        try {
            return SourceRecord.of(record.topic(), record.partition(), record.offset(),
                    deserializer.deserialize(record.value()));
        } catch (IOException e) {
            return SourceRecord.undecodable(record.topic(), record.partition(), record.offset(), e.getMessage());
        }
    }

    private void commitAcknowledged() {
        if (acknowledged.isEmpty()) {
            return;
        }
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>(acknowledged);
        acknowledged.clear();
        try {
            consumer.commitSync(offsets);
            LOG.debug("Committed offsets {}", offsets);
        } catch (KafkaException e) {
            // Records past the failed commit are redelivered after a rebalance.
            LOG.warn("Offset commit failed for {}: {}", offsets.keySet(), e.getMessage());
        }
    }
}
