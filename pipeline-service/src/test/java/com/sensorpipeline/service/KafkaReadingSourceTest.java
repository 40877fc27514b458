package com.sensorpipeline.service;

import com.sensorpipeline.core.pipeline.SourceRecord;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Metric;
import org.apache.kafka.common.MetricName;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link KafkaReadingSource} against a {@link MockConsumer}.
 */
class KafkaReadingSourceTest {

    private static final String TOPIC = "sensor-data";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);
    private static final Duration TIMEOUT = Duration.ofMillis(10);

    private MockConsumer<String, byte[]> consumer;
    private KafkaReadingSource source;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        source = new KafkaReadingSource(consumer, new ReadingDeserializer());
        source.subscribe(TOPIC);
        consumer.rebalance(List.of(PARTITION));
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
    }

    private void send(long offset, String json) {
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset, "Well_01",
                json.getBytes(StandardCharsets.UTF_8)));
    }

    private static String reading(double value) {
        return "{\"well_id\":\"Well_01\",\"sensor_type\":\"motor_temperature\","
                + "\"sensor_value\":" + value + ",\"timestamp\":\"2024-01-15T10:00:00Z\"}";
    }

    @Test
    @DisplayName("Should decode polled records and keep garbage as undecodable")
    void shouldDecodeRecords() throws InterruptedException {
        send(0, reading(71.5));
        send(1, "not json");

        List<SourceRecord> records = source.poll(TIMEOUT);

        assertThat(records).hasSize(2);
        assertThat(records.get(0).isDecoded()).isTrue();
        assertThat(records.get(0).getReading().getSensorValue()).isEqualTo(71.5);
        assertThat(records.get(0).getOffset()).isZero();
        assertThat(records.get(1).isDecoded()).isFalse();
        assertThat(records.get(1).getDecodeError()).isNotBlank();
        assertThat(source.isConnected()).isTrue();
    }

    @Test
    @DisplayName("Acknowledged offsets are committed on the next poll")
    void shouldCommitAcknowledgedOffsets() throws InterruptedException {
        send(0, reading(70.0));
        send(1, reading(71.0));
        send(2, reading(72.0));
        List<SourceRecord> records = source.poll(TIMEOUT);

        source.ack(records.get(1));
        source.ack(records.get(0));
        assertThat(consumer.committed(Set.of(PARTITION))).doesNotContainKey(PARTITION);

        source.poll(TIMEOUT);

        OffsetAndMetadata committed = consumer.committed(Set.of(PARTITION)).get(PARTITION);
        assertThat(committed.offset()).isEqualTo(2);
    }

    @Test
    @DisplayName("Close commits outstanding acknowledgements and closes the consumer")
    void shouldCommitOnClose() throws InterruptedException {
        send(0, reading(70.0));
        source.ack(source.poll(TIMEOUT).get(0));

        source.close();

        assertThat(consumer.closed()).isTrue();
        assertThat(source.isConnected()).isFalse();
    }

    @Test
    @DisplayName("A failed poll marks the source disconnected until the next success")
    void shouldTrackConnectivity() throws InterruptedException {
        consumer.setPollException(new KafkaException("broker unreachable"));

        assertThat(source.poll(TIMEOUT)).isEmpty();
        assertThat(source.isConnected()).isFalse();

        send(0, reading(70.0));
        assertThat(source.poll(TIMEOUT)).hasSize(1);
        assertThat(source.isConnected()).isTrue();
    }

    @Test
    @DisplayName("Pausing pauses the assigned partitions and resume delivers the held records")
    void shouldPausePartitionsInsteadOfStoppingThePoll() throws InterruptedException {
        source.pause();
        assertThat(consumer.paused()).containsExactly(PARTITION);

        send(0, reading(70.0));
        assertThat(source.poll(TIMEOUT)).isEmpty();
        assertThat(source.poll(TIMEOUT)).isEmpty();
        assertThat(source.isConnected()).isTrue();

        source.resume();
        assertThat(consumer.paused()).isEmpty();
        List<SourceRecord> records = source.poll(TIMEOUT);
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getOffset()).isZero();
    }

    @Test
    @DisplayName("Acknowledged offsets are still committed while paused")
    void shouldCommitWhilePaused() throws InterruptedException {
        send(0, reading(70.0));
        send(1, reading(71.0));
        List<SourceRecord> records = source.poll(TIMEOUT);
        source.pause();
        records.forEach(source::ack);

        assertThat(source.poll(TIMEOUT)).isEmpty();

        assertThat(consumer.committed(Set.of(PARTITION)).get(PARTITION).offset()).isEqualTo(2);
        assertThat(consumer.paused()).containsExactly(PARTITION);
    }

    @Test
    @DisplayName("Connectivity follows the client's connection-count metric")
    void shouldReadConnectivityFromClientMetrics() throws InterruptedException {
        AtomicReference<Object> connections = new AtomicReference<>(0.0);
        MetricName name = new MetricName(KafkaReadingSource.CONNECTION_COUNT, KafkaReadingSource.METRICS_GROUP,
                "", Map.of());
        Metric metric = new Metric() {
            @Override
            public MetricName metricName() {
                return name;
            }

            @Override
            public Object metricValue() {
                return connections.get();
            }
        };
        MockConsumer<String, byte[]> metered = new MockConsumer<>(OffsetResetStrategy.EARLIEST) {
            @Override
            public synchronized Map<MetricName, ? extends Metric> metrics() {
                return Map.of(name, metric);
            }
        };
        KafkaReadingSource meteredSource = new KafkaReadingSource(metered, new ReadingDeserializer());
        meteredSource.subscribe(TOPIC);
        metered.rebalance(List.of(PARTITION));
        metered.updateBeginningOffsets(Map.of(PARTITION, 0L));

        assertThat(meteredSource.poll(TIMEOUT)).isEmpty();
        assertThat(meteredSource.isConnected()).isFalse();

        connections.set(1.0);
        meteredSource.poll(TIMEOUT);
        assertThat(meteredSource.isConnected()).isTrue();
    }

    @Test
    @DisplayName("Without an assignment, repeated empty polls fall back to a metadata request")
    void shouldDetectUnreachableBrokerWithoutAssignment() throws InterruptedException {
        AtomicReference<KafkaException> metadataFailure = new AtomicReference<>(new TimeoutException("no broker"));
        MockConsumer<String, byte[]> unassigned = new MockConsumer<>(OffsetResetStrategy.EARLIEST) {
            @Override
            public synchronized Map<String, List<PartitionInfo>> listTopics(Duration timeout) {
                KafkaException failure = metadataFailure.get();
                if (failure != null) {
                    throw failure;
                }
                return Map.of();
            }
        };
        KafkaReadingSource idleSource = new KafkaReadingSource(unassigned, new ReadingDeserializer());
        idleSource.subscribe(TOPIC);

        for (int i = 1; i < KafkaReadingSource.CHECK_AFTER_EMPTY_POLLS; i++) {
            idleSource.poll(TIMEOUT);
            assertThat(idleSource.isConnected()).isTrue();
        }
        idleSource.poll(TIMEOUT);
        assertThat(idleSource.isConnected()).isFalse();

        metadataFailure.set(null);
        for (int i = 0; i < KafkaReadingSource.CHECK_AFTER_EMPTY_POLLS; i++) {
            idleSource.poll(TIMEOUT);
        }
        assertThat(idleSource.isConnected()).isTrue();
    }
}
