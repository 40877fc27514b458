package com.sensorpipeline.service;

import com.sensorpipeline.core.pipeline.ReadingSource;
import com.sensorpipeline.core.pipeline.ReadingSourceFactory;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.util.Objects;

/**
 * Opens one {@link KafkaConsumer} per pipeline worker, all in the same
 * consumer group.
 */
public class KafkaReadingSourceFactory implements ReadingSourceFactory {

    private final ServiceConfig config;
    private final ReadingDeserializer deserializer = new ReadingDeserializer();

    public KafkaReadingSourceFactory(ServiceConfig config) {
        this.config = Objects.requireNonNull(config, "ServiceConfig must not be null");
    }

    @Override
    public ReadingSource open(int workerIndex) {
        KafkaConsumer<String, byte[]> consumer = new KafkaConsumer<>(
                config.kafkaConsumerProperties("worker-" + workerIndex),
                new StringDeserializer(), new ByteArrayDeserializer());
        return new KafkaReadingSource(consumer, deserializer);
    }
}
