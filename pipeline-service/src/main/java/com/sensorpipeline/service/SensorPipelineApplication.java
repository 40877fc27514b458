package com.sensorpipeline.service;

import com.sensorpipeline.core.config.PipelineConfig;
import com.sensorpipeline.core.config.PipelineConfigLoader;
import com.sensorpipeline.core.metrics.PipelineMetrics;
import com.sensorpipeline.core.pipeline.PipelineOrchestrator;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Main entry point of the sensor pipeline service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (sensor-data topic)
 *     → Deserialize JSON → RawReading
 *     → PipelineOrchestrator workers (validate, window statistics, features)
 *     → BatchWriteBuffer
 *     → JdbcFeatureStore (sensor_features upsert)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Connections and ports come from environment variables via
 * {@link ServiceConfig}; pipeline tuning from YAML via
 * {@link PipelineConfigLoader}.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * A JVM shutdown hook stops the orchestrator, which drains the write buffer
 * before releasing the Kafka consumers.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorPipelineApplication {

    private static final Logger LOG = LoggerFactory.getLogger(SensorPipelineApplication.class);

    private SensorPipelineApplication() {
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting sensor pipeline with config: {}", config);
        PipelineConfig pipelineConfig = loadPipelineConfig(config);

        // 2. Storage
        JdbcFeatureStore store = new JdbcFeatureStore(dataSource(config));
        if (config.isInitSchema()) {
            store.ensureSchema();
        }

        // 3. Orchestrator
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(pipelineConfig,
                new KafkaReadingSourceFactory(config), store, new PipelineMetrics());

        // 4. Health server (for K8s liveness and readiness checks)
        HealthServer healthServer = new HealthServer(orchestrator);
        healthServer.start(config.getHealthPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            orchestrator.stop();
            healthServer.stop();
        }, "pipeline-shutdown"));

        // 5. Run until the JVM is asked to exit
        orchestrator.start();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static PipelineConfig loadPipelineConfig(ServiceConfig config) {
        String path = config.getPipelineConfigPath();
        PipelineConfig pipelineConfig = path.isBlank()
                ? PipelineConfigLoader.load()
                : PipelineConfigLoader.fromFile(path);
        String topic = config.getKafkaInputTopic();
        if (!topic.isBlank() && !topic.equals(pipelineConfig.getTopic())) {
            LOG.info("Overriding topic '{}' with KAFKA_INPUT_TOPIC '{}'", pipelineConfig.getTopic(), topic);
            pipelineConfig = pipelineConfig.toBuilder().topic(topic).build();
        }
        return pipelineConfig;
    }

    private static DataSource dataSource(ServiceConfig config) {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setURL(config.getJdbcUrl());
        dataSource.setUser(config.getJdbcUser());
        dataSource.setPassword(config.getJdbcPassword());
        return dataSource;
    }
}
