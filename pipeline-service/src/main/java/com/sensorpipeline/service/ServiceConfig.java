package com.sensorpipeline.service;

import java.util.Objects;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration of the deployable service: where to read
 * readings from, where to write features to, and which port serves health
 * checks.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment. Pipeline tuning (window, batch, retry, ...) lives in the YAML
 * file named by {@code PIPELINE_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Storage
    // ---------------------------------------------------------------
    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;
    private final boolean initSchema;

    // ---------------------------------------------------------------
    // Health / pipeline
    // ---------------------------------------------------------------
    private final int healthPort;
    private final String pipelineConfigPath;

    private ServiceConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.jdbcUrl = b.jdbcUrl;
        this.jdbcUser = b.jdbcUser;
        this.jdbcPassword = b.jdbcPassword;
        this.initSchema = b.initSchema;
        this.healthPort = b.healthPort;
        this.pipelineConfigPath = b.pipelineConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromLookup(System::getenv);
    }

    static ServiceConfig fromLookup(UnaryOperator<String> lookup) {
        try {
            return new Builder()
                    .kafkaBootstrapServers(value(lookup, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(value(lookup, "KAFKA_INPUT_TOPIC", ""))
                    .kafkaGroupId(value(lookup, "KAFKA_GROUP_ID", "sensor-pipeline"))
                    .jdbcUrl(value(lookup, "JDBC_URL", "jdbc:postgresql://localhost:5432/sensors"))
                    .jdbcUser(value(lookup, "JDBC_USER", "postgres"))
                    .jdbcPassword(value(lookup, "JDBC_PASSWORD", ""))
                    .initSchema(Boolean.parseBoolean(value(lookup, "JDBC_INIT_SCHEMA", "true")))
                    .healthPort(Integer.parseInt(value(lookup, "HEALTH_PORT", "8080")))
                    .pipelineConfigPath(value(lookup, "PIPELINE_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Build Kafka consumer {@link Properties}. Offsets are committed by the
     * source after records are acknowledged, never automatically.
     *
     * @param clientSuffix appended to the client id so each worker is
     *                     distinguishable in broker logs
     */
    public Properties kafkaConsumerProperties(String clientSuffix) {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("client.id", kafkaGroupId + "-" + clientSuffix);
        props.setProperty("auto.offset.reset", "earliest");
        props.setProperty("enable.auto.commit", "false");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    /**
     * @return topic override, or an empty string to use the pipeline
     *         configuration's topic
     */
    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getJdbcUser() {
        return jdbcUser;
    }

    public String getJdbcPassword() {
        return jdbcPassword;
    }

    public boolean isInitSchema() {
        return initSchema;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks for a non-blank bootstrap server list, group id
     * and JDBC URL, and a health port in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "";
        private String kafkaGroupId = "sensor-pipeline";
        private String jdbcUrl = "jdbc:postgresql://localhost:5432/sensors";
        private String jdbcUser = "postgres";
        private String jdbcPassword = "";
        private boolean initSchema = true;
        private int healthPort = 8080;
        private String pipelineConfigPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder jdbcUrl(String v) {
            this.jdbcUrl = v;
            return this;
        }

        public Builder jdbcUser(String v) {
            this.jdbcUser = v;
            return this;
        }

        public Builder jdbcPassword(String v) {
            this.jdbcPassword = v;
            return this;
        }

        public Builder initSchema(boolean v) {
            this.initSchema = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(jdbcUrl, "jdbcUrl");
            kafkaInputTopic = Objects.requireNonNullElse(kafkaInputTopic, "");
            pipelineConfigPath = Objects.requireNonNullElse(pipelineConfigPath, "");
            jdbcPassword = Objects.requireNonNullElse(jdbcPassword, "");

            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(UnaryOperator<String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", jdbcUrl='" + jdbcUrl + '\'' +
                ", jdbcUser='" + jdbcUser + '\'' +
                ", healthPort=" + healthPort +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                '}';
    }
}
