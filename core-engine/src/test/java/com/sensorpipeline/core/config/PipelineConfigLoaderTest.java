package com.sensorpipeline.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineConfigLoader}.
 */
class PipelineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath("test-pipeline.yml");

        assertThat(config.getTopic()).isEqualTo("test-sensors");
        assertThat(config.getWorkerCount()).isEqualTo(3);
        assertThat(config.getWindowSize()).isEqualTo(10);
        assertThat(config.getWindowMaxAge()).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.getAnomalyThreshold()).isEqualTo(2.5);
        assertThat(config.getBatchSize()).isEqualTo(25);
        assertThat(config.getFlushInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getRetryLimit()).isEqualTo(5);
    }

    @Test
    @DisplayName("Keys absent from the file keep their defaults")
    void shouldKeepDefaultsForAbsentKeys() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath("test-pipeline.yml");
        PipelineConfig defaults = PipelineConfig.defaults();

        assertThat(config.getBackoffBase()).isEqualTo(defaults.getBackoffBase());
        assertThat(config.getShutdownTimeout()).isEqualTo(defaults.getShutdownTimeout());
        assertThat(config.getErrorRateThreshold()).isEqualTo(defaults.getErrorRateThreshold());
    }

    @Test
    @DisplayName("Bundled pipeline.yml matches the built-in defaults")
    void shouldLoadBundledDefaults() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath(PipelineConfigLoader.DEFAULT_RESOURCE);

        assertThat(config).usingRecursiveComparison().isEqualTo(PipelineConfig.defaults());
    }

    @Test
    @DisplayName("An empty document yields the defaults")
    void shouldUseDefaultsForEmptyDocument() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath("empty-pipeline.yml");

        assertThat(config).usingRecursiveComparison().isEqualTo(PipelineConfig.defaults());
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> PipelineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Invalid values are rejected at load time")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> PipelineConfigLoader.fromClasspath("invalid-pipeline.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batchSize");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("pipeline.yml");
        Files.write(file, "batchSize: 7\nbackoffBaseMs: 50\nbackoffMaxMs: 400\n".getBytes(StandardCharsets.UTF_8));

        PipelineConfig config = PipelineConfigLoader.fromFile(file.toString());

        assertThat(config.getBatchSize()).isEqualTo(7);
        assertThat(config.getBackoffBase()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.getBackoffMax()).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        String missing = tempDir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Malformed YAML and unknown keys are reported as malformed")
    void shouldRejectMalformedYaml() throws IOException {
        Path broken = tempDir.resolve("broken.yml");
        Files.write(broken, "batchSize: [1, 2\n".getBytes(StandardCharsets.UTF_8));
        Path unknown = tempDir.resolve("unknown.yml");
        Files.write(unknown, "batchSzie: 10\n".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(broken.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(unknown.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }
}
