package com.sensorpipeline.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineConfig}.
 */
class PipelineConfigTest {

    @Test
    @DisplayName("Defaults describe a single-worker pipeline with a 60-reading window")
    void shouldExposeDefaults() {
        PipelineConfig config = PipelineConfig.defaults();

        assertThat(config.getTopic()).isEqualTo("sensor-data");
        assertThat(config.getWorkerCount()).isEqualTo(1);
        assertThat(config.getWindowSize()).isEqualTo(60);
        assertThat(config.getWindowMaxAge()).isNull();
        assertThat(config.getAnomalyThreshold()).isEqualTo(3.0);
        assertThat(config.getBatchSize()).isEqualTo(100);
        assertThat(config.getFlushInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getRetryLimit()).isEqualTo(3);
        assertThat(config.getMaxBufferedRecords()).isEqualTo(400);
    }

    @Test
    @DisplayName("toBuilder copies every value and leaves the original untouched")
    void shouldCopyThroughToBuilder() {
        PipelineConfig original = PipelineConfig.builder().topic("a").batchSize(10).build();

        PipelineConfig copy = original.toBuilder().topic("b").build();

        assertThat(copy.getTopic()).isEqualTo("b");
        assertThat(copy.getBatchSize()).isEqualTo(10);
        assertThat(original.getTopic()).isEqualTo("a");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> PipelineConfig.builder().windowSize(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("windowSize");
        assertThatThrownBy(() -> PipelineConfig.builder().topic(" ").build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("topic");
        assertThatThrownBy(() -> PipelineConfig.builder().flushInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("flushInterval");
        assertThatThrownBy(() -> PipelineConfig.builder()
                .backoffBase(Duration.ofSeconds(2)).backoffMax(Duration.ofSeconds(1)).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("backoffMax");
        assertThatThrownBy(() -> PipelineConfig.builder().anomalyThreshold(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("anomalyThreshold");
        assertThatThrownBy(() -> PipelineConfig.builder().errorRateThreshold(1.5).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("errorRateThreshold");
        assertThatThrownBy(() -> PipelineConfig.builder().rateInterval(Duration.ofMillis(500)).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("rateInterval");
    }
}
