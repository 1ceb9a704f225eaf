package com.ensemblesentinel.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunnerConfigTest {

    @Test
    @DisplayName("Empty environment yields the defaults")
    void shouldApplyDefaults() {
        RunnerConfig config = RunnerConfig.fromEnvironment(Map.of());

        assertThat(config.getEnsembleConfigPath()).isEmpty();
        assertThat(config.getHttpPort()).isEqualTo(8080);
        assertThat(config.getStreamIntervalMs()).isEqualTo(100);
        assertThat(config.getMaxPoints()).isZero();
        assertThat(config.getSeed()).isEqualTo(42);
        assertThat(config.getNoiseLevel()).isEqualTo(2.0);
        assertThat(config.getAnomalyChance()).isEqualTo(0.1);
        assertThat(config.getAmplitude()).isEqualTo(5.0);
        assertThat(config.getAnomalyMagnitude()).isEqualTo(25.0);
    }

    @Test
    @DisplayName("Environment variables override the defaults; blanks are ignored")
    void shouldReadOverrides() {
        RunnerConfig config = RunnerConfig.fromEnvironment(Map.of(
                "ENSEMBLE_CONFIG_PATH", "/etc/ensemble.yml",
                "HTTP_PORT", "9090",
                "STREAM_INTERVAL_MS", "0",
                "STREAM_MAX_POINTS", "500",
                "STREAM_SEED", "7",
                "STREAM_ANOMALY_CHANCE", "0.25",
                "STREAM_NOISE_LEVEL", " "));

        assertThat(config.getEnsembleConfigPath()).isEqualTo("/etc/ensemble.yml");
        assertThat(config.getHttpPort()).isEqualTo(9090);
        assertThat(config.getStreamIntervalMs()).isZero();
        assertThat(config.getMaxPoints()).isEqualTo(500);
        assertThat(config.getSeed()).isEqualTo(7);
        assertThat(config.getAnomalyChance()).isEqualTo(0.25);
        assertThat(config.getNoiseLevel()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Unparseable numbers fail fast")
    void shouldRejectUnparseableNumber() {
        assertThatThrownBy(() -> RunnerConfig.fromEnvironment(Map.of("HTTP_PORT", "eighty")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    @DisplayName("Out-of-range values are rejected")
    void shouldRejectOutOfRange() {
        assertThatThrownBy(() -> RunnerConfig.fromEnvironment(Map.of("HTTP_PORT", "70000")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("httpPort");
        assertThatThrownBy(() -> RunnerConfig.fromEnvironment(Map.of("STREAM_ANOMALY_CHANCE", "1.5")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("anomalyChance");
        assertThatThrownBy(() -> new RunnerConfig.Builder().noiseLevel(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("noiseLevel");
        assertThatThrownBy(() -> new RunnerConfig.Builder().maxPoints(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
