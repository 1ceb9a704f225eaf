package com.ensemblesentinel.runner;

import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration for the Ensemble Sentinel runner.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the runner is configurable from a container definition or a shell without any
 * command-line flags.
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
public final class RunnerConfig {

    // ---------------------------------------------------------------
    // Ensemble
    // ---------------------------------------------------------------
    private final String ensembleConfigPath;

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------
    private final int httpPort;

    // ---------------------------------------------------------------
    // Synthetic stream
    // ---------------------------------------------------------------
    private final long streamIntervalMs;
    private final long maxPoints;
    private final long seed;
    private final double noiseLevel;
    private final double anomalyChance;
    private final double amplitude;
    private final double anomalyMagnitude;

    private RunnerConfig(Builder b) {
        this.ensembleConfigPath = b.ensembleConfigPath;
        this.httpPort = b.httpPort;
        this.streamIntervalMs = b.streamIntervalMs;
        this.maxPoints = b.maxPoints;
        this.seed = b.seed;
        this.noiseLevel = b.noiseLevel;
        this.anomalyChance = b.anomalyChance;
        this.amplitude = b.amplitude;
        this.anomalyMagnitude = b.anomalyMagnitude;
    }

    // ---------------------------------------------------------------
    // Factory
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunnerConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link RunnerConfig} from the given variables.
     *
     * @param env variable name to value
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    static RunnerConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "environment must not be null");
        try {
            return new Builder()
                    .ensembleConfigPath(env(env, "ENSEMBLE_CONFIG_PATH", ""))
                    .httpPort(Integer.parseInt(env(env, "HTTP_PORT", "8080")))
                    .streamIntervalMs(Long.parseLong(env(env, "STREAM_INTERVAL_MS", "100")))
                    .maxPoints(Long.parseLong(env(env, "STREAM_MAX_POINTS", "0")))
                    .seed(Long.parseLong(env(env, "STREAM_SEED", "42")))
                    .noiseLevel(Double.parseDouble(env(env, "STREAM_NOISE_LEVEL", "2.0")))
                    .anomalyChance(Double.parseDouble(env(env, "STREAM_ANOMALY_CHANCE", "0.1")))
                    .amplitude(Double.parseDouble(env(env, "STREAM_AMPLITUDE", "5.0")))
                    .anomalyMagnitude(Double.parseDouble(env(env, "STREAM_ANOMALY_MAGNITUDE", "25.0")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return a streamer configured with this configuration's parameters
     */
    public SyntheticDataStreamer newStreamer() {
        return new SyntheticDataStreamer(seed, noiseLevel, anomalyChance, amplitude, anomalyMagnitude);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getEnsembleConfigPath() {
        return ensembleConfigPath;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public long getStreamIntervalMs() {
        return streamIntervalMs;
    }

    /** Number of points to stream before stopping; 0 means unbounded. */
    public long getMaxPoints() {
        return maxPoints;
    }

    public long getSeed() {
        return seed;
    }

    public double getNoiseLevel() {
        return noiseLevel;
    }

    public double getAnomalyChance() {
        return anomalyChance;
    }

    public double getAmplitude() {
        return amplitude;
    }

    public double getAnomalyMagnitude() {
        return anomalyMagnitude;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (port in [0, 65535] where 0 picks a free port, interval &gt;= 0,
     * max points &gt;= 0, noise &gt;= 0, anomaly chance in [0, 1]).
     * </p>
     */
    public static class Builder {
        private String ensembleConfigPath = "";
        private int httpPort = 8080;
        private long streamIntervalMs = 100;
        private long maxPoints = 0;
        private long seed = 42;
        private double noiseLevel = SyntheticDataStreamer.DEFAULT_NOISE_LEVEL;
        private double anomalyChance = SyntheticDataStreamer.DEFAULT_ANOMALY_CHANCE;
        private double amplitude = SyntheticDataStreamer.DEFAULT_AMPLITUDE;
        private double anomalyMagnitude = SyntheticDataStreamer.DEFAULT_ANOMALY_MAGNITUDE;

        public Builder ensembleConfigPath(String v) {
            this.ensembleConfigPath = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder streamIntervalMs(long v) {
            this.streamIntervalMs = v;
            return this;
        }

        public Builder maxPoints(long v) {
            this.maxPoints = v;
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Builder noiseLevel(double v) {
            this.noiseLevel = v;
            return this;
        }

        public Builder anomalyChance(double v) {
            this.anomalyChance = v;
            return this;
        }

        public Builder amplitude(double v) {
            this.amplitude = v;
            return this;
        }

        public Builder anomalyMagnitude(double v) {
            this.anomalyMagnitude = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            Objects.requireNonNull(ensembleConfigPath, "ensembleConfigPath required");

            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (streamIntervalMs < 0) {
                throw new IllegalArgumentException("streamIntervalMs must be >= 0, got: " + streamIntervalMs);
            }
            if (maxPoints < 0) {
                throw new IllegalArgumentException("maxPoints must be >= 0, got: " + maxPoints);
            }
            requireFinite(amplitude, "amplitude");
            requireFinite(anomalyMagnitude, "anomalyMagnitude");
            if (!(noiseLevel >= 0) || !Double.isFinite(noiseLevel)) {
                throw new IllegalArgumentException("noiseLevel must be a finite number >= 0, got: " + noiseLevel);
            }
            if (!(anomalyChance >= 0 && anomalyChance <= 1)) {
                throw new IllegalArgumentException("anomalyChance must be in [0, 1], got: " + anomalyChance);
            }

            return new RunnerConfig(this);
        }

        private static void requireFinite(double value, String name) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException(name + " must be finite, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "ensembleConfigPath='" + ensembleConfigPath + '\'' +
                ", httpPort=" + httpPort +
                ", streamIntervalMs=" + streamIntervalMs +
                ", maxPoints=" + maxPoints +
                ", seed=" + seed +
                ", noiseLevel=" + noiseLevel +
                ", anomalyChance=" + anomalyChance +
                ", amplitude=" + amplitude +
                ", anomalyMagnitude=" + anomalyMagnitude +
                '}';
    }
}
