package com.ensemblesentinel.runner;

import com.ensemblesentinel.core.config.EnsembleConfig;
import com.ensemblesentinel.core.config.EnsembleConfigLoader;
import com.ensemblesentinel.core.ensemble.EnsembleCoordinator;
import com.ensemblesentinel.core.ensemble.EnsembleMetrics;
import com.ensemblesentinel.core.ensemble.VoteTally;
import com.ensemblesentinel.core.model.DataPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Main entry point for Ensemble Sentinel.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   SyntheticDataStreamer
 *     → EnsembleCoordinator.process (one point at a time)
 *     → anomaly snapshot
 *     → GET /anomalies (visualizer)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Runner settings come from environment variables via {@link RunnerConfig};
 * the detector ensemble comes from YAML via {@link EnsembleConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelRunner.class);

    private SentinelRunner() {
        // not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        RunnerConfig config = RunnerConfig.fromEnvironment();
        LOG.info("Starting Ensemble Sentinel with config: {}", config);

        // 2. Build the ensemble
        EnsembleConfig ensembleConfig = loadEnsemble(config);
        EnsembleMetrics metrics = new EnsembleMetrics(new SimpleMeterRegistry());
        EnsembleCoordinator coordinator = EnsembleCoordinator.fromConfig(ensembleConfig, metrics);
        coordinator.start();

        // 3. Expose the anomaly snapshot, with shutdown hook
        AnomalyHttpServer httpServer = new AnomalyHttpServer(coordinator::snapshot, coordinator::isRunning);
        httpServer.start(config.getHttpPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            httpServer.stop();
            coordinator.close();
        }, "sentinel-shutdown"));

        // 4. Stream
        try {
            long processed = stream(coordinator, config.newStreamer(), config);
            LOG.info("Stream finished after {} point(s); {} anomaly(ies) detected",
                    processed, coordinator.snapshot().size());
        } finally {
            httpServer.stop();
            coordinator.close();
        }
    }

    /**
     * Feed points from {@code source} into the coordinator until the
     * configured limit is reached, the source is exhausted or the thread is
     * interrupted.
     *
     * @return number of points processed
     */
    static long stream(EnsembleCoordinator coordinator, Iterator<DataPoint> source, RunnerConfig config)
            throws InterruptedException {
        long processed = 0;
        long limit = config.getMaxPoints();
        while (source.hasNext() && (limit == 0 || processed < limit)
                && !Thread.currentThread().isInterrupted()) {
            DataPoint point = source.next();
            VoteTally tally = coordinator.process(point);
            processed++;
            if (tally.isAnomalous()) {
                LOG.info("t={} value={} flagged by {} detector(s)",
                        point.getTime(), point.getValue(), tally.getVotesPositive());
            }
            if (config.getStreamIntervalMs() > 0) {
                Thread.sleep(config.getStreamIntervalMs());
            }
        }
        return processed;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EnsembleConfig loadEnsemble(RunnerConfig config) {
        String path = config.getEnsembleConfigPath();
        if (path != null && !path.isBlank()) {
            return EnsembleConfigLoader.fromFile(path);
        }
        return EnsembleConfigLoader.load();
    }
}
