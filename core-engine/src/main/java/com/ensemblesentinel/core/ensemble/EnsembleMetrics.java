package com.ensemblesentinel.core.ensemble;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Metric definitions for the detector ensemble.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code ensemble.points.processed}: points that completed a vote</li>
 * <li>{@code ensemble.points.rejected}: points that failed validation</li>
 * <li>{@code ensemble.anomalies.detected}: points that reached quorum</li>
 * <li>{@code ensemble.verdicts.timeout}: verdicts that did not arrive in
 * time</li>
 * <li>{@code ensemble.worker.failures}: detector errors contained by a
 * worker</li>
 * <li>{@code ensemble.fanout.skipped}: points not sent to a worker whose
 * queue was full</li>
 * <li>{@code ensemble.process.latency}: time from fan-out to decision</li>
 * </ul>
 *
 * <p>
 * Counters are shared by the coordinator thread and every worker thread;
 * Micrometer meters are thread-safe.
 * </p>
 */
public class EnsembleMetrics {

    private final MeterRegistry registry;
    private final Counter pointsProcessed;
    private final Counter pointsRejected;
    private final Counter anomaliesDetected;
    private final Counter verdictTimeouts;
    private final Counter workerFailures;
    private final Counter skippedSubmissions;
    private final Timer processLatency;

    public EnsembleMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

        this.pointsProcessed = Counter.builder("ensemble.points.processed")
                .description("Data points that completed a vote")
                .register(registry);
        this.pointsRejected = Counter.builder("ensemble.points.rejected")
                .description("Data points rejected by validation")
                .register(registry);
        this.anomaliesDetected = Counter.builder("ensemble.anomalies.detected")
                .description("Data points classified as anomalous")
                .register(registry);
        this.verdictTimeouts = Counter.builder("ensemble.verdicts.timeout")
                .description("Detector verdicts that did not arrive within the wait bound")
                .register(registry);
        this.workerFailures = Counter.builder("ensemble.worker.failures")
                .description("Detector failures contained by their worker")
                .register(registry);
        this.skippedSubmissions = Counter.builder("ensemble.fanout.skipped")
                .description("Data points not sent to a worker with a full backlog")
                .register(registry);
        this.processLatency = Timer.builder("ensemble.process.latency")
                .description("Time from fan-out to decision for one data point")
                .register(registry);
    }

    /**
     * Metrics backed by a private in-memory registry.
     *
     * @return a new instance
     */
    public static EnsembleMetrics inMemory() {
        return new EnsembleMetrics(new SimpleMeterRegistry());
    }

    public void incrementPointsProcessed() {
        pointsProcessed.increment();
    }

    public void incrementPointsRejected() {
        pointsRejected.increment();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.increment();
    }

    public void incrementVerdictTimeouts(int count) {
        verdictTimeouts.increment(count);
    }

    public void incrementWorkerFailures() {
        workerFailures.increment();
    }

    public void incrementSkippedSubmissions() {
        skippedSubmissions.increment();
    }

    public void recordLatency(long nanos) {
        processLatency.record(nanos, TimeUnit.NANOSECONDS);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public long pointsProcessed() {
        return (long) pointsProcessed.count();
    }

    public long pointsRejected() {
        return (long) pointsRejected.count();
    }

    public long anomaliesDetected() {
        return (long) anomaliesDetected.count();
    }

    public long verdictTimeouts() {
        return (long) verdictTimeouts.count();
    }

    public long workerFailures() {
        return (long) workerFailures.count();
    }

    public long skippedSubmissions() {
        return (long) skippedSubmissions.count();
    }
}
