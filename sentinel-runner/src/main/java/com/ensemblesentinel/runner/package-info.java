/**
 * Process wiring for Ensemble Sentinel.
 *
 * <p>
 * This package drives the core ensemble with a synthetic data stream and
 * exposes the anomalies it finds over HTTP.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.ensemblesentinel.runner.SentinelRunner}: main entry
 * point</li>
 * <li>{@link com.ensemblesentinel.runner.RunnerConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.ensemblesentinel.runner.SyntheticDataStreamer}: seeded
 * seasonal series with injected spikes</li>
 * <li>{@link com.ensemblesentinel.runner.AnomalyHttpServer}: anomaly
 * snapshot and health/readiness endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ensemblesentinel.runner;
