/**
 * Concurrent detector ensemble.
 *
 * <p>
 * {@link com.ensemblesentinel.core.ensemble.EnsembleCoordinator} owns one
 * {@link com.ensemblesentinel.core.ensemble.DetectionWorker} per detector,
 * fans each data point out to all of them, collects one
 * {@link com.ensemblesentinel.core.model.Verdict} per worker and records the
 * point in the {@link com.ensemblesentinel.core.ensemble.AnomalyStore} when
 * the positive votes reach the quorum.
 * </p>
 *
 * <h3>Threading</h3>
 * <ul>
 * <li>Each detector window is confined to its worker thread.</li>
 * <li>The verdict queue is the only structure shared by all workers.</li>
 * <li>The anomaly store is written by the coordinator only and read through
 * immutable snapshots.</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ensemblesentinel.core.ensemble;
