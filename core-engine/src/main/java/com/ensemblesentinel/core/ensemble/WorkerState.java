package com.ensemblesentinel.core.ensemble;

/**
 * Lifecycle of a {@link DetectionWorker}.
 *
 * <pre>
 *   IDLE ──point──▶ PROCESSING ──verdict──▶ IDLE
 *   IDLE ──shutdown sentinel──▶ SHUTDOWN
 * </pre>
 *
 * {@code SHUTDOWN} is terminal.
 */
public enum WorkerState {
    IDLE,
    PROCESSING,
    SHUTDOWN
}
