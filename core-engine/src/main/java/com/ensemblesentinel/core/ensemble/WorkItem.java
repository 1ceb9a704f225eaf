package com.ensemblesentinel.core.ensemble;

import com.ensemblesentinel.core.model.DataPoint;

/**
 * Entry on a worker's inbound queue: either one point of a fan-out round or
 * the {@link #SHUTDOWN} sentinel.
 */
final class WorkItem {

    /** Sentinel that tells a worker to stop. Compared by identity. */
    static final WorkItem SHUTDOWN = new WorkItem(-1, null);

    private final long sequence;
    private final DataPoint point;

    private WorkItem(long sequence, DataPoint point) {
        this.sequence = sequence;
        this.point = point;
    }

    static WorkItem of(long sequence, DataPoint point) {
        return new WorkItem(sequence, point);
    }

    boolean isShutdown() {
        return this == SHUTDOWN;
    }

    long getSequence() {
        return sequence;
    }

    DataPoint getPoint() {
        return point;
    }
}
