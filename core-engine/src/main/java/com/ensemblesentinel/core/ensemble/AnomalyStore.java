package com.ensemblesentinel.core.ensemble;

import com.ensemblesentinel.core.model.DataPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only record of the points the ensemble classified as anomalous.
 *
 * <p>
 * Only the coordinator appends. Readers get an immutable copy, so they never
 * observe a partially applied append. The list is not bounded; retention is
 * left to the caller.
 * </p>
 */
public final class AnomalyStore {

    private final List<DataPoint> anomalies = new ArrayList<>();

    synchronized void append(DataPoint point) {
        anomalies.add(Objects.requireNonNull(point, "Anomalous point must not be null"));
    }

    /**
     * @return immutable copy of the anomalies, in arrival order
     */
    public synchronized List<DataPoint> snapshot() {
        return List.copyOf(anomalies);
    }

    public synchronized int size() {
        return anomalies.size();
    }
}
