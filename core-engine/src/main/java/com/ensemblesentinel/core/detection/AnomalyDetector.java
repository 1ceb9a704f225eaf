package com.ensemblesentinel.core.detection;

import com.ensemblesentinel.core.model.DataPoint;
import com.ensemblesentinel.core.model.DetectorType;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateful</strong>: each call to
 * {@link #ingest(DataPoint)} adds the point to the detector's history before
 * classifying it. Detectors are not thread-safe; the ensemble confines each
 * instance to a single worker thread.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Record a data point and decide whether it is anomalous.
     *
     * @param point the incoming point
     * @return {@code true} if the point is anomalous, {@code false} if it is
     *         normal or the detector cannot decide yet
     * @throws com.ensemblesentinel.core.validation.DataValidationException if
     *         the point is {@code null} or its value is not finite; the point
     *         is not recorded in that case
     */
    boolean ingest(DataPoint point);

    /**
     * Return the unique name of this detector.
     *
     * @return detector name
     */
    String getName();

    /**
     * @return the detector variant
     */
    DetectorType getType();
}
