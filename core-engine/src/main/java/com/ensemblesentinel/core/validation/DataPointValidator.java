package com.ensemblesentinel.core.validation;

import com.ensemblesentinel.core.model.DataPoint;

/**
 * Shape checks applied to every data point before it reaches a detector.
 *
 * <p>
 * A valid point has a finite, non-negative {@code time} and a finite
 * {@code value}. {@code NaN} and infinities are rejected for both fields.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPointValidator {

    private DataPointValidator() {
        // not instantiable
    }

    /**
     * Validate a data point.
     *
     * @param point the point to check
     * @return the same point, for chaining
     * @throws DataValidationException if the point is {@code null} or malformed
     */
    public static DataPoint validate(DataPoint point) {
        if (point == null) {
            throw new DataValidationException("Data point must not be null");
        }
        double time = point.getTime();
        if (!Double.isFinite(time) || time < 0) {
            throw new DataValidationException(
                    "Invalid time value: " + time + ". Must be a finite, non-negative number.");
        }
        requireFiniteValue(point);
        return point;
    }

    /**
     * Check only the value of a point. Detectors use this, since the window
     * holds values and has no interest in the timestamp.
     *
     * @param point the point to check
     * @throws DataValidationException if the point is {@code null} or its value
     *                                 is not finite
     */
    public static void requireFiniteValue(DataPoint point) {
        if (point == null) {
            throw new DataValidationException("Data point must not be null");
        }
        double value = point.getValue();
        if (!Double.isFinite(value)) {
            throw new DataValidationException(
                    "Invalid data value: " + value + ". Must be a finite number.");
        }
    }
}
