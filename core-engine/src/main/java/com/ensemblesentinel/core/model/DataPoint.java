package com.ensemblesentinel.core.model;

import com.ensemblesentinel.core.validation.DataPointValidator;
import com.ensemblesentinel.core.validation.DataValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single observation in the input time series.
 *
 * <p>
 * Instances are immutable and are handed across thread boundaries by
 * reference; no component ever mutates one after construction.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * {@link #of(double, double)} validates its arguments and is what producers
 * should use. The Jackson creator does <strong>not</strong> validate, so a
 * deserialized point may carry a negative time or a non-finite value; the
 * ensemble coordinator re-validates every point before it enters the
 * pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Timestamp or sequence number of the observation. */
    private final double time;

    /** Observed value. */
    private final double value;

    @JsonCreator
    public DataPoint(@JsonProperty("time") double time, @JsonProperty("value") double value) {
        this.time = time;
        this.value = value;
    }

    /**
     * Create a validated data point.
     *
     * @param time  non-negative timestamp
     * @param value finite value
     * @return a new {@link DataPoint}
     * @throws DataValidationException if {@code time} is negative or either
     *                                 argument is not finite
     */
    public static DataPoint of(double time, double value) {
        DataPoint point = new DataPoint(time, value);
        DataPointValidator.validate(point);
        return point;
    }

    public double getTime() {
        return time;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return Double.compare(time, that.time) == 0
                && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, value);
    }

    @Override
    public String toString() {
        return "DataPoint{time=" + time + ", value=" + value + '}';
    }
}
