package com.ensemblesentinel.core.detection;

import com.ensemblesentinel.core.config.ConfigurationException;
import com.ensemblesentinel.core.config.DetectorConfig;
import com.ensemblesentinel.core.model.DataPoint;
import com.ensemblesentinel.core.model.DetectorType;
import com.ensemblesentinel.core.validation.DataPointValidator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Base class for detectors that judge the latest value against a fixed-size
 * window of recent values.
 *
 * <h3>Window</h3>
 * <p>
 * The window holds at most {@code windowCapacity} values and evicts the
 * oldest first. A point is appended before it is judged, so the rule always
 * sees the just-ingested value as the last element.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * {@link #ingest(DataPoint)} returns {@code false} until the window is full.
 * Only then is {@link #evaluate(double[])} called.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Not thread-safe. The window is mutated only by {@code ingest}, which the
 * ensemble calls from a single worker thread.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class SlidingWindowDetector implements AnomalyDetector {

    private final DetectorType type;
    private final String name;
    private final int windowCapacity;
    private final double threshold;

    /** Most recent values, oldest first. */
    private final Deque<Double> window = new ArrayDeque<>();

    /**
     * @param type           detector variant
     * @param name           non-blank detector name
     * @param windowCapacity number of values to hold; must be &gt; 0
     * @param threshold      rule threshold; must be finite and &gt; 0
     * @throws ConfigurationException if any parameter is invalid
     */
    protected SlidingWindowDetector(DetectorType type, String name, int windowCapacity, double threshold) {
        this.type = Objects.requireNonNull(type, "DetectorType must not be null");
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Detector name must not be null or blank");
        }
        if (windowCapacity <= 0) {
            throw new ConfigurationException(
                    "windowCapacity must be > 0 for detector '" + name + "', got: " + windowCapacity);
        }
        if (!(threshold > 0) || !Double.isFinite(threshold)) {
            throw new ConfigurationException(
                    "threshold must be a finite number > 0 for detector '" + name + "', got: " + threshold);
        }
        this.name = name;
        this.windowCapacity = windowCapacity;
        this.threshold = threshold;
    }

    /**
     * Build from a configuration whose type must equal {@code expectedType}.
     */
    protected SlidingWindowDetector(DetectorType expectedType, DetectorConfig config) {
        this(expectedType, checkedName(expectedType, config),
                config.effectiveWindowCapacity(), config.effectiveThreshold());
    }

    private static String checkedName(DetectorType expectedType, DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        config.validate();
        if (config.resolveType() != expectedType) {
            throw new ConfigurationException("Detector '" + config.getName() + "' has type '"
                    + config.getType() + "', expected '" + expectedType.getId() + "'");
        }
        return config.getName();
    }

    @Override
    public final boolean ingest(DataPoint point) {
        DataPointValidator.requireFiniteValue(point);

        window.addLast(point.getValue());
        if (window.size() > windowCapacity) {
            window.pollFirst();
        }
        if (window.size() < windowCapacity) {
            return false;
        }

        double[] values = new double[window.size()];
        int i = 0;
        for (double v : window) {
            values[i++] = v;
        }
        return evaluate(values);
    }

    /**
     * Apply the detector's rule to a full window.
     *
     * @param values window contents, oldest first; the last element is the
     *               value being judged. Length equals the window capacity.
     * @return {@code true} if the last value is anomalous
     */
    protected abstract boolean evaluate(double[] values);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DetectorType getType() {
        return type;
    }

    public int getWindowCapacity() {
        return windowCapacity;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return number of values currently in the window
     */
    public int windowSize() {
        return window.size();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "name='" + name + '\'' +
                ", windowCapacity=" + windowCapacity +
                ", threshold=" + threshold +
                ", windowSize=" + window.size() +
                '}';
    }
}
