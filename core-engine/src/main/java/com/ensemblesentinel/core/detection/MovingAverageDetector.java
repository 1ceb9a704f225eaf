package com.ensemblesentinel.core.detection;

import com.ensemblesentinel.core.config.ConfigurationException;
import com.ensemblesentinel.core.config.DetectorConfig;
import com.ensemblesentinel.core.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moving-average detector.
 *
 * <p>
 * Compares the latest value with the mean of the values that precede it in
 * the window. The latest value is an outlier when it deviates from that
 * moving average by more than {@code threshold × σ}, where σ is the
 * population standard deviation of the same preceding values.
 * </p>
 *
 * <p>
 * The latest value is excluded from its own baseline, so a capacity of at
 * least 2 is required.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageDetector extends SlidingWindowDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MovingAverageDetector.class);

    static final int MIN_WINDOW_CAPACITY = 2;

    public MovingAverageDetector() {
        this(DetectorConfig.defaults(DetectorType.MOVING_AVERAGE));
    }

    public MovingAverageDetector(String name, int windowCapacity, double threshold) {
        super(DetectorType.MOVING_AVERAGE, name, windowCapacity, threshold);
        requireMinimumCapacity();
    }

    public MovingAverageDetector(DetectorConfig config) {
        super(DetectorType.MOVING_AVERAGE, config);
        requireMinimumCapacity();
    }

    private void requireMinimumCapacity() {
        if (getWindowCapacity() < MIN_WINDOW_CAPACITY) {
            throw new ConfigurationException("windowCapacity must be >= " + MIN_WINDOW_CAPACITY
                    + " for detector '" + getName() + "', got: " + getWindowCapacity());
        }
    }

    @Override
    protected boolean evaluate(double[] values) {
        int baselineSize = values.length - 1;
        double movingAverage = WindowStatistics.mean(values, 0, baselineSize);
        double stddev = WindowStatistics.stdDev(values, 0, baselineSize, movingAverage);

        double latest = values[baselineSize];
        double deviation = Math.abs(latest - movingAverage);
        if (deviation > getThreshold() * stddev) {
            LOG.debug("Detector [{}] fired: value={} movingAverage={} stddev={} deviation={}",
                    getName(), latest, movingAverage, stddev, deviation);
            return true;
        }
        return false;
    }
}
