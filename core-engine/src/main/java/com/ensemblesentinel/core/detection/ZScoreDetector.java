package com.ensemblesentinel.core.detection;

import com.ensemblesentinel.core.config.DetectorConfig;
import com.ensemblesentinel.core.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Z-score detector.
 *
 * <p>
 * Computes the mean and population standard deviation over the whole window,
 * latest value included, and flags the latest value when
 * {@code |latest - mean| / σ > threshold}. A window with zero deviation
 * never fires.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector extends SlidingWindowDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    public ZScoreDetector() {
        this(DetectorConfig.defaults(DetectorType.ZSCORE));
    }

    public ZScoreDetector(String name, int windowCapacity, double threshold) {
        super(DetectorType.ZSCORE, name, windowCapacity, threshold);
    }

    /**
     * @param config detector configuration of type {@code zscore}
     * @throws com.ensemblesentinel.core.config.ConfigurationException if the
     *         configuration is invalid
     */
    public ZScoreDetector(DetectorConfig config) {
        super(DetectorType.ZSCORE, config);
    }

    @Override
    protected boolean evaluate(double[] values) {
        int n = values.length;
        double mean = WindowStatistics.mean(values, 0, n);
        double stddev = WindowStatistics.stdDev(values, 0, n, mean);
        if (stddev == 0) {
            return false;
        }

        double latest = values[n - 1];
        double zScore = Math.abs(latest - mean) / stddev;
        if (zScore > getThreshold()) {
            LOG.debug("Detector [{}] fired: value={} mean={} stddev={} z={}",
                    getName(), latest, mean, stddev, zScore);
            return true;
        }
        return false;
    }
}
