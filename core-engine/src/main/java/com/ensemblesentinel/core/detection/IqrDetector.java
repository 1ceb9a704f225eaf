package com.ensemblesentinel.core.detection;

import com.ensemblesentinel.core.config.DetectorConfig;
import com.ensemblesentinel.core.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interquartile-range detector.
 *
 * <p>
 * Computes the 25th and 75th percentiles of the full window by linear
 * interpolation and flags the latest value when it falls outside the fences
 * {@code [q1 - factor × IQR, q3 + factor × IQR]}. A window whose quartiles
 * coincide ({@code IQR == 0}) never fires.
 * </p>
 *
 * <p>
 * The configured threshold is used as the IQR factor.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector extends SlidingWindowDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IqrDetector.class);

    public IqrDetector() {
        this(DetectorConfig.defaults(DetectorType.IQR));
    }

    public IqrDetector(String name, int windowCapacity, double factor) {
        super(DetectorType.IQR, name, windowCapacity, factor);
    }

    public IqrDetector(DetectorConfig config) {
        super(DetectorType.IQR, config);
    }

    @Override
    protected boolean evaluate(double[] values) {
        double[] quartiles = WindowStatistics.percentiles(values, 25, 75);
        double q1 = quartiles[0];
        double q3 = quartiles[1];
        double iqr = q3 - q1;
        if (iqr == 0) {
            return false;
        }

        double factor = getThreshold();
        double lowerBound = q1 - factor * iqr;
        double upperBound = q3 + factor * iqr;
        double latest = values[values.length - 1];
        if (latest < lowerBound || latest > upperBound) {
            LOG.debug("Detector [{}] fired: value={} outside [{}, {}] (q1={} q3={})",
                    getName(), latest, lowerBound, upperBound, q1, q3);
            return true;
        }
        return false;
    }
}
