package com.ensemblesentinel.core.detection;

import com.ensemblesentinel.core.config.ConfigurationException;
import com.ensemblesentinel.core.config.DetectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link DetectorConfig} configurations.
 *
 * <p>
 * This is the single point of extension when adding new detector variants:
 * add the type to {@link com.ensemblesentinel.core.model.DetectorType} and
 * map it to its implementation here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // not instantiable
    }

    /**
     * Create a detector for the given configuration.
     *
     * @param config the detector configuration; must not be {@code null}
     * @return a new detector with an empty window
     * @throws NullPointerException   if {@code config} is {@code null}
     * @throws ConfigurationException if the configuration is invalid
     */
    public static AnomalyDetector create(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        config.validate();

        return switch (config.resolveType()) {
            case ZSCORE -> new ZScoreDetector(config);
            case MOVING_AVERAGE -> new MovingAverageDetector(config);
            case IQR -> new IqrDetector(config);
        };
    }

    /**
     * Create detectors for every configuration in the supplied list.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>. Detector names must
     * be unique because verdicts are attributed by name.
     * </p>
     *
     * @param configs detector configurations; must not be {@code null}
     * @return unmodifiable list of detectors (one per configuration)
     * @throws NullPointerException   if {@code configs} is {@code null}
     * @throws ConfigurationException if any configuration is invalid or two
     *                                share a name
     */
    public static List<AnomalyDetector> createAll(List<DetectorConfig> configs) {
        Objects.requireNonNull(configs, "Detector configuration list must not be null");
        Set<String> names = new HashSet<>();
        for (DetectorConfig config : configs) {
            Objects.requireNonNull(config, "Detector configuration must not be null");
            if (config.getName() != null && !names.add(config.getName())) {
                throw new ConfigurationException("Duplicate detector name: '" + config.getName() + "'");
            }
        }
        LOG.info("Creating {} detector(s) from configuration", configs.size());
        return configs.stream()
                .map(DetectorFactory::create)
                .toList();
    }
}
