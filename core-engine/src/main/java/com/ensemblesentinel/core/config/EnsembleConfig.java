package com.ensemblesentinel.core.config;

import com.ensemblesentinel.core.model.DetectorType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the ensemble YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * quorum: 2
 * verdictTimeoutMillis: 1000
 * workerPollTimeoutMillis: 200
 * detectors:
 *   - name: Z-Score
 *     type: zscore
 *     windowCapacity: 30
 *     threshold: 2.0
 * </pre>
 *
 * <p>
 * {@code quorum} is optional and defaults to a strict majority of the
 * configured detectors. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final long DEFAULT_VERDICT_TIMEOUT_MILLIS = 1_000;
    public static final long DEFAULT_WORKER_POLL_TIMEOUT_MILLIS = 200;

    private List<DetectorConfig> detectors = new ArrayList<>();

    /** Minimum positive votes for an anomaly; {@code null} means majority. */
    private Integer quorum;

    /** Upper bound on each wait for a worker verdict. */
    private long verdictTimeoutMillis = DEFAULT_VERDICT_TIMEOUT_MILLIS;

    /** Upper bound on each idle wait of a worker for its next point. */
    private long workerPollTimeoutMillis = DEFAULT_WORKER_POLL_TIMEOUT_MILLIS;

    /**
     * The reference ensemble: Z-Score, Moving Average and IQR with their
     * default windows and thresholds, voting by strict majority.
     *
     * @return a new configuration
     */
    public static EnsembleConfig defaults() {
        EnsembleConfig config = new EnsembleConfig();
        config.setDetectors(Arrays.stream(DetectorType.values())
                .map(DetectorConfig::defaults)
                .toList());
        return config;
    }

    /**
     * Strict majority of {@code detectorCount}: {@code ⌈(n + 1) / 2⌉}.
     *
     * @param detectorCount number of voting detectors, at least 1
     * @return the smallest vote count that is more than half
     */
    public static int majorityQuorum(int detectorCount) {
        return detectorCount / 2 + 1;
    }

    /**
     * @return the configured quorum, or the strict majority of the
     *         configured detectors when unset
     */
    public int effectiveQuorum() {
        return quorum != null ? quorum : majorityQuorum(detectors.size());
    }

    /**
     * Validate the ensemble and every detector in it.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws ConfigurationException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (detectors.isEmpty()) {
            errors.add("At least one detector is required");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < detectors.size(); i++) {
            DetectorConfig detector = detectors.get(i);
            if (detector == null) {
                errors.add("Detector at index " + i + " is null");
                continue;
            }
            try {
                detector.validate();
            } catch (ConfigurationException e) {
                errors.add(e.getMessage());
            }
            if (detector.getName() != null && !names.add(detector.getName())) {
                errors.add("Duplicate detector name: '" + detector.getName() + "'");
            }
        }

        if (quorum != null && (quorum < 1 || quorum > detectors.size())) {
            errors.add("quorum must be in [1, " + detectors.size() + "], got: " + quorum);
        }
        if (verdictTimeoutMillis <= 0) {
            errors.add("verdictTimeoutMillis must be > 0, got: " + verdictTimeoutMillis);
        }
        if (workerPollTimeoutMillis <= 0) {
            errors.add("workerPollTimeoutMillis must be > 0, got: " + workerPollTimeoutMillis);
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Ensemble configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    /**
     * Return the detector list. The returned list is
     * <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of detector configurations
     */
    public List<DetectorConfig> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    /**
     * Set the detector list (used by SnakeYAML during deserialization).
     *
     * @param detectors the detector configurations
     */
    public void setDetectors(List<DetectorConfig> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    public Integer getQuorum() {
        return quorum;
    }

    public void setQuorum(Integer quorum) {
        this.quorum = quorum;
    }

    public long getVerdictTimeoutMillis() {
        return verdictTimeoutMillis;
    }

    public void setVerdictTimeoutMillis(long verdictTimeoutMillis) {
        this.verdictTimeoutMillis = verdictTimeoutMillis;
    }

    public long getWorkerPollTimeoutMillis() {
        return workerPollTimeoutMillis;
    }

    public void setWorkerPollTimeoutMillis(long workerPollTimeoutMillis) {
        this.workerPollTimeoutMillis = workerPollTimeoutMillis;
    }

    @Override
    public String toString() {
        return "EnsembleConfig{" +
                "detectors=" + detectors +
                ", quorum=" + quorum +
                ", verdictTimeoutMillis=" + verdictTimeoutMillis +
                ", workerPollTimeoutMillis=" + workerPollTimeoutMillis +
                '}';
    }
}
