package com.ensemblesentinel.core.config;

import com.ensemblesentinel.core.model.DetectorType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Configuration of a single sliding-window detector.
 *
 * <p>
 * Supported detector types:
 * </p>
 * <ul>
 * <li>{@code zscore}: distance from the window mean in standard
 * deviations</li>
 * <li>{@code moving_average}: distance of the latest value from the mean of
 * the preceding values</li>
 * <li>{@code iqr}: Tukey fences around the interquartile range</li>
 * </ul>
 *
 * <p>
 * {@code windowCapacity} and {@code threshold} are optional; when left unset
 * the defaults of the declared {@link DetectorType} apply. Call
 * {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Detector name used in verdicts, logs and metrics. */
    private String name;

    /** Detector type id: "zscore", "moving_average" or "iqr". */
    private String type;

    /** Number of values held in the sliding window. */
    private Integer windowCapacity;

    /** Standard-deviation multiplier, or IQR factor for the iqr type. */
    private Double threshold;

    /** No-arg constructor required by SnakeYAML. */
    public DetectorConfig() {
    }

    /**
     * Configuration for {@code type} with all defaults applied.
     *
     * @param type detector type; must not be {@code null}
     * @return a new configuration
     */
    public static DetectorConfig defaults(DetectorType type) {
        Objects.requireNonNull(type, "DetectorType must not be null");
        return of(type.getDefaultName(), type, type.getDefaultWindowCapacity(), type.getDefaultThreshold());
    }

    public static DetectorConfig of(String name, DetectorType type, int windowCapacity, double threshold) {
        Objects.requireNonNull(type, "DetectorType must not be null");
        DetectorConfig config = new DetectorConfig();
        config.setName(name);
        config.setType(type.getId());
        config.setWindowCapacity(windowCapacity);
        config.setThreshold(threshold);
        return config;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the configuration can build a detector.
     *
     * @throws ConfigurationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Detector 'name' is required");
        }

        DetectorType resolved = null;
        if (type == null || type.isBlank()) {
            errors.add("Detector '" + name + "' requires 'type'");
        } else {
            try {
                resolved = DetectorType.fromId(type);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (windowCapacity != null && windowCapacity <= 0) {
            errors.add("Detector '" + name + "' requires 'windowCapacity' > 0, got: " + windowCapacity);
        } else if (resolved == DetectorType.MOVING_AVERAGE && windowCapacity != null && windowCapacity < 2) {
            errors.add("Detector '" + name + "' requires 'windowCapacity' >= 2 for type moving_average");
        }
        if (threshold != null && !(threshold > 0 && Double.isFinite(threshold))) {
            errors.add("Detector '" + name + "' requires a finite 'threshold' > 0, got: " + threshold);
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid DetectorConfig: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Resolved values
    // ---------------------------------------------------------------

    /**
     * @return the parsed detector type
     * @throws IllegalArgumentException if the type is missing or unknown
     */
    public DetectorType resolveType() {
        return DetectorType.fromId(type);
    }

    /**
     * @return the configured window capacity, or the type default when unset
     */
    public int effectiveWindowCapacity() {
        return windowCapacity != null ? windowCapacity : resolveType().getDefaultWindowCapacity();
    }

    /**
     * @return the configured threshold, or the type default when unset
     */
    public double effectiveThreshold() {
        return threshold != null ? threshold : resolveType().getDefaultThreshold();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the detector type, normalised to lowercase.
     *
     * @param type type id
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public Integer getWindowCapacity() {
        return windowCapacity;
    }

    public void setWindowCapacity(Integer windowCapacity) {
        this.windowCapacity = windowCapacity;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return Objects.equals(name, that.name)
                && Objects.equals(type, that.type)
                && Objects.equals(windowCapacity, that.windowCapacity)
                && Objects.equals(threshold, that.threshold);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, windowCapacity, threshold);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", windowCapacity=" + windowCapacity +
                ", threshold=" + threshold +
                '}';
    }
}
