package com.ensemblesentinel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The closed set of sliding-window detector variants.
 *
 * <p>
 * Each type carries the defaults used when a configuration omits the window
 * capacity or the threshold. For {@link #IQR} the threshold is the IQR
 * multiplier rather than a number of standard deviations.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorType {

    ZSCORE("zscore", "Z-Score", 30, 2.0),
    MOVING_AVERAGE("moving_average", "Moving Average", 15, 1.5),
    IQR("iqr", "IQR", 30, 1.5);

    private final String id;
    private final String defaultName;
    private final int defaultWindowCapacity;
    private final double defaultThreshold;

    DetectorType(String id, String defaultName, int defaultWindowCapacity, double defaultThreshold) {
        this.id = id;
        this.defaultName = defaultName;
        this.defaultWindowCapacity = defaultWindowCapacity;
        this.defaultThreshold = defaultThreshold;
    }

    /**
     * Resolve a type from its configuration id. Matching ignores case and
     * treats {@code '-'} as {@code '_'}, so {@code "Moving-Average"} resolves
     * to {@link #MOVING_AVERAGE}.
     *
     * @param id configuration id
     * @return the matching type
     * @throws IllegalArgumentException if {@code id} is {@code null} or unknown
     */
    public static DetectorType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Detector type must not be null");
        }
        String normalised = id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DetectorType type : values()) {
            if (type.id.equals(normalised)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown detector type: '" + id
                + "'. Supported: " + supportedIds());
    }

    public static String supportedIds() {
        return Arrays.stream(values())
                .map(DetectorType::getId)
                .collect(Collectors.joining(", "));
    }

    public String getId() {
        return id;
    }

    public String getDefaultName() {
        return defaultName;
    }

    public int getDefaultWindowCapacity() {
        return defaultWindowCapacity;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }
}
