package com.ensemblesentinel.core.detection;

import java.util.Arrays;

/**
 * Descriptive statistics over a slice of a value window.
 *
 * <p>
 * All methods take a half-open range {@code [from, to)} so callers can
 * exclude the latest value without copying the array.
 * </p>
 */
final class WindowStatistics {

    private WindowStatistics() {
        // not instantiable
    }

    static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /** Population standard deviation (divides by n, not n - 1). */
    static double stdDev(double[] values, int from, int to, double mean) {
        double sumSquaredDiff = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (to - from));
    }

    /**
     * Percentiles by linear interpolation between the two closest ranks,
     * where rank = {@code p / 100 * (n - 1)} over the sorted values.
     *
     * @param values      window values, not modified
     * @param percentiles requested percentiles in [0, 100]
     * @return one result per requested percentile, in order
     */
    static double[] percentiles(double[] values, double... percentiles) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double[] result = new double[percentiles.length];
        for (int i = 0; i < percentiles.length; i++) {
            result[i] = interpolate(sorted, percentiles[i]);
        }
        return result;
    }

    private static double interpolate(double[] sorted, double percentile) {
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
