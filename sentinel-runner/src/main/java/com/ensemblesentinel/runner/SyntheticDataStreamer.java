package com.ensemblesentinel.runner;

import com.ensemblesentinel.core.model.DataPoint;

import java.util.Iterator;
import java.util.Random;

/**
 * Endless, seeded generator of a noisy seasonal series with occasional
 * injected spikes.
 *
 * <p>
 * At step {@code t} the value is
 * {@code amplitude × sin(0.1 t) + N(0, noiseLevel)}. After the first
 * {@value #WARM_UP_STEPS} steps, each point has probability
 * {@code anomalyChance} of being shifted by ±{@code anomalyMagnitude}.
 * </p>
 *
 * <p>
 * Not thread-safe and not restartable: every call to {@link #next()} advances
 * the series.
 * </p>
 */
public class SyntheticDataStreamer implements Iterator<DataPoint> {

    static final double DEFAULT_NOISE_LEVEL = 2.0;
    static final double DEFAULT_ANOMALY_CHANCE = 0.1;
    static final double DEFAULT_AMPLITUDE = 5.0;
    static final double DEFAULT_ANOMALY_MAGNITUDE = 25.0;

    /** Steps before spikes may be injected. */
    static final int WARM_UP_STEPS = 30;

    private static final double FREQUENCY = 0.1;

    private final Random random;
    private final double noiseLevel;
    private final double anomalyChance;
    private final double amplitude;
    private final double anomalyMagnitude;

    private long t;

    public SyntheticDataStreamer(long seed) {
        this(seed, DEFAULT_NOISE_LEVEL, DEFAULT_ANOMALY_CHANCE, DEFAULT_AMPLITUDE, DEFAULT_ANOMALY_MAGNITUDE);
    }

    public SyntheticDataStreamer(long seed, double noiseLevel, double anomalyChance,
            double amplitude, double anomalyMagnitude) {
        this.random = new Random(seed);
        this.noiseLevel = noiseLevel;
        this.anomalyChance = anomalyChance;
        this.amplitude = amplitude;
        this.anomalyMagnitude = anomalyMagnitude;
    }

    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public DataPoint next() {
        double value = amplitude * Math.sin(FREQUENCY * t) + random.nextGaussian() * noiseLevel;
        if (random.nextDouble() < anomalyChance && t > WARM_UP_STEPS) {
            value += random.nextBoolean() ? anomalyMagnitude : -anomalyMagnitude;
        }
        DataPoint point = DataPoint.of(t, value);
        t++;
        return point;
    }
}
