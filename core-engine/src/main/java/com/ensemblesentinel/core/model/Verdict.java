package com.ensemblesentinel.core.model;

import java.util.Objects;

/**
 * One detector's judgement for one fan-out round.
 *
 * <p>
 * The {@code sequence} ties the verdict to the round that produced it, so a
 * verdict that arrives after its round has timed out can be recognised and
 * discarded. A {@code failed} verdict means the detector could not classify
 * the point; it counts as a zero vote.
 * </p>
 *
 * @since 1.0.0
 */
public final class Verdict {

    private final String detectorName;
    private final long sequence;
    private final boolean anomalous;
    private final boolean failed;

    private Verdict(String detectorName, long sequence, boolean anomalous, boolean failed) {
        this.detectorName = Objects.requireNonNull(detectorName, "detectorName must not be null");
        this.sequence = sequence;
        this.anomalous = anomalous;
        this.failed = failed;
    }

    public static Verdict of(String detectorName, long sequence, boolean anomalous) {
        return new Verdict(detectorName, sequence, anomalous, false);
    }

    public static Verdict failed(String detectorName, long sequence) {
        return new Verdict(detectorName, sequence, false, true);
    }

    public String getDetectorName() {
        return detectorName;
    }

    public long getSequence() {
        return sequence;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    public boolean isFailed() {
        return failed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Verdict that))
            return false;
        return sequence == that.sequence
                && anomalous == that.anomalous
                && failed == that.failed
                && detectorName.equals(that.detectorName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectorName, sequence, anomalous, failed);
    }

    @Override
    public String toString() {
        return "Verdict{" +
                "detector='" + detectorName + '\'' +
                ", sequence=" + sequence +
                ", anomalous=" + anomalous +
                ", failed=" + failed +
                '}';
    }
}
