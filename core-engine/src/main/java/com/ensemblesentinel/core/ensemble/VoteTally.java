package com.ensemblesentinel.core.ensemble;

import com.ensemblesentinel.core.model.DataPoint;
import com.ensemblesentinel.core.model.Verdict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Votes collected for one data point.
 *
 * <p>
 * Built by the coordinator while it fans verdicts in, then returned to the
 * caller of {@link EnsembleCoordinator#process(DataPoint)} as a read-only
 * record of the decision.
 * </p>
 */
public final class VoteTally {

    private final DataPoint point;
    private final int quorum;
    private final List<String> detectorNames;
    private final Map<String, Verdict> received = new LinkedHashMap<>();

    VoteTally(DataPoint point, int quorum, List<String> detectorNames) {
        this.point = Objects.requireNonNull(point, "point must not be null");
        this.quorum = quorum;
        this.detectorNames = List.copyOf(detectorNames);
    }

    /**
     * Record a verdict. A second verdict from the same detector is ignored.
     *
     * @return {@code true} if the verdict was counted
     */
    boolean record(Verdict verdict) {
        return received.putIfAbsent(verdict.getDetectorName(), verdict) == null;
    }

    public DataPoint getPoint() {
        return point;
    }

    public int getQuorum() {
        return quorum;
    }

    /** Verdicts that arrived in time, failed ones included. */
    public int getVotesReceived() {
        return received.size();
    }

    public int getVotesPositive() {
        int positive = 0;
        for (Verdict verdict : received.values()) {
            if (verdict.isAnomalous()) {
                positive++;
            }
        }
        return positive;
    }

    /** Names of detectors whose worker reported a failure for this point. */
    public List<String> getFailedDetectors() {
        List<String> failed = new ArrayList<>();
        for (Verdict verdict : received.values()) {
            if (verdict.isFailed()) {
                failed.add(verdict.getDetectorName());
            }
        }
        return Collections.unmodifiableList(failed);
    }

    /** Names of detectors that did not answer in time. */
    public List<String> getMissingDetectors() {
        List<String> missing = new ArrayList<>();
        for (String name : detectorNames) {
            if (!received.containsKey(name)) {
                missing.add(name);
            }
        }
        return Collections.unmodifiableList(missing);
    }

    public boolean isAnomalous() {
        return getVotesPositive() >= quorum;
    }

    @Override
    public String toString() {
        return "VoteTally{" +
                "point=" + point +
                ", votesReceived=" + getVotesReceived() +
                ", votesPositive=" + getVotesPositive() +
                ", quorum=" + quorum +
                '}';
    }
}
