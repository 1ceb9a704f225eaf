package com.ensemblesentinel.core.ensemble;

import com.ensemblesentinel.core.config.ConfigurationException;
import com.ensemblesentinel.core.config.EnsembleConfig;
import com.ensemblesentinel.core.detection.AnomalyDetector;
import com.ensemblesentinel.core.detection.DetectorFactory;
import com.ensemblesentinel.core.model.DataPoint;
import com.ensemblesentinel.core.model.Verdict;
import com.ensemblesentinel.core.validation.DataPointValidator;
import com.ensemblesentinel.core.validation.DataValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a set of detectors concurrently and classifies each data point by
 * vote.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   process(point)
 *     → validate
 *     → fan out to every worker's inbound queue (skipping workers with a full backlog)
 *     → fan in: one bounded wait per submitted worker, until all have answered
 *     → anomalous iff positive votes ≥ quorum
 *     → append to the anomaly store
 * </pre>
 *
 * <h3>Ordering</h3>
 * <p>
 * {@link #process(DataPoint)} is serialized: fan-out for a point starts only
 * after the previous point's decision is final, so anomalies are stored in
 * arrival order. Every fan-out round carries a sequence number and verdicts
 * from an earlier round that arrive late are discarded.
 * </p>
 *
 * <h3>Degradation</h3>
 * <p>
 * A worker that does not answer in time, or whose detector fails, costs one
 * vote for that point and nothing more. A timed-out wait does not end the
 * round: the coordinator keeps waiting, one bounded wait per outstanding
 * verdict, so a slow worker can still be counted. A worker that already has
 * {@value #MAX_WORKER_BACKLOG} points queued is not sent the point at all and
 * counts as a zero vote, so a hung detector's queue stays bounded.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} launches one thread per detector; {@link #close()} sends
 * each worker the shutdown sentinel and waits a bounded time for them to
 * exit.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleCoordinator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleCoordinator.class);

    /** Queued points above which a worker is left out of a fan-out round. */
    static final int MAX_WORKER_BACKLOG = 8;

    private enum Lifecycle {
        NEW, RUNNING, CLOSED
    }

    private final List<DetectionWorker> workers;
    private final List<String> detectorNames;
    private final BlockingQueue<Verdict> verdicts = new LinkedBlockingQueue<>();
    private final int quorum;
    private final long verdictTimeoutMillis;
    private final Duration shutdownTimeout;
    private final EnsembleMetrics metrics;
    private final AnomalyStore anomalies = new AnomalyStore();
    private final ExecutorService executor;

    private volatile Lifecycle lifecycle = Lifecycle.NEW;

    /** Fan-out round counter; guarded by {@code this}. */
    private long sequence;

    private EnsembleCoordinator(Builder b) {
        this.quorum = b.quorum != null ? b.quorum : EnsembleConfig.majorityQuorum(b.detectors.size());
        this.verdictTimeoutMillis = b.verdictTimeout.toMillis();
        this.metrics = b.metrics != null ? b.metrics : EnsembleMetrics.inMemory();
        this.shutdownTimeout = b.verdictTimeout.plus(b.workerPollTimeout).multipliedBy(2);

        List<DetectionWorker> created = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (AnomalyDetector detector : b.detectors) {
            created.add(new DetectionWorker(detector, verdicts, b.workerPollTimeout, metrics));
            names.add(detector.getName());
        }
        this.workers = Collections.unmodifiableList(created);
        this.detectorNames = Collections.unmodifiableList(names);

        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers.size(), r -> {
            Thread t = new Thread(r, "ensemble-worker-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Build a coordinator from a validated configuration.
     *
     * @param config  ensemble configuration; must not be {@code null}
     * @param metrics metrics sink; must not be {@code null}
     * @return a new, not yet started coordinator
     * @throws ConfigurationException if the configuration is invalid
     */
    public static EnsembleCoordinator fromConfig(EnsembleConfig config, EnsembleMetrics metrics) {
        Objects.requireNonNull(config, "EnsembleConfig must not be null");
        Objects.requireNonNull(metrics, "EnsembleMetrics must not be null");
        config.validate();
        return builder()
                .detectors(DetectorFactory.createAll(config.getDetectors()))
                .quorum(config.effectiveQuorum())
                .verdictTimeout(Duration.ofMillis(config.getVerdictTimeoutMillis()))
                .workerPollTimeout(Duration.ofMillis(config.getWorkerPollTimeoutMillis()))
                .metrics(metrics)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start one worker thread per detector.
     *
     * @throws IllegalStateException if the coordinator was already started or
     *                               has been closed
     */
    public synchronized void start() {
        if (lifecycle != Lifecycle.NEW) {
            throw new IllegalStateException("Ensemble cannot be started in state " + lifecycle);
        }
        workers.forEach(executor::execute);
        lifecycle = Lifecycle.RUNNING;
        LOG.info("Ensemble started with {} worker(s) {} and quorum {}", workers.size(), detectorNames, quorum);
    }

    /**
     * Stop all workers. Safe to call more than once.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (lifecycle == Lifecycle.CLOSED) {
                return;
            }
            lifecycle = Lifecycle.CLOSED;
        }
        workers.forEach(DetectionWorker::shutdown);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Workers did not stop within {}, interrupting", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Ensemble stopped; {} anomaly(ies) recorded", anomalies.size());
    }

    public boolean isRunning() {
        return lifecycle == Lifecycle.RUNNING;
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Classify one data point.
     *
     * <p>
     * When this method returns, the anomaly store already reflects the
     * decision.
     * </p>
     *
     * @param point the point to classify
     * @return the votes collected for the point
     * @throws DataValidationException if the point is malformed; no worker
     *                                 sees it
     * @throws IllegalStateException   if the ensemble is not running
     */
    public synchronized VoteTally process(DataPoint point) {
        try {
            DataPointValidator.validate(point);
        } catch (DataValidationException e) {
            metrics.incrementPointsRejected();
            throw e;
        }
        if (lifecycle != Lifecycle.RUNNING) {
            throw new IllegalStateException("Ensemble is not running (state " + lifecycle + ")");
        }

        long startNanos = System.nanoTime();
        long round = ++sequence;

        int submitted = fanOut(round, point);
        VoteTally tally = collectVerdicts(round, point, submitted);

        if (tally.isAnomalous()) {
            anomalies.append(point);
            metrics.incrementAnomaliesDetected();
            LOG.info("Anomaly recorded: {} ({} of {} vote(s), quorum {})",
                    point, tally.getVotesPositive(), workers.size(), quorum);
        }

        metrics.incrementPointsProcessed();
        metrics.recordLatency(System.nanoTime() - startNanos);
        return tally;
    }

    /**
     * @return number of workers the point was submitted to
     */
    private int fanOut(long round, DataPoint point) {
        int submitted = 0;
        for (DetectionWorker worker : workers) {
            int backlog = worker.backlog();
            if (backlog >= MAX_WORKER_BACKLOG) {
                LOG.warn("Worker [{}] has {} point(s) queued, not sending {}; counting as no vote",
                        worker.getDetectorName(), backlog, point);
                metrics.incrementSkippedSubmissions();
                continue;
            }
            worker.submit(round, point);
            submitted++;
        }
        return submitted;
    }

    /**
     * Make one bounded wait per submitted worker. A timed-out wait is charged
     * as one zero vote and the next wait starts; the round ends when every
     * submitted worker has answered or all waits are used up.
     */
    private VoteTally collectVerdicts(long round, DataPoint point, int submitted) {
        VoteTally tally = new VoteTally(point, quorum, detectorNames);
        try {
            for (int wait = 0; wait < submitted && tally.getVotesReceived() < submitted; wait++) {
                Verdict verdict = awaitVerdict(round);
                if (verdict == null) {
                    LOG.warn("Timed out after {} ms waiting for verdict(s) from {} for {}, counting as no vote",
                            verdictTimeoutMillis, describeMissing(tally), point);
                    metrics.incrementVerdictTimeouts(1);
                    continue;
                }
                tally.record(verdict);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while collecting verdicts for {}, deciding on {} vote(s)",
                    point, tally.getVotesReceived());
        }
        return tally;
    }

    private String describeMissing(VoteTally tally) {
        List<String> missing = tally.getMissingDetectors();
        StringBuilder sb = new StringBuilder("[");
        for (DetectionWorker worker : workers) {
            if (missing.contains(worker.getDetectorName())) {
                if (sb.length() > 1) {
                    sb.append(", ");
                }
                sb.append(worker.getDetectorName()).append(" (backlog ").append(worker.backlog()).append(')');
            }
        }
        return sb.append(']').toString();
    }

    /**
     * Wait for the next verdict of {@code round}, skipping stale ones.
     *
     * @return the verdict, or {@code null} if none arrived within the timeout
     */
    private Verdict awaitVerdict(long round) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(verdictTimeoutMillis);
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            Verdict verdict = verdicts.poll(remaining, TimeUnit.NANOSECONDS);
            if (verdict == null) {
                return null;
            }
            if (verdict.getSequence() == round) {
                return verdict;
            }
            LOG.debug("Discarding stale verdict {} while collecting round {}", verdict, round);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return immutable copy of the anomalies recorded so far, in arrival
     *         order
     */
    public List<DataPoint> snapshot() {
        return anomalies.snapshot();
    }

    public int getQuorum() {
        return quorum;
    }

    public List<String> getDetectorNames() {
        return detectorNames;
    }

    /**
     * @return current state of every worker, keyed by detector name
     */
    public Map<String, WorkerState> workerStates() {
        Map<String, WorkerState> states = new LinkedHashMap<>();
        for (DetectionWorker worker : workers) {
            states.put(worker.getDetectorName(), worker.getState());
        }
        return Collections.unmodifiableMap(states);
    }

    /**
     * @return points queued but not yet taken by each worker, keyed by
     *         detector name
     */
    public Map<String, Integer> workerBacklogs() {
        Map<String, Integer> backlogs = new LinkedHashMap<>();
        for (DetectionWorker worker : workers) {
            backlogs.put(worker.getDetectorName(), worker.backlog());
        }
        return Collections.unmodifiableMap(backlogs);
    }

    public EnsembleMetrics getMetrics() {
        return metrics;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EnsembleCoordinator}.
     *
     * <p>
     * {@link #build()} validates that at least one detector is present,
     * detector names are unique, the quorum lies in {@code [1, N]} and both
     * timeouts are positive. Unset values fall back to the defaults of
     * {@link EnsembleConfig}.
     * </p>
     */
    public static class Builder {
        private List<AnomalyDetector> detectors = new ArrayList<>();
        private Integer quorum;
        private Duration verdictTimeout = Duration.ofMillis(EnsembleConfig.DEFAULT_VERDICT_TIMEOUT_MILLIS);
        private Duration workerPollTimeout = Duration.ofMillis(EnsembleConfig.DEFAULT_WORKER_POLL_TIMEOUT_MILLIS);
        private EnsembleMetrics metrics;

        public Builder detectors(List<? extends AnomalyDetector> v) {
            this.detectors = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder detector(AnomalyDetector v) {
            this.detectors.add(v);
            return this;
        }

        public Builder quorum(int v) {
            this.quorum = v;
            return this;
        }

        public Builder verdictTimeout(Duration v) {
            this.verdictTimeout = v;
            return this;
        }

        public Builder workerPollTimeout(Duration v) {
            this.workerPollTimeout = v;
            return this;
        }

        public Builder metrics(EnsembleMetrics v) {
            this.metrics = v;
            return this;
        }

        /**
         * Build and validate the coordinator.
         *
         * @return a new, not yet started coordinator
         * @throws ConfigurationException if any value is invalid
         */
        public EnsembleCoordinator build() {
            if (detectors.isEmpty()) {
                throw new ConfigurationException("At least one detector is required");
            }
            Set<String> names = new HashSet<>();
            for (AnomalyDetector detector : detectors) {
                Objects.requireNonNull(detector, "detector must not be null");
                if (!names.add(detector.getName())) {
                    throw new ConfigurationException("Duplicate detector name: '" + detector.getName() + "'");
                }
            }
            if (quorum != null && (quorum < 1 || quorum > detectors.size())) {
                throw new ConfigurationException(
                        "quorum must be in [1, " + detectors.size() + "], got: " + quorum);
            }
            requirePositive(verdictTimeout, "verdictTimeout");
            requirePositive(workerPollTimeout, "workerPollTimeout");
            return new EnsembleCoordinator(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new ConfigurationException(name + " must be > 0, got: " + value);
            }
        }
    }
}
