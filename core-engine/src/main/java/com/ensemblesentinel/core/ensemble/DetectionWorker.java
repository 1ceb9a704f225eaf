package com.ensemblesentinel.core.ensemble;

import com.ensemblesentinel.core.detection.AnomalyDetector;
import com.ensemblesentinel.core.model.DataPoint;
import com.ensemblesentinel.core.model.Verdict;
import com.ensemblesentinel.core.validation.DataValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Long-lived task that owns one detector.
 *
 * <p>
 * The worker takes points from its private inbound queue, feeds them to its
 * detector and publishes one {@link Verdict} per point on the outbound queue
 * shared by all workers of the ensemble. Its detector is touched by no other
 * thread, so the detector window needs no locking.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A detector that throws (an exception, or an error other than a JVM-level
 * {@link VirtualMachineError}) is logged and answered with a
 * {@linkplain Verdict#failed(String, long) failed verdict}; the worker keeps
 * running, and the coordinator does not have to wait out its timeout.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * The worker stops when it takes the shutdown sentinel from its queue. Idle
 * waits are bounded by the poll timeout so interruption is noticed promptly.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionWorker implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionWorker.class);

    private final AnomalyDetector detector;
    private final BlockingQueue<WorkItem> inbound = new LinkedBlockingQueue<>();
    private final BlockingQueue<Verdict> outbound;
    private final long pollTimeoutMillis;
    private final EnsembleMetrics metrics;

    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile WorkerState state = WorkerState.IDLE;

    /**
     * @param detector    the detector this worker owns
     * @param outbound    verdict queue shared with the coordinator
     * @param pollTimeout upper bound on each idle wait for input
     * @param metrics     ensemble metrics
     */
    public DetectionWorker(AnomalyDetector detector,
            BlockingQueue<Verdict> outbound,
            Duration pollTimeout,
            EnsembleMetrics metrics) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.outbound = Objects.requireNonNull(outbound, "outbound queue must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be > 0, got: " + pollTimeout);
        }
        this.pollTimeoutMillis = pollTimeout.toMillis();
    }

    // ---------------------------------------------------------------
    // Inbound side (called by the coordinator)
    // ---------------------------------------------------------------

    /**
     * Queue a point for classification as part of fan-out round
     * {@code sequence}. Never blocks.
     */
    public void submit(long sequence, DataPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        inbound.add(WorkItem.of(sequence, point));
    }

    /**
     * Queue the shutdown sentinel. Points queued before it are still
     * processed; anything queued after it is ignored.
     */
    public void shutdown() {
        inbound.add(WorkItem.SHUTDOWN);
    }

    // ---------------------------------------------------------------
    // Worker loop
    // ---------------------------------------------------------------

    @Override
    public void run() {
        LOG.info("Worker [{}] started", detector.getName());
        try {
            while (!Thread.currentThread().isInterrupted()) {
                WorkItem item = inbound.poll(pollTimeoutMillis, TimeUnit.MILLISECONDS);
                if (item == null) {
                    continue;
                }
                if (item.isShutdown()) {
                    break;
                }
                handle(item);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Worker [{}] interrupted, stopping", detector.getName());
        } finally {
            state = WorkerState.SHUTDOWN;
            terminated.countDown();
            LOG.info("Worker [{}] stopped", detector.getName());
        }
    }

    private void handle(WorkItem item) {
        state = WorkerState.PROCESSING;
        DataPoint point = item.getPoint();
        Verdict verdict;
        try {
            verdict = Verdict.of(detector.getName(), item.getSequence(), detector.ingest(point));
        } catch (DataValidationException e) {
            LOG.warn("Detector [{}] rejected {}: {}", detector.getName(), point, e.getMessage());
            metrics.incrementWorkerFailures();
            verdict = Verdict.failed(detector.getName(), item.getSequence());
        } catch (RuntimeException e) {
            LOG.error("Detector [{}] threw an exception on {}, continuing with next point",
                    detector.getName(), point, e);
            metrics.incrementWorkerFailures();
            verdict = Verdict.failed(detector.getName(), item.getSequence());
        } catch (Error e) {
            if (isFatal(e)) {
                throw e;
            }
            LOG.error("Detector [{}] raised {} on {}, continuing with next point",
                    detector.getName(), e.getClass().getSimpleName(), point, e);
            metrics.incrementWorkerFailures();
            verdict = Verdict.failed(detector.getName(), item.getSequence());
        }
        outbound.add(verdict);
        state = WorkerState.IDLE;
    }

    /**
     * JVM-level errors end the worker; anything else a detector raises,
     * including {@link StackOverflowError} and {@link AssertionError}, is
     * contained.
     */
    private static boolean isFatal(Error e) {
        return e instanceof VirtualMachineError && !(e instanceof StackOverflowError);
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    /**
     * Wait for the worker loop to exit.
     *
     * @return {@code true} if the worker stopped within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public WorkerState getState() {
        return state;
    }

    public String getDetectorName() {
        return detector.getName();
    }

    /** Points queued but not yet taken by the worker. */
    public int backlog() {
        return inbound.size();
    }
}
