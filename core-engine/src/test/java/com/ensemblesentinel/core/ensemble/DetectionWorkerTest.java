package com.ensemblesentinel.core.ensemble;

import com.ensemblesentinel.core.detection.AnomalyDetector;
import com.ensemblesentinel.core.detection.ZScoreDetector;
import com.ensemblesentinel.core.model.DataPoint;
import com.ensemblesentinel.core.model.Verdict;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionWorker}.
 */
class DetectionWorkerTest {

    private static final Duration POLL = Duration.ofMillis(20);
    private static final Duration WAIT = Duration.ofSeconds(5);

    private final BlockingQueue<Verdict> outbound = new LinkedBlockingQueue<>();
    private final EnsembleMetrics metrics = EnsembleMetrics.inMemory();
    private Thread thread;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (thread != null) {
            thread.interrupt();
            thread.join(WAIT.toMillis());
        }
    }

    @Test
    @DisplayName("Should publish one verdict per point, tagged with its round")
    void shouldPublishVerdict() throws InterruptedException {
        DetectionWorker worker = start(StubDetector.voting("stub", true));

        worker.submit(7, DataPoint.of(0, 1.0));

        assertThat(outbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS))
                .isEqualTo(Verdict.of("stub", 7, true));
    }

    @Test
    @DisplayName("Should contain a detector failure and keep running")
    void shouldIsolateFailures() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        DetectionWorker worker = start(StubDetector.judging("flaky", p -> {
            if (calls.getAndIncrement() == 0) {
                throw new IllegalStateException("boom");
            }
            return true;
        }));

        worker.submit(1, DataPoint.of(0, 1.0));
        worker.submit(2, DataPoint.of(1, 1.0));

        Verdict first = outbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        Verdict second = outbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        assertThat(first).isEqualTo(Verdict.failed("flaky", 1));
        assertThat(second).isEqualTo(Verdict.of("flaky", 2, true));
        assertThat(worker.getState()).isNotEqualTo(WorkerState.SHUTDOWN);
        assertThat(metrics.workerFailures()).isEqualTo(1);
    }

    static Stream<Supplier<Error>> containedErrors() {
        return Stream.of(
                () -> new AssertionError("broken invariant"),
                StackOverflowError::new,
                () -> new NoClassDefFoundError("missing/Helper"));
    }

    @ParameterizedTest
    @MethodSource("containedErrors")
    @DisplayName("Should contain non-fatal errors raised by a detector")
    void shouldIsolateErrors(Supplier<Error> error) throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        DetectionWorker worker = start(StubDetector.judging("erratic", p -> {
            if (calls.getAndIncrement() == 0) {
                throw error.get();
            }
            return false;
        }));

        worker.submit(1, DataPoint.of(0, 1.0));
        worker.submit(2, DataPoint.of(1, 1.0));

        assertThat(outbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS))
                .isEqualTo(Verdict.failed("erratic", 1));
        assertThat(outbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS))
                .isEqualTo(Verdict.of("erratic", 2, false));
        assertThat(worker.getState()).isNotEqualTo(WorkerState.SHUTDOWN);
        assertThat(metrics.workerFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop on JVM-level errors")
    void shouldStopOnFatalError() throws InterruptedException {
        DetectionWorker worker = new DetectionWorker(
                StubDetector.judging("oom", p -> {
                    throw new OutOfMemoryError("simulated");
                }), outbound, POLL, metrics);
        worker.submit(1, DataPoint.of(0, 1.0));

        Thread failing = new Thread(worker, "fatal-worker");
        failing.setDaemon(true);
        failing.setUncaughtExceptionHandler((t, e) -> {
            // the error is expected to escape the worker
        });
        failing.start();

        assertThat(worker.awaitTermination(WAIT)).isTrue();
        assertThat(worker.getState()).isEqualTo(WorkerState.SHUTDOWN);
        assertThat(outbound).isEmpty();
    }

    @Test
    @DisplayName("Should answer a malformed point with a failed verdict")
    void shouldFailOnMalformedPoint() throws InterruptedException {
        DetectionWorker worker = start(new ZScoreDetector("z", 3, 2.0));

        worker.submit(1, new DataPoint(0, Double.NaN));

        assertThat(outbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS))
                .isEqualTo(Verdict.failed("z", 1));
        assertThat(metrics.workerFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop on the shutdown sentinel and ignore later work")
    void shouldStopOnSentinel() throws InterruptedException {
        StubDetector detector = StubDetector.voting("stub", false);
        DetectionWorker worker = start(detector);

        worker.shutdown();
        assertThat(worker.awaitTermination(WAIT)).isTrue();
        worker.submit(1, DataPoint.of(0, 1.0));

        assertThat(worker.getState()).isEqualTo(WorkerState.SHUTDOWN);
        assertThat(outbound.poll(100, TimeUnit.MILLISECONDS)).isNull();
        assertThat(detector.ingestCount()).isZero();
    }

    @Test
    @DisplayName("Should stay alive through idle poll timeouts")
    void shouldSurviveIdlePeriods() throws InterruptedException {
        DetectionWorker worker = start(StubDetector.voting("stub", true));

        // several poll timeouts elapse with nothing to do
        assertThat(worker.awaitTermination(POLL.multipliedBy(5))).isFalse();
        worker.submit(3, DataPoint.of(0, 1.0));

        assertThat(outbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isNotNull();
        assertThat(worker.getState()).isNotEqualTo(WorkerState.SHUTDOWN);
    }

    @Test
    @DisplayName("Should report PROCESSING while the detector works, then IDLE")
    void shouldTrackState() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        DetectionWorker worker = start(StubDetector.gated("slow", gate, true));
        assertThat(worker.getState()).isEqualTo(WorkerState.IDLE);

        worker.submit(1, DataPoint.of(0, 1.0));
        awaitState(worker, WorkerState.PROCESSING);

        gate.countDown();
        assertThat(outbound.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isNotNull();
        awaitState(worker, WorkerState.IDLE);
    }

    @Test
    @DisplayName("Should stop when interrupted")
    void shouldStopOnInterrupt() throws InterruptedException {
        DetectionWorker worker = start(StubDetector.voting("stub", true));

        thread.interrupt();

        assertThat(worker.awaitTermination(WAIT)).isTrue();
        assertThat(worker.getState()).isEqualTo(WorkerState.SHUTDOWN);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DetectionWorker start(AnomalyDetector detector) {
        DetectionWorker worker = new DetectionWorker(detector, outbound, POLL, metrics);
        thread = new Thread(worker, "test-worker");
        thread.setDaemon(true);
        thread.start();
        return worker;
    }

    private static void awaitState(DetectionWorker worker, WorkerState expected) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (worker.getState() != expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(worker.getState()).isEqualTo(expected);
    }
}
