package com.ensemblesentinel.core.ensemble;

import com.ensemblesentinel.core.config.EnsembleConfig;
import com.ensemblesentinel.core.detection.ZScoreDetector;
import com.ensemblesentinel.core.model.DataPoint;
import com.ensemblesentinel.core.validation.DataValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the default detector ensemble over short deterministic series.
 */
class EnsembleEndToEndTest {

    private static double sine(int t) {
        return 5 * Math.sin(0.1 * t);
    }

    @Test
    @DisplayName("Clean sine: only the steep descent after warm-up draws a majority")
    void cleanSineFlagsOnlyZeroCrossing() {
        try (EnsembleCoordinator coordinator =
                     EnsembleCoordinator.fromConfig(EnsembleConfig.defaults(), EnsembleMetrics.inMemory())) {
            coordinator.start();
            for (int t = 0; t < 40; t++) {
                coordinator.process(DataPoint.of(t, sine(t)));
            }

            // windows span one rising half-period, so the fall through zero stands out
            assertThat(coordinator.snapshot())
                    .extracting(DataPoint::getTime)
                    .containsExactly(31.0, 32.0, 33.0, 34.0, 35.0, 36.0, 37.0, 38.0);
            assertThat(coordinator.getMetrics().pointsProcessed()).isEqualTo(40);
            assertThat(coordinator.getMetrics().verdictTimeouts()).isZero();
        }
    }

    @Test
    @DisplayName("Injected spike is recorded and dominates the windows after it")
    void spikeIsRecorded() {
        try (EnsembleCoordinator coordinator =
                     EnsembleCoordinator.fromConfig(EnsembleConfig.defaults(), EnsembleMetrics.inMemory())) {
            coordinator.start();
            VoteTally spike = null;
            for (int t = 0; t < 40; t++) {
                double value = t == 35 ? sine(t) + 25.0 : sine(t);
                VoteTally tally = coordinator.process(DataPoint.of(t, value));
                if (t == 35) {
                    spike = tally;
                }
            }

            assertThat(spike).isNotNull();
            assertThat(spike.isAnomalous()).isTrue();
            assertThat(spike.getVotesPositive()).isEqualTo(3);
            assertThat(coordinator.snapshot())
                    .extracting(DataPoint::getTime)
                    .contains(35.0)
                    .allSatisfy(time -> assertThat(time).isLessThanOrEqualTo(35.0));
        }
    }

    @Test
    @DisplayName("A rejected point never reaches a detector window")
    void rejectedPointLeavesWindowsUntouched() {
        ZScoreDetector detector = new ZScoreDetector("z", 5, 2.0);
        try (EnsembleCoordinator coordinator = EnsembleCoordinator.builder()
                .detector(detector)
                .workerPollTimeout(Duration.ofMillis(20))
                .build()) {
            coordinator.start();

            assertThatThrownBy(() -> coordinator.process(new DataPoint(0, Double.NaN)))
                    .isInstanceOf(DataValidationException.class);
            assertThat(detector.windowSize()).isZero();

            coordinator.process(DataPoint.of(0, 1.0));
            assertThat(detector.windowSize()).isEqualTo(1);
        }
    }
}
