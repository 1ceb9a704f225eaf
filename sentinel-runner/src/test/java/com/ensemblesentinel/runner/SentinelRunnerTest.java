package com.ensemblesentinel.runner;

import com.ensemblesentinel.core.config.EnsembleConfig;
import com.ensemblesentinel.core.ensemble.EnsembleCoordinator;
import com.ensemblesentinel.core.ensemble.EnsembleMetrics;
import com.ensemblesentinel.core.model.DataPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SentinelRunnerTest {

    private static List<DataPoint> spikeSeries(int length) {
        List<DataPoint> points = new ArrayList<>();
        for (int t = 0; t < length; t++) {
            double value = 5 * Math.sin(0.1 * t) + (t == 35 ? 25.0 : 0.0);
            points.add(DataPoint.of(t, value));
        }
        return points;
    }

    @Test
    @DisplayName("Stream stops at the point limit and records the spike")
    void shouldStreamUpToLimit() throws InterruptedException {
        RunnerConfig config = new RunnerConfig.Builder().streamIntervalMs(0).maxPoints(40).build();

        try (EnsembleCoordinator coordinator =
                     EnsembleCoordinator.fromConfig(EnsembleConfig.defaults(), EnsembleMetrics.inMemory())) {
            coordinator.start();

            long processed = SentinelRunner.stream(coordinator, spikeSeries(60).iterator(), config);

            assertThat(processed).isEqualTo(40);
            assertThat(coordinator.getMetrics().pointsProcessed()).isEqualTo(40);
            assertThat(coordinator.snapshot()).extracting(DataPoint::getTime).contains(35.0);
        }
    }

    @Test
    @DisplayName("Unbounded stream ends when the source is exhausted")
    void shouldStopWhenSourceExhausted() throws InterruptedException {
        RunnerConfig config = new RunnerConfig.Builder().streamIntervalMs(0).build();

        try (EnsembleCoordinator coordinator =
                     EnsembleCoordinator.fromConfig(EnsembleConfig.defaults(), EnsembleMetrics.inMemory())) {
            coordinator.start();

            assertThat(SentinelRunner.stream(coordinator, spikeSeries(12).iterator(), config)).isEqualTo(12);
            assertThat(coordinator.snapshot()).isEmpty();
        }
    }
}
