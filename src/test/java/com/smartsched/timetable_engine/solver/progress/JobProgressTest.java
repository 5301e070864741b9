package com.smartsched.timetable_engine.solver.progress;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.Test;

import com.smartsched.timetable_engine.config.EngineSettings;

class JobProgressTest {

    private static final double CATCH_UP = 0.35;
    private static final double MIN_STEP = 0.05;
    private static final double CREEP = 0.01;

    private static void tick(JobProgress progress, int times, List<Double> observed) {
        for (int i = 0; i < times; i++) {
            progress.tick(CATCH_UP, MIN_STEP, CREEP);
            observed.add(progress.displayedPercent());
        }
    }

    @Test
    void displayedValueNeverDecreases() {
        JobProgress progress = new JobProgress(System.nanoTime() - 1_000_000_000L);
        List<Double> observed = new ArrayList<>();
        WorkReporter loading = progress.reporter(Stage.LOADING);

        loading.report(1, 1);
        tick(progress, 10, observed);
        progress.enterStage(Stage.CONSTRAINT_SOLVING);
        WorkReporter solving = progress.reporter(Stage.CONSTRAINT_SOLVING);
        solving.report(6, 10);
        tick(progress, 10, observed);
        // late and out-of-order reports
        solving.report(2, 10);
        loading.report(5, 1);
        progress.enterStage(Stage.CLUSTERING);
        tick(progress, 10, observed);
        progress.enterStage(Stage.POPULATION_REFINEMENT);
        tick(progress, 10, observed);

        for (int i = 1; i < observed.size(); i++) {
            assertThat(observed.get(i)).isGreaterThanOrEqualTo(observed.get(i - 1));
        }
        assertThat(progress.stage()).isEqualTo(Stage.POPULATION_REFINEMENT);
    }

    @Test
    void catchesUpWithTheStageTargetButNotBeyondItsEnd() {
        JobProgress progress = new JobProgress();
        progress.enterStage(Stage.CONSTRAINT_SOLVING);
        progress.reporter(Stage.CONSTRAINT_SOLVING).report(10, 10);

        tick(progress, 500, new ArrayList<>());

        assertThat(progress.displayedPercent()).isEqualTo(40.0);
    }

    @Test
    void staysBelowCompletionUntilFinished() {
        JobProgress progress = new JobProgress(System.nanoTime() - 5_000_000_000L);
        progress.enterStage(Stage.FINALIZING);
        progress.reporter(Stage.FINALIZING).report(3, 3);

        tick(progress, 1000, new ArrayList<>());
        assertThat(progress.displayedPercent()).isEqualTo(JobProgress.MAX_BEFORE_COMPLETION);
        assertThat(progress.snapshot().etaSeconds()).isBetween(1L, 3600L);

        progress.finish();
        progress.tick(CATCH_UP, MIN_STEP, CREEP);

        assertThat(progress.displayedPercent()).isEqualTo(100.0);
        assertThat(progress.snapshot().etaSeconds()).isZero();
    }

    @Test
    void reportsWithoutTotalsKeepTheBarAtTheStageStart() {
        JobProgress progress = new JobProgress();
        progress.enterStage(Stage.CLUSTERING);

        progress.tick(1.0, MIN_STEP, 0.0);

        assertThat(progress.displayedPercent()).isEqualTo(Stage.CLUSTERING.start());
    }

    @Test
    void coordinatorReleaseStopsTheLoopAndShowsCompletion() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ProgressCoordinator coordinator = new ProgressCoordinator(scheduler, EngineSettings.defaults());
            JobProgress progress = new JobProgress();

            coordinator.track(progress);
            assertThat(coordinator.activeLoops()).isEqualTo(1);
            progress.finish();
            coordinator.release(progress);

            assertThat(coordinator.activeLoops()).isZero();
            assertThat(progress.displayedPercent()).isEqualTo(100.0);
        } finally {
            scheduler.shutdownNow();
        }
    }
}
