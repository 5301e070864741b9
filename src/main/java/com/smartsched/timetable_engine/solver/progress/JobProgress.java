package com.smartsched.timetable_engine.solver.progress;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-job progress state. Stages write raw counters through {@link #reporter(Stage)}; the
 * displayed percentage is only advanced by {@link #tick}, which the coordinator's reporting loop
 * owns. Reports from a stage that is no longer current are dropped, and counters only grow, so
 * late or out-of-order reports cannot pull the bar back.
 */
public final class JobProgress {

    static final double MAX_BEFORE_COMPLETION = 99.0;
    private static final double ETA_SMOOTHING = 0.3;

    private final AtomicReference<Stage> stage = new AtomicReference<>(Stage.LOADING);
    private final AtomicLong done = new AtomicLong();
    private final AtomicLong total = new AtomicLong();
    private final long startedNanos;

    private volatile boolean finished;
    private volatile double displayed;
    private volatile Long etaSeconds;

    public JobProgress() {
        this(System.nanoTime());
    }

    JobProgress(long startedNanos) {
        this.startedNanos = startedNanos;
    }

    /** Moves to a later stage. Moving backwards is ignored. */
    public void enterStage(Stage next) {
        Stage current = stage.get();
        while (next.ordinal() > current.ordinal()) {
            if (stage.compareAndSet(current, next)) {
                synchronized (this) {
                    done.set(0);
                    total.set(0);
                }
                return;
            }
            current = stage.get();
        }
    }

    public WorkReporter reporter(Stage owner) {
        return (workDone, workTotal) -> {
            synchronized (this) {
                if (stage.get() != owner) {
                    return;
                }
                total.accumulateAndGet(workTotal, Math::max);
                done.accumulateAndGet(Math.min(workDone, total.get()), Math::max);
            }
        };
    }

    /** Marks the job finished; the next tick shows 100%. */
    public void finish() {
        finished = true;
    }

    /**
     * Advances the displayed value one step toward the current stage's target: a fraction of the
     * gap when behind, a small creep when at or ahead, never past the stage's end and never down.
     */
    void tick(double catchUpFactor, double minStep, double creepStep) {
        if (finished) {
            displayed = 100.0;
            etaSeconds = 0L;
            return;
        }
        Stage current = stage.get();
        long workDone;
        long workTotal;
        synchronized (this) {
            workDone = done.get();
            workTotal = total.get();
        }
        double target = current.target(workDone, workTotal);
        double ceiling = Math.min(current.end(), MAX_BEFORE_COMPLETION);
        double value = displayed;
        double next;
        if (value < target) {
            double gap = target - value;
            next = value + Math.min(gap, Math.max(minStep, gap * catchUpFactor));
        } else {
            next = value + creepStep;
        }
        next = Math.max(value, Math.min(next, ceiling));
        displayed = next;
        updateEta(next);
    }

    private void updateEta(double percent) {
        if (percent <= 0.0) {
            return;
        }
        double elapsed = (System.nanoTime() - startedNanos) / 1e9;
        double remaining = elapsed * (100.0 - percent) / percent;
        Long previous = etaSeconds;
        double smoothed = previous == null ? remaining : (1 - ETA_SMOOTHING) * previous + ETA_SMOOTHING * remaining;
        etaSeconds = Math.max(1L, Math.min(3600L, Math.round(smoothed)));
    }

    public double displayedPercent() {
        return displayed;
    }

    public Stage stage() {
        return stage.get();
    }

    public boolean isFinished() {
        return finished;
    }

    public ProgressSnapshot snapshot() {
        synchronized (this) {
            return new ProgressSnapshot(stage.get(), displayed, etaSeconds, done.get(), total.get());
        }
    }
}
