package com.smartsched.timetable_engine.solver.progress;

/**
 * Pipeline stages and the share of the progress bar each one owns.
 */
public enum Stage {
    LOADING(0, 2),
    CLUSTERING(2, 5),
    CONSTRAINT_SOLVING(5, 40),
    POPULATION_REFINEMENT(40, 80),
    CONFLICT_REPAIR(80, 95),
    FINALIZING(95, 100);

    private final double start;
    private final double end;

    Stage(double start, double end) {
        this.start = start;
        this.end = end;
    }

    public double start() {
        return start;
    }

    public double end() {
        return end;
    }

    public double target(long done, long total) {
        if (total <= 0) {
            return start;
        }
        double fraction = Math.min(1.0, Math.max(0.0, (double) done / total));
        return start + fraction * (end - start);
    }
}
