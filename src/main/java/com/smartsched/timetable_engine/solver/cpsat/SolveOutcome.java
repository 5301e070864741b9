package com.smartsched.timetable_engine.solver.cpsat;

public enum SolveOutcome {
    OPTIMAL,
    FEASIBLE,
    /** Every strategy failed or timed out. */
    GREEDY_AFTER_SOLVER,
    /** Capacity pre-check ruled the cluster out before modeling. */
    GREEDY_CAPACITY_PRECHECK;

    public boolean usedGreedy() {
        return this == GREEDY_AFTER_SOLVER || this == GREEDY_CAPACITY_PRECHECK;
    }
}
