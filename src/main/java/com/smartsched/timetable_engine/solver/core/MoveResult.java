package com.smartsched.timetable_engine.solver.core;

/**
 * Outcome of a validated mutation. {@code conflictDelta} is the change in the global conflict
 * count caused by the move (negative means conflicts were removed).
 */
public record MoveResult(boolean applied, int conflictDelta) {

    public static MoveResult rejected() {
        return new MoveResult(false, 0);
    }

    public boolean reducedConflicts() {
        return applied && conflictDelta < 0;
    }
}
