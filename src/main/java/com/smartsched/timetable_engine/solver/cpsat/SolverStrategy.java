package com.smartsched.timetable_engine.solver.cpsat;

/**
 * Constraint sets tried in order, each under its own wall-clock budget.
 */
public enum SolverStrategy {
    /** Assignment, room, faculty, priority students exactly and a sample of the rest. */
    FULL(true, true),
    /** Student constraints only for the priority subset. */
    RELAXED_STUDENTS(true, false),
    /** Assignment, room and faculty only. */
    ESSENTIAL(false, false);

    private final boolean priorityStudents;
    private final boolean remainingStudents;

    SolverStrategy(boolean priorityStudents, boolean remainingStudents) {
        this.priorityStudents = priorityStudents;
        this.remainingStudents = remainingStudents;
    }

    public boolean constrainsPriorityStudents() {
        return priorityStudents;
    }

    public boolean constrainsRemainingStudents() {
        return remainingStudents;
    }
}
