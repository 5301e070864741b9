package com.smartsched.timetable_engine.solver.cpsat;

/**
 * Placement of every session of one cluster. Arrays are aligned: {@code slots[i]} and
 * {@code rooms[i]} belong to global session index {@code sessions[i]}.
 */
public record ClusterSolveResult(int clusterId,
                                 int[] sessions,
                                 int[] slots,
                                 int[] rooms,
                                 SolveOutcome outcome,
                                 SolverStrategy strategy,
                                 boolean suspectedModelingDefect,
                                 double wallSeconds) {
}
