package com.smartsched.timetable_engine.solver.refine;

/**
 * Evaluated quality of a chromosome; lower cost is better.
 */
public record Fitness(int conflicts, int capacityViolations, int preferenceMisses, double cost) {
}
