package com.smartsched.timetable_engine.solver.progress;

/**
 * What a stage sees of progress reporting: raw units of work, never a percentage.
 */
@FunctionalInterface
public interface WorkReporter {

    WorkReporter NOOP = (done, total) -> { };

    void report(long done, long total);
}
