package com.smartsched.timetable_engine.solver.progress;

public record ProgressSnapshot(Stage stage, double percent, Long etaSeconds, long workDone, long workTotal) {
}
