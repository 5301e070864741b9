package com.smartsched.timetable_engine.solver.repair;

record Candidate(int slot, int room, String key, double value) {
}
