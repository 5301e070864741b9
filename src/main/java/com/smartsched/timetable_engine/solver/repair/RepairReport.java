package com.smartsched.timetable_engine.solver.repair;

import java.util.List;

public record RepairReport(int conflictsBefore,
                           int conflictsAfter,
                           int resolved,
                           int rejected,
                           int superClusters,
                           int rolledBackScopes,
                           List<String> manualReview) {

    public RepairReport {
        manualReview = List.copyOf(manualReview);
    }

    public static RepairReport unchanged(int conflicts) {
        return new RepairReport(conflicts, conflicts, 0, 0, 0, 0, List.of());
    }
}
