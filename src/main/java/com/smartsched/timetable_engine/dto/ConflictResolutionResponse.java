package com.smartsched.timetable_engine.dto;

import java.util.List;

public record ConflictResolutionResponse(int resolved,
                                         List<String> manualReview,
                                         List<ResolutionDetail> details,
                                         int conflictsBefore,
                                         int conflictsAfter,
                                         List<AssignmentEntry> assignment) {
}
