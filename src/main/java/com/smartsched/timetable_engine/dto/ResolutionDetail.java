package com.smartsched.timetable_engine.dto;

import java.util.List;

import com.smartsched.timetable_engine.model.ConflictType;
import com.smartsched.timetable_engine.model.Severity;

public record ResolutionDetail(String conflictId,
                               ConflictType type,
                               Severity severity,
                               List<String> courseIds,
                               String outcome) {

    public static final String RESOLVED = "RESOLVED";
    public static final String MANUAL_REVIEW = "MANUAL_REVIEW";
}
