package com.smartsched.timetable_engine.dto;

import com.smartsched.timetable_engine.model.JobStatus;
import com.smartsched.timetable_engine.solver.progress.Stage;

public record ProgressResponse(String jobId,
                               JobStatus status,
                               Stage stage,
                               double progressPercent,
                               Long etaSeconds,
                               String message) {
}
