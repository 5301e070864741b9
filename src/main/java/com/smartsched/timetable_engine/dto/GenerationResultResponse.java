package com.smartsched.timetable_engine.dto;

import java.util.List;

import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.solver.pipeline.GenerationStatistics;

public record GenerationResultResponse(String jobId,
                                       List<AssignmentEntry> assignment,
                                       List<Conflict> conflicts,
                                       GenerationStatistics statistics,
                                       List<VariantResponse> variants) {
}
