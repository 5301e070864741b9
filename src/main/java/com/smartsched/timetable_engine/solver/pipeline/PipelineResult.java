package com.smartsched.timetable_engine.solver.pipeline;

import java.util.List;
import java.util.Map;

import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.model.SessionKey;

/**
 * The recommended schedule with its report, plus every variant ranked best first. The top-level
 * assignment is the rank 1 variant's.
 */
public record PipelineResult(Map<SessionKey, Placement> assignment,
                             List<Conflict> conflicts,
                             GenerationStatistics statistics,
                             List<ScheduleVariant> variants) {
}
