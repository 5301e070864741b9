package com.smartsched.timetable_engine.solver.pipeline;

import java.util.Map;

import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.model.SessionKey;
import com.smartsched.timetable_engine.solver.refine.WeightProfile;

/**
 * One refined and repaired alternative of a generation. {@code cost} is scored under the
 * configured (balanced) weights so that variants are comparable; rank 1 is the recommended one.
 */
public record ScheduleVariant(int variantNumber,
                              int rank,
                              WeightProfile profile,
                              Map<String, Double> weights,
                              int conflicts,
                              int capacityViolations,
                              int preferenceMisses,
                              double cost,
                              Map<SessionKey, Placement> assignment) {
}
