package com.smartsched.timetable_engine.dto;

import java.util.List;
import java.util.Map;

public record VariantResponse(int variantNumber,
                              int rank,
                              String profile,
                              String name,
                              Map<String, Double> weights,
                              int conflicts,
                              int capacityViolations,
                              int preferenceMisses,
                              double cost,
                              List<AssignmentEntry> assignment) {
}
