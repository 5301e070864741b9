package com.smartsched.timetable_engine.dto;

import java.util.List;

public record ConflictDetectionRequest(CatalogPayload catalog, List<AssignmentEntry> assignment) {
}
