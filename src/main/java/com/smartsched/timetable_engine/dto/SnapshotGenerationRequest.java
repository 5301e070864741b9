package com.smartsched.timetable_engine.dto;

public record SnapshotGenerationRequest(String organizationId, String semester, String academicYear,
                                        Integer variants) {
}
