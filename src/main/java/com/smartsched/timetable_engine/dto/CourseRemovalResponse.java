package com.smartsched.timetable_engine.dto;

import java.util.List;

public record CourseRemovalResponse(List<AssignmentEntry> removedSessions, List<AssignmentEntry> assignment) {
}
