package com.smartsched.timetable_engine.dto;

import java.util.List;

public record CourseAdditionResponse(boolean success,
                                     List<AssignmentEntry> assignedSessions,
                                     List<AssignmentEntry> assignment,
                                     String message) {
}
