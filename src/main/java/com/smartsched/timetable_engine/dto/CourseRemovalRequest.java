package com.smartsched.timetable_engine.dto;

import java.util.List;

public record CourseRemovalRequest(List<AssignmentEntry> assignment, String courseId) {
}
