package com.smartsched.timetable_engine.dto;

import java.util.List;

import com.smartsched.timetable_engine.model.Course;

public record CourseAdditionRequest(CatalogPayload catalog, List<AssignmentEntry> assignment, Course course) {
}
