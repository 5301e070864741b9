package com.smartsched.timetable_engine.model;

/**
 * One scheduled occurrence of a course: the atomic unit of assignment.
 */
public record SessionKey(String courseId, int index) {

    public SessionKey {
        if (courseId == null || courseId.isBlank()) {
            throw new IllegalArgumentException("Session course id is required.");
        }
        if (index < 0) {
            throw new IllegalArgumentException("Session index must not be negative.");
        }
    }

    @Override
    public String toString() {
        return courseId + "#" + index;
    }
}
