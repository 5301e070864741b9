package com.smartsched.timetable_engine.dto;

/**
 * Wire form of one assignment: session {@code sessionIndex} of a course placed in a slot and room.
 */
public record AssignmentEntry(String courseId, int sessionIndex, String slotId, String roomId) {
}
