package com.smartsched.timetable_engine.model;

import java.util.Set;

/**
 * A course to be scheduled. Owns {@code sessionCount} sessions, each of which needs one
 * (time slot, room) placement. Immutable for the duration of a generation run.
 */
public record Course(String id,
                     String code,
                     String departmentId,
                     String facultyId,
                     int sessionCount,
                     Set<String> studentIds,
                     String roomType,
                     int minCapacity) {

    public Course {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Course id is required.");
        }
        if (facultyId == null || facultyId.isBlank()) {
            throw new IllegalArgumentException("Course " + id + " has no faculty assigned.");
        }
        if (sessionCount < 1) {
            throw new IllegalArgumentException("Course " + id + " must require at least one session, got " + sessionCount);
        }
        if (minCapacity < 0) {
            throw new IllegalArgumentException("Course " + id + " has a negative minimum capacity.");
        }
        studentIds = studentIds == null ? Set.of() : Set.copyOf(studentIds);
        code = code == null ? id : code;
    }

    /** Seats a room must offer: the larger of the declared minimum and the enrollment. */
    public int requiredCapacity() {
        return Math.max(minCapacity, studentIds.size());
    }

    public int enrollment() {
        return studentIds.size();
    }

    public boolean accepts(Room room) {
        if (room.capacity() < requiredCapacity()) {
            return false;
        }
        return roomType == null || roomType.isBlank() || roomType.equalsIgnoreCase(room.type());
    }
}
