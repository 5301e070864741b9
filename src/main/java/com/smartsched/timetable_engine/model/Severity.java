package com.smartsched.timetable_engine.model;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static Severity forStudentOverlap(int affectedStudents) {
        if (affectedStudents >= 5) {
            return HIGH;
        }
        return affectedStudents >= 2 ? MEDIUM : LOW;
    }
}
