package com.smartsched.timetable_engine.model;

public record Faculty(String id, String name, String departmentId) {

    public Faculty {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Faculty id is required.");
        }
    }
}
