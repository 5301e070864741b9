package com.smartsched.timetable_engine.model;

public record Room(String id, String name, int capacity, String type) {

    public Room {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Room id is required.");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Room " + id + " must have a positive capacity, got " + capacity);
        }
        name = name == null ? id : name;
    }
}
