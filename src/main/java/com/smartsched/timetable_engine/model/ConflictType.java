package com.smartsched.timetable_engine.model;

public enum ConflictType {
    FACULTY,
    ROOM,
    STUDENT
}
