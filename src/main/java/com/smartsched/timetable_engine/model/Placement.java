package com.smartsched.timetable_engine.model;

public record Placement(String slotId, String roomId) {

    public Placement {
        if (slotId == null || roomId == null) {
            throw new IllegalArgumentException("A placement needs both a slot and a room.");
        }
    }
}
