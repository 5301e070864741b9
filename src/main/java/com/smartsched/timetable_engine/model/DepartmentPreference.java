package com.smartsched.timetable_engine.model;

import java.util.Set;

/**
 * Soft preferences a department declares for its courses. Empty sets mean "no preference".
 */
public record DepartmentPreference(String departmentId,
                                   Set<Integer> preferredDays,
                                   Set<Integer> preferredPeriods,
                                   String preferredRoomType) {

    public DepartmentPreference {
        if (departmentId == null || departmentId.isBlank()) {
            throw new IllegalArgumentException("Department id is required.");
        }
        preferredDays = preferredDays == null ? Set.of() : Set.copyOf(preferredDays);
        preferredPeriods = preferredPeriods == null ? Set.of() : Set.copyOf(preferredPeriods);
    }

    /** Number of declared preferences the placement misses (0..3). */
    public int misses(TimeSlot slot, Room room) {
        int misses = 0;
        if (!preferredDays.isEmpty() && !preferredDays.contains(slot.day())) {
            misses++;
        }
        if (!preferredPeriods.isEmpty() && !preferredPeriods.contains(slot.period())) {
            misses++;
        }
        if (preferredRoomType != null && !preferredRoomType.isBlank() && !preferredRoomType.equalsIgnoreCase(room.type())) {
            misses++;
        }
        return misses;
    }
}
