package com.smartsched.timetable_engine.model;

import java.util.List;

/**
 * A derived overlap in an assignment. Recomputed from the schedule state on demand, never stored.
 * The id is deterministic so a client can address a single conflict when resolving.
 * {@code affectedCount} is the number of bookings beyond the first in the overlapping cells: a
 * student in three courses at one slot counts two.
 */
public record Conflict(String id,
                       ConflictType type,
                       Severity severity,
                       List<String> courseIds,
                       String slotId,
                       String resourceId,
                       int affectedCount) {

    public Conflict {
        courseIds = List.copyOf(courseIds);
    }

    public static String idFor(ConflictType type, String slotId, String resourceId) {
        return type.name().toLowerCase() + ":" + slotId + ":" + resourceId;
    }
}
