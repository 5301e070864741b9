package com.smartsched.timetable_engine.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.smartsched.timetable_engine.dto.AssignmentEntry;
import com.smartsched.timetable_engine.dto.CatalogPayload;
import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.model.SessionKey;
import com.smartsched.timetable_engine.model.TimeSlot;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Converts wire payloads into engine structures and back.
 */
final class CatalogMapper {

    static final int DEFAULT_DAYS = 6;
    static final int DEFAULT_PERIODS = 9;

    private CatalogMapper() {}

    static SchedulingProblem toProblem(CatalogPayload catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("A catalog of courses, rooms and time slots is required.");
        }
        if (catalog.courses() == null) {
            throw new IllegalArgumentException("Course list is required.");
        }
        return SchedulingProblem.of(catalog.courses(), catalog.rooms(), slotsOf(catalog), catalog.faculty(),
                catalog.preferences());
    }

    static List<TimeSlot> slotsOf(CatalogPayload catalog) {
        if (catalog.slots() != null && !catalog.slots().isEmpty()) {
            return catalog.slots();
        }
        int days = catalog.days() == null ? DEFAULT_DAYS : catalog.days();
        int periods = catalog.periodsPerDay() == null ? DEFAULT_PERIODS : catalog.periodsPerDay();
        return TimeSlot.grid(days, periods);
    }

    /** Entries with no course, slot or room are bad input; a missing list is an empty one. */
    static List<AssignmentEntry> checkedEntries(List<AssignmentEntry> entries) {
        if (entries == null) {
            return List.of();
        }
        for (AssignmentEntry entry : entries) {
            if (entry == null || entry.courseId() == null || entry.courseId().isBlank() || entry.slotId() == null
                    || entry.roomId() == null) {
                throw new IllegalArgumentException("Invalid assignment entry " + entry
                        + ": course, slot and room are required.");
            }
        }
        return entries;
    }

    /** Loads an existing assignment; unknown or duplicate sessions are rejected as bad input. */
    static ScheduleState loadAssignment(SchedulingProblem problem, List<AssignmentEntry> entries) {
        ScheduleState state = new ScheduleState(problem);
        for (AssignmentEntry entry : checkedEntries(entries)) {
            try {
                state.assign(new SessionKey(entry.courseId(), entry.sessionIndex()),
                        new Placement(entry.slotId(), entry.roomId()));
            } catch (NoSuchElementException | IllegalStateException e) {
                throw new IllegalArgumentException("Invalid assignment entry " + entry + ": " + e.getMessage(), e);
            }
        }
        return state;
    }

    static List<AssignmentEntry> toEntries(Map<SessionKey, Placement> assignment) {
        List<AssignmentEntry> entries = new ArrayList<>(assignment.size());
        assignment.forEach((key, placement) -> entries.add(
                new AssignmentEntry(key.courseId(), key.index(), placement.slotId(), placement.roomId())));
        return entries;
    }
}
