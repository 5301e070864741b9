package com.smartsched.timetable_engine.model;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One cell of the weekly grid. {@code index} is the position in the slot domain and is used
 * as the static "earliest slot" ordering.
 */
public record TimeSlot(String id, int index, int day, int period) {

    public TimeSlot {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Time slot id is required.");
        }
        if (index < 0 || day < 0 || period < 0) {
            throw new IllegalArgumentException("Time slot " + id + " has a negative coordinate.");
        }
    }

    /**
     * Builds a Monday-first day x period grid, e.g. {@code MON-1 .. SAT-9}.
     */
    public static List<TimeSlot> grid(int days, int periodsPerDay) {
        if (days < 1 || days > 7 || periodsPerDay < 1) {
            throw new IllegalArgumentException("Invalid slot grid " + days + "x" + periodsPerDay);
        }
        List<TimeSlot> slots = new ArrayList<>(days * periodsPerDay);
        int index = 0;
        for (int d = 0; d < days; d++) {
            String dayName = DayOfWeek.of(d + 1).getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toUpperCase(Locale.ROOT);
            for (int p = 0; p < periodsPerDay; p++) {
                slots.add(new TimeSlot(dayName + "-" + (p + 1), index++, d, p));
            }
        }
        return slots;
    }
}
