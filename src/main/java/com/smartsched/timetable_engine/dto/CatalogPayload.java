package com.smartsched.timetable_engine.dto;

import java.util.List;

import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.DepartmentPreference;
import com.smartsched.timetable_engine.model.Faculty;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.model.TimeSlot;

/**
 * Entities a scheduling operation works on. When {@code slots} is absent a
 * {@code days x periodsPerDay} grid is generated (6 x 9 by default).
 */
public record CatalogPayload(List<Course> courses,
                             List<Room> rooms,
                             List<Faculty> faculty,
                             List<DepartmentPreference> preferences,
                             List<TimeSlot> slots,
                             Integer days,
                             Integer periodsPerDay) {
}
