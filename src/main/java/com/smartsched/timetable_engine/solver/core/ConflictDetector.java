package com.smartsched.timetable_engine.solver.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.model.ConflictType;
import com.smartsched.timetable_engine.model.Severity;

/**
 * Derives the conflict report from a schedule. Faculty and room overlaps are reported per
 * (resource, slot); student overlaps are grouped per slot and set of colliding courses, with the
 * number of affected students deciding the severity.
 * <p>
 * Every conflict's {@code affectedCount} is the excess occupancy it stands for, so the counts of a
 * report add up to {@link ScheduleState#conflictCount()}.
 */
public final class ConflictDetector {

    private ConflictDetector() {}

    public static List<Conflict> detect(ScheduleState state) {
        SchedulingProblem problem = state.problem();
        int[] slots = state.slotArray();
        int[] rooms = state.roomArray();

        Map<Long, TreeSet<String>> facultyCells = new HashMap<>();
        Map<Long, TreeSet<String>> roomCells = new HashMap<>();
        Map<Long, Integer> facultyCounts = new HashMap<>();
        Map<Long, Integer> roomCounts = new HashMap<>();
        List<Map<Integer, List<Integer>>> studentCoursesBySlot = new ArrayList<>();
        for (int t = 0; t < problem.slotCount(); t++) {
            studentCoursesBySlot.add(new HashMap<>());
        }

        for (int s = 0; s < slots.length; s++) {
            int t = slots[s];
            if (t < 0) {
                continue;
            }
            int c = problem.courseOfSession(s);
            String courseId = problem.course(c).id();
            long facultyCell = cell(problem.facultyOfCourse(c), t);
            long roomCell = cell(rooms[s], t);
            facultyCells.computeIfAbsent(facultyCell, k -> new TreeSet<>()).add(courseId);
            roomCells.computeIfAbsent(roomCell, k -> new TreeSet<>()).add(courseId);
            facultyCounts.merge(facultyCell, 1, Integer::sum);
            roomCounts.merge(roomCell, 1, Integer::sum);
            Map<Integer, List<Integer>> bySlot = studentCoursesBySlot.get(t);
            for (int st : problem.studentsOfCourse(c)) {
                bySlot.computeIfAbsent(st, k -> new ArrayList<>(2)).add(c);
            }
        }

        List<Conflict> conflicts = new ArrayList<>();
        facultyCounts.forEach((key, count) -> {
            if (count > 1) {
                int t = (int) (key & 0xffffffffL);
                String facultyId = problem.facultyIdOf((int) (key >>> 32));
                String slotId = problem.slot(t).id();
                conflicts.add(new Conflict(Conflict.idFor(ConflictType.FACULTY, slotId, facultyId),
                        ConflictType.FACULTY, Severity.CRITICAL, new ArrayList<>(facultyCells.get(key)),
                        slotId, facultyId, count - 1));
            }
        });
        roomCounts.forEach((key, count) -> {
            if (count > 1) {
                int t = (int) (key & 0xffffffffL);
                String roomId = problem.room((int) (key >>> 32)).id();
                String slotId = problem.slot(t).id();
                conflicts.add(new Conflict(Conflict.idFor(ConflictType.ROOM, slotId, roomId),
                        ConflictType.ROOM, Severity.CRITICAL, new ArrayList<>(roomCells.get(key)),
                        slotId, roomId, count - 1));
            }
        });
        for (int t = 0; t < problem.slotCount(); t++) {
            Map<String, Integer> students = new TreeMap<>();
            Map<String, Integer> excess = new HashMap<>();
            Map<String, List<String>> courseSets = new HashMap<>();
            for (List<Integer> courses : studentCoursesBySlot.get(t).values()) {
                if (courses.size() < 2) {
                    continue;
                }
                TreeSet<String> ids = new TreeSet<>();
                courses.forEach(c -> ids.add(problem.course(c).id()));
                String groupKey = String.join("+", ids);
                students.merge(groupKey, 1, Integer::sum);
                excess.merge(groupKey, courses.size() - 1, Integer::sum);
                courseSets.putIfAbsent(groupKey, new ArrayList<>(ids));
            }
            String slotId = problem.slot(t).id();
            students.forEach((groupKey, count) -> conflicts.add(new Conflict(
                    Conflict.idFor(ConflictType.STUDENT, slotId, groupKey), ConflictType.STUDENT,
                    Severity.forStudentOverlap(count), courseSets.get(groupKey), slotId, groupKey,
                    excess.get(groupKey))));
        }
        conflicts.sort(Comparator.comparing(Conflict::severity).thenComparing(Conflict::id));
        return conflicts;
    }

    private static long cell(int resource, int slot) {
        return ((long) resource << 32) | slot;
    }
}
