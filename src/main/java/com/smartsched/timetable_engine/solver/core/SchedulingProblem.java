package com.smartsched.timetable_engine.solver.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.DepartmentPreference;
import com.smartsched.timetable_engine.model.Faculty;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.model.SessionKey;
import com.smartsched.timetable_engine.model.TimeSlot;

/**
 * Immutable, integer-indexed view of one generation run's input. Every stage reads from it;
 * none of them mutate it.
 */
public final class SchedulingProblem {

    private final List<Course> courses;
    private final List<Room> rooms;
    private final List<TimeSlot> slots;
    private final List<Faculty> faculty;
    private final Map<String, DepartmentPreference> preferences;

    private final Map<String, Integer> courseIndex = new HashMap<>();
    private final Map<String, Integer> roomIndex = new HashMap<>();
    private final Map<String, Integer> slotIndex = new HashMap<>();
    private final Map<String, Integer> facultyIndex = new LinkedHashMap<>();
    private final Map<String, Integer> studentIndex = new LinkedHashMap<>();

    private final int[] courseFaculty;
    private final int[][] courseStudents;
    private final int[][] placementRooms;
    private final boolean[] relaxedRooms;
    private final int[] sessionOffset;
    private final int[] sessionCourse;
    private final List<SessionKey> sessions;
    private final String[] facultyIds;
    private final String[] studentIds;

    private SchedulingProblem(List<Course> courses, List<Room> rooms, List<TimeSlot> slots,
                              List<Faculty> faculty, Collection<DepartmentPreference> preferences) {
        if (rooms == null || rooms.isEmpty()) {
            throw new IllegalArgumentException("At least one room is required.");
        }
        if (slots == null || slots.isEmpty()) {
            throw new IllegalArgumentException("At least one time slot is required.");
        }
        this.courses = List.copyOf(courses);
        this.rooms = List.copyOf(rooms);
        this.slots = List.copyOf(slots.stream().sorted(Comparator.comparingInt(TimeSlot::index)).collect(Collectors.toList()));
        this.faculty = faculty == null ? List.of() : List.copyOf(faculty);
        this.preferences = new HashMap<>();
        if (preferences != null) {
            preferences.forEach(p -> this.preferences.put(p.departmentId(), p));
        }

        indexUnique(this.rooms.stream().map(Room::id).collect(Collectors.toList()), roomIndex, "room");
        indexUnique(this.slots.stream().map(TimeSlot::id).collect(Collectors.toList()), slotIndex, "time slot");
        indexUnique(this.courses.stream().map(Course::id).collect(Collectors.toList()), courseIndex, "course");

        this.faculty.forEach(f -> facultyIndex.putIfAbsent(f.id(), facultyIndex.size()));
        Set<String> allStudents = new TreeSet<>();
        for (Course course : this.courses) {
            facultyIndex.putIfAbsent(course.facultyId(), facultyIndex.size());
            allStudents.addAll(course.studentIds());
        }
        allStudents.forEach(s -> studentIndex.put(s, studentIndex.size()));
        facultyIds = facultyIndex.keySet().toArray(new String[0]);
        studentIds = studentIndex.keySet().toArray(new String[0]);

        int n = this.courses.size();
        courseFaculty = new int[n];
        courseStudents = new int[n][];
        placementRooms = new int[n][];
        relaxedRooms = new boolean[n];
        sessionOffset = new int[n + 1];
        List<SessionKey> keys = new ArrayList<>();
        for (int c = 0; c < n; c++) {
            Course course = this.courses.get(c);
            courseFaculty[c] = facultyIndex.get(course.facultyId());
            courseStudents[c] = course.studentIds().stream().mapToInt(studentIndex::get).sorted().toArray();
            placementRooms[c] = computeRooms(course, c);
            sessionOffset[c] = keys.size();
            for (int s = 0; s < course.sessionCount(); s++) {
                keys.add(new SessionKey(course.id(), s));
            }
        }
        sessionOffset[n] = keys.size();
        sessions = List.copyOf(keys);
        sessionCourse = new int[sessions.size()];
        for (int c = 0; c < n; c++) {
            Arrays.fill(sessionCourse, sessionOffset[c], sessionOffset[c + 1], c);
        }
    }

    public static SchedulingProblem of(List<Course> courses, List<Room> rooms, List<TimeSlot> slots,
                                       List<Faculty> faculty, Collection<DepartmentPreference> preferences) {
        return new SchedulingProblem(courses, rooms, slots, faculty, preferences);
    }

    public static SchedulingProblem of(List<Course> courses, List<Room> rooms, List<TimeSlot> slots) {
        return new SchedulingProblem(courses, rooms, slots, List.of(), List.of());
    }

    /** Same rooms, slots and preferences with one more course appended. */
    public SchedulingProblem withCourse(Course course) {
        if (courseIndex.containsKey(course.id())) {
            throw new IllegalArgumentException("Course " + course.id() + " is already part of the schedule.");
        }
        List<Course> extended = new ArrayList<>(courses);
        extended.add(course);
        return new SchedulingProblem(extended, rooms, slots, faculty, preferences.values());
    }

    private static void indexUnique(List<String> ids, Map<String, Integer> index, String kind) {
        for (String id : ids) {
            if (index.putIfAbsent(id, index.size()) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " id: " + id);
            }
        }
    }

    // Rooms satisfying capacity and type, smallest first. A course nothing fits falls back to the
    // largest compatible room so it can still be placed and reported as a capacity violation.
    private int[] computeRooms(Course course, int c) {
        List<Integer> valid = new ArrayList<>();
        for (int r = 0; r < rooms.size(); r++) {
            if (course.accepts(rooms.get(r))) {
                valid.add(r);
            }
        }
        if (valid.isEmpty()) {
            relaxedRooms[c] = true;
            Comparator<Integer> byCapacity = Comparator.comparingInt(r -> rooms.get(r).capacity());
            int largest = -1;
            for (int r = 0; r < rooms.size(); r++) {
                boolean typeOk = course.roomType() == null || course.roomType().equalsIgnoreCase(rooms.get(r).type());
                if (typeOk && (largest < 0 || byCapacity.compare(r, largest) > 0)) {
                    largest = r;
                }
            }
            if (largest < 0) {
                for (int r = 0; r < rooms.size(); r++) {
                    if (largest < 0 || byCapacity.compare(r, largest) > 0) {
                        largest = r;
                    }
                }
            }
            return new int[] { largest };
        }
        return valid.stream()
                .sorted(Comparator.comparingInt((Integer r) -> rooms.get(r).capacity()).thenComparing(r -> r))
                .mapToInt(Integer::intValue)
                .toArray();
    }

    // --- sizes ---
    public int courseCount() { return courses.size(); }
    public int roomCount() { return rooms.size(); }
    public int slotCount() { return slots.size(); }
    public int facultyCount() { return facultyIndex.size(); }
    public int studentCount() { return studentIndex.size(); }
    public int sessionCount() { return sessions.size(); }

    // --- entity access ---
    public List<Course> courses() { return courses; }
    public List<Room> rooms() { return rooms; }
    public List<TimeSlot> slots() { return slots; }
    public List<Faculty> faculty() { return faculty; }
    public Collection<DepartmentPreference> preferences() { return preferences.values(); }
    public List<SessionKey> sessions() { return sessions; }

    public Course course(int c) { return courses.get(c); }
    public Room room(int r) { return rooms.get(r); }
    public TimeSlot slot(int t) { return slots.get(t); }
    public SessionKey session(int s) { return sessions.get(s); }

    public int courseIndexOf(String courseId) {
        Integer c = courseIndex.get(courseId);
        if (c == null) {
            throw new NoSuchElementException("Unknown course: " + courseId);
        }
        return c;
    }

    public boolean hasCourse(String courseId) {
        return courseIndex.containsKey(courseId);
    }

    public int roomIndexOf(String roomId) {
        Integer r = roomIndex.get(roomId);
        if (r == null) {
            throw new NoSuchElementException("Unknown room: " + roomId);
        }
        return r;
    }

    public int slotIndexOf(String slotId) {
        Integer t = slotIndex.get(slotId);
        if (t == null) {
            throw new NoSuchElementException("Unknown time slot: " + slotId);
        }
        return t;
    }

    public int sessionIndexOf(SessionKey key) {
        int c = courseIndexOf(key.courseId());
        int s = sessionOffset[c] + key.index();
        if (key.index() >= courses.get(c).sessionCount()) {
            throw new NoSuchElementException("Unknown session: " + key);
        }
        return s;
    }

    public String facultyIdOf(int f) {
        return facultyIds[f];
    }

    public String studentIdOf(int st) {
        return studentIds[st];
    }

    // --- derived structure ---
    public int courseOfSession(int s) { return sessionCourse[s]; }
    public int firstSession(int c) { return sessionOffset[c]; }
    public int endSession(int c) { return sessionOffset[c + 1]; }
    public int facultyOfCourse(int c) { return courseFaculty[c]; }
    public int[] studentsOfCourse(int c) { return courseStudents[c]; }

    /** Rooms a course may be placed in after capacity/type pruning, smallest first. */
    public int[] roomsForCourse(int c) { return placementRooms[c]; }

    /** True when no room satisfied the course and it was given the largest room instead. */
    public boolean hasRelaxedRooms(int c) { return relaxedRooms[c]; }

    /** Number of (slot, room) domain pairs for each session of the course. */
    public long domainPairs(int c) {
        return (long) placementRooms[c].length * slots.size();
    }

    public boolean fitsRoom(int c, int r) {
        return courses.get(c).accepts(rooms.get(r));
    }

    public int preferenceMisses(int c, int t, int r) {
        DepartmentPreference preference = preferences.get(courses.get(c).departmentId());
        return preference == null ? 0 : preference.misses(slots.get(t), rooms.get(r));
    }

}
