package com.smartsched.timetable_engine.solver.clustering;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Weighted affinity graph over a set of courses. Vertices are local indices into
 * {@link #courseIndices()}; edge weights combine shared faculty, shared students and department.
 */
public final class CourseGraph {

    static final double SHARED_FACULTY_WEIGHT = 10.0;
    static final double STUDENT_OVERLAP_WEIGHT = 10.0;
    static final double SAME_DEPARTMENT_WEIGHT = 5.0;
    static final double MIN_EDGE_WEIGHT = 0.1;

    private final int[] courseIndices;
    private final List<Map<Integer, Double>> adjacency;

    private CourseGraph(int[] courseIndices, List<Map<Integer, Double>> adjacency) {
        this.courseIndices = courseIndices;
        this.adjacency = adjacency;
    }

    public static CourseGraph build(SchedulingProblem problem) {
        int[] all = new int[problem.courseCount()];
        for (int c = 0; c < all.length; c++) {
            all[c] = c;
        }
        return build(problem, all);
    }

    /**
     * Builds the graph restricted to the given course indices. The department bonus is only added
     * on top of an existing faculty or student link so that large departments stay sparse.
     */
    public static CourseGraph build(SchedulingProblem problem, int[] courseIndices) {
        int n = courseIndices.length;
        Map<Integer, Integer> local = new HashMap<>();
        for (int i = 0; i < n; i++) {
            local.put(courseIndices[i], i);
        }

        Map<Long, Integer> sharedStudents = new HashMap<>();
        Map<Integer, List<Integer>> coursesByStudent = new HashMap<>();
        Map<Integer, List<Integer>> coursesByFaculty = new HashMap<>();
        for (int i = 0; i < n; i++) {
            int c = courseIndices[i];
            coursesByFaculty.computeIfAbsent(problem.facultyOfCourse(c), k -> new ArrayList<>()).add(i);
            for (int st : problem.studentsOfCourse(c)) {
                coursesByStudent.computeIfAbsent(st, k -> new ArrayList<>()).add(i);
            }
        }
        for (List<Integer> enrolled : coursesByStudent.values()) {
            for (int a = 0; a < enrolled.size(); a++) {
                for (int b = a + 1; b < enrolled.size(); b++) {
                    sharedStudents.merge(pair(enrolled.get(a), enrolled.get(b)), 1, Integer::sum);
                }
            }
        }

        Map<Long, Double> weights = new HashMap<>();
        for (List<Integer> taught : coursesByFaculty.values()) {
            for (int a = 0; a < taught.size(); a++) {
                for (int b = a + 1; b < taught.size(); b++) {
                    weights.merge(pair(taught.get(a), taught.get(b)), SHARED_FACULTY_WEIGHT, Double::sum);
                }
            }
        }
        sharedStudents.forEach((key, shared) -> {
            int a = (int) (key >>> 32);
            int b = (int) (key & 0xffffffffL);
            int larger = Math.max(problem.studentsOfCourse(courseIndices[a]).length,
                    problem.studentsOfCourse(courseIndices[b]).length);
            weights.merge(key, STUDENT_OVERLAP_WEIGHT * shared / larger, Double::sum);
        });

        List<Map<Integer, Double>> adjacency = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adjacency.add(new HashMap<>());
        }
        weights.forEach((key, weight) -> {
            int a = (int) (key >>> 32);
            int b = (int) (key & 0xffffffffL);
            Course ca = problem.course(courseIndices[a]);
            Course cb = problem.course(courseIndices[b]);
            if (ca.departmentId() != null && Objects.equals(ca.departmentId(), cb.departmentId())) {
                weight += SAME_DEPARTMENT_WEIGHT;
            }
            if (weight > MIN_EDGE_WEIGHT) {
                adjacency.get(a).put(b, weight);
                adjacency.get(b).put(a, weight);
            }
        });
        return new CourseGraph(courseIndices.clone(), adjacency);
    }

    private static long pair(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | hi;
    }

    public int size() {
        return courseIndices.length;
    }

    public int[] courseIndices() {
        return courseIndices;
    }

    public Map<Integer, Double> neighbors(int vertex) {
        return adjacency.get(vertex);
    }

    public int edgeCount() {
        return adjacency.stream().mapToInt(Map::size).sum() / 2;
    }
}
