package com.smartsched.timetable_engine.solver.clustering;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.smartsched.timetable_engine.model.Cluster;
import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.model.TimeSlot;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

class LouvainClustererTest {

    private static SchedulingProblem campus(int courseCount, long seed) {
        Random random = new Random(seed);
        List<Course> courses = new ArrayList<>();
        for (int i = 0; i < courseCount; i++) {
            Set<String> students = new HashSet<>();
            for (int k = 0; k < 8; k++) {
                students.add("st" + random.nextInt(60));
            }
            courses.add(new Course("C" + i, null, "D" + (i % 4), "F" + random.nextInt(12), 2, students, null, 0));
        }
        return SchedulingProblem.of(courses, List.of(new Room("R1", null, 50, null)), TimeSlot.grid(5, 8));
    }

    @Test
    void everyCourseLandsInExactlyOneBoundedCluster() {
        SchedulingProblem problem = campus(80, 7L);
        LouvainClusterer clusterer = new LouvainClusterer(10, 3, 10, 42L);

        List<Cluster> clusters = clusterer.cluster(problem);

        List<String> seen = new ArrayList<>();
        clusters.forEach(cluster -> seen.addAll(cluster.courseIds()));
        assertThat(seen).hasSize(80).doesNotHaveDuplicates();
        assertThat(clusters).allSatisfy(cluster -> assertThat(cluster.size()).isBetween(1, 10));
        assertThat(clusters).extracting(Cluster::id).doesNotHaveDuplicates();
    }

    @Test
    void sharedFacultyKeepsCoursesTogether() {
        List<Course> courses = List.of(
                new Course("A1", null, "D1", "FA", 1, Set.of("a"), null, 0),
                new Course("A2", null, "D1", "FA", 1, Set.of("a"), null, 0),
                new Course("A3", null, "D1", "FA", 1, Set.of("a"), null, 0),
                new Course("B1", null, "D2", "FB", 1, Set.of("b"), null, 0),
                new Course("B2", null, "D2", "FB", 1, Set.of("b"), null, 0),
                new Course("B3", null, "D2", "FB", 1, Set.of("b"), null, 0));
        SchedulingProblem problem = SchedulingProblem.of(courses, List.of(new Room("R1", null, 10, null)),
                TimeSlot.grid(1, 6));

        List<Cluster> clusters = new LouvainClusterer(3, 1, 10, 1L).cluster(problem);

        assertThat(clusters).hasSize(2);
        assertThat(clusters).extracting(cluster -> Set.copyOf(cluster.courseIds()))
                .containsExactlyInAnyOrder(Set.of("A1", "A2", "A3"), Set.of("B1", "B2", "B3"));
    }

    @Test
    void sameSeedGivesSamePartition() {
        SchedulingProblem problem = campus(40, 3L);

        List<Cluster> first = new LouvainClusterer(8, 2, 10, 99L).cluster(problem);
        List<Cluster> second = new LouvainClusterer(8, 2, 10, 99L).cluster(problem);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void graphOnlyKeepsMeaningfulEdges() {
        List<Course> courses = List.of(
                new Course("X", null, "D1", "F1", 1, Set.of("s1"), null, 0),
                new Course("Y", null, "D1", "F2", 1, Set.of("s2"), null, 0));
        SchedulingProblem problem = SchedulingProblem.of(courses, List.of(new Room("R1", null, 10, null)),
                TimeSlot.grid(1, 2));

        CourseGraph graph = CourseGraph.build(problem);

        // same department alone does not link two courses
        assertThat(graph.edgeCount()).isZero();
    }
}
