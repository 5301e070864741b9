package com.smartsched.timetable_engine.solver.repair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.model.Cluster;
import com.smartsched.timetable_engine.solver.clustering.CourseGraph;
import com.smartsched.timetable_engine.solver.clustering.LouvainClusterer;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Groups conflicting courses into super-clusters and orders them into waves. Scopes inside one
 * wave have pairwise disjoint course, faculty, student and room footprints and may be repaired
 * concurrently; waves run one after another.
 */
final class SuperClusterPlanner {

    private static final Logger logger = LoggerFactory.getLogger(SuperClusterPlanner.class);

    private static final long COURSE = 0L;
    private static final long FACULTY = 1L << 60;
    private static final long STUDENT = 2L << 60;
    private static final long ROOM = 3L << 60;

    private final SchedulingProblem problem;
    private final EngineSettings settings;

    SuperClusterPlanner(SchedulingProblem problem, EngineSettings settings) {
        this.problem = problem;
        this.settings = settings;
    }

    List<List<RepairScope>> plan(ScheduleState state, int[] conflictingCourses) {
        if (conflictingCourses.length == 0) {
            return List.of();
        }
        CourseGraph graph = CourseGraph.build(problem, conflictingCourses);
        LouvainClusterer clusterer = new LouvainClusterer(settings.getSuperClusterMaxSize(),
                settings.getClusterMinSize(), settings.getClusteringMaxPasses(), settings.getSeed());
        List<Cluster> superClusters = clusterer.cluster(problem, graph);

        List<RepairScope> scopes = new ArrayList<>(superClusters.size());
        for (Cluster cluster : superClusters) {
            int[] courses = cluster.courseIds().stream().mapToInt(problem::courseIndexOf).toArray();
            scopes.add(new RepairScope(cluster.id(), courses, footprint(state, courses)));
        }

        List<List<RepairScope>> waves = new ArrayList<>();
        for (RepairScope scope : scopes) {
            List<RepairScope> target = null;
            for (List<RepairScope> wave : waves) {
                if (wave.stream().allMatch(scope::disjointFrom)) {
                    target = wave;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                waves.add(target);
            }
            target.add(scope);
        }
        logger.info("Planned {} super-clusters over {} conflicting courses in {} waves", scopes.size(),
                conflictingCourses.length, waves.size());
        return waves;
    }

    private Set<Long> footprint(ScheduleState state, int[] courses) {
        Set<Long> footprint = new HashSet<>();
        for (int c : courses) {
            footprint.add(COURSE | c);
            footprint.add(FACULTY | problem.facultyOfCourse(c));
            for (int st : problem.studentsOfCourse(c)) {
                footprint.add(STUDENT | st);
            }
            for (int r : problem.roomsForCourse(c)) {
                footprint.add(ROOM | r);
            }
            for (int s = problem.firstSession(c); s < problem.endSession(c); s++) {
                int r = state.roomIndex(s);
                if (r >= 0) {
                    footprint.add(ROOM | r);
                }
            }
        }
        return footprint;
    }
}
