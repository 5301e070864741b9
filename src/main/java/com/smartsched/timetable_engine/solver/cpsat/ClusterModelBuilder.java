package com.smartsched.timetable_engine.solver.cpsat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.Literal;
import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.solver.core.OccupancyView;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Builds the boolean (session, slot, room) model for one cluster.
 * <p>
 * Triples whose room cannot host the course, or whose room or faculty is already taken by a
 * previously committed cluster, never become variables. Faculty exclusivity is posted per
 * (faculty, slot) over individual session variables, so two multi-session courses sharing a
 * lecturer only compete for the same slot, never for their total session count.
 */
final class ClusterModelBuilder {

    private final SchedulingProblem problem;
    private final EngineSettings settings;

    ClusterModelBuilder(SchedulingProblem problem, EngineSettings settings) {
        this.problem = problem;
        this.settings = settings;
    }

    ClusterModel build(int clusterId, int[] courses, OccupancyView reserved, SolverStrategy strategy) {
        int slotCount = problem.slotCount();
        CpModel model = new CpModel();
        List<BoolVar> variables = new ArrayList<>();
        List<Integer> tripleSession = new ArrayList<>();
        List<Integer> tripleSlot = new ArrayList<>();
        List<Integer> tripleRoom = new ArrayList<>();

        Map<Integer, List<Literal>> roomCells = new HashMap<>();
        Map<Integer, List<Literal>> facultyCells = new HashMap<>();
        List<List<List<Literal>>> courseSlotLiterals = new ArrayList<>(courses.length);
        int sessionCount = 0;

        for (int lc = 0; lc < courses.length; lc++) {
            int c = courses[lc];
            int f = problem.facultyOfCourse(c);
            List<List<Literal>> perSlot = new ArrayList<>(slotCount);
            for (int t = 0; t < slotCount; t++) {
                perSlot.add(new ArrayList<>());
            }
            courseSlotLiterals.add(perSlot);

            for (int s = problem.firstSession(c); s < problem.endSession(c); s++) {
                sessionCount++;
                List<Literal> choices = new ArrayList<>();
                for (int t = 0; t < slotCount; t++) {
                    if (reserved.facultyBusy(f, t)) {
                        continue;
                    }
                    for (int r : problem.roomsForCourse(c)) {
                        if (reserved.roomBusy(r, t)) {
                            continue;
                        }
                        BoolVar x = model.newBoolVar("x_" + s + "_" + t + "_" + r);
                        variables.add(x);
                        tripleSession.add(s);
                        tripleSlot.add(t);
                        tripleRoom.add(r);
                        choices.add(x);
                        roomCells.computeIfAbsent(r * slotCount + t, k -> new ArrayList<>()).add(x);
                        facultyCells.computeIfAbsent(f * slotCount + t, k -> new ArrayList<>()).add(x);
                        perSlot.get(t).add(x);
                    }
                }
                // An empty choice list makes the model infeasible, which is the honest answer.
                model.addExactlyOne(choices);
            }
        }

        for (List<Literal> cell : roomCells.values()) {
            if (cell.size() > 1) {
                model.addAtMostOne(cell);
            }
        }
        for (List<Literal> cell : facultyCells.values()) {
            if (cell.size() > 1) {
                model.addAtMostOne(cell);
            }
        }

        int studentConstraints = 0;
        if (strategy.constrainsPriorityStudents()) {
            studentConstraints = addStudentConstraints(model, clusterId, courses, courseSlotLiterals, sessionCount,
                    strategy);
        }

        return new ClusterModel(model, variables,
                tripleSession.stream().mapToInt(Integer::intValue).toArray(),
                tripleSlot.stream().mapToInt(Integer::intValue).toArray(),
                tripleRoom.stream().mapToInt(Integer::intValue).toArray(),
                studentConstraints);
    }

    /**
     * Students enrolled in the same set of cluster courses produce identical constraints, so they
     * are grouped by that set. Groups covering the most cross-enrolled students form the priority
     * subset; the remainder is sampled when the cluster is large.
     */
    private int addStudentConstraints(CpModel model, int clusterId, int[] courses,
                                      List<List<List<Literal>>> courseSlotLiterals, int sessionCount,
                                      SolverStrategy strategy) {
        Map<Integer, List<Integer>> coursesByStudent = new HashMap<>();
        for (int lc = 0; lc < courses.length; lc++) {
            for (int st : problem.studentsOfCourse(courses[lc])) {
                coursesByStudent.computeIfAbsent(st, k -> new ArrayList<>(2)).add(lc);
            }
        }
        Map<List<Integer>, Integer> groups = new HashMap<>();
        for (List<Integer> enrolled : coursesByStudent.values()) {
            if (enrolled.size() > 1) {
                groups.merge(enrolled, 1, Integer::sum);
            }
        }
        List<Map.Entry<List<Integer>, Integer>> ranked = new ArrayList<>(groups.entrySet());
        ranked.sort(Comparator.comparing((Map.Entry<List<Integer>, Integer> e) -> e.getKey().size()).reversed()
                .thenComparing(Map.Entry::getValue, Comparator.reverseOrder())
                .thenComparing(e -> e.getKey().toString()));

        boolean sampleRemainder = sessionCount > settings.getLargeClusterSessions();
        Random random = new Random(settings.getSeed() + clusterId);
        int covered = 0;
        int posted = 0;
        for (Map.Entry<List<Integer>, Integer> group : ranked) {
            boolean priority = covered < settings.getPriorityStudents();
            covered += group.getValue();
            if (!priority) {
                if (!strategy.constrainsRemainingStudents()) {
                    break;
                }
                if (sampleRemainder && random.nextDouble() >= settings.getStudentSampleRate()) {
                    continue;
                }
            }
            for (int t = 0; t < problem.slotCount(); t++) {
                List<Literal> cell = new ArrayList<>();
                for (int lc : group.getKey()) {
                    cell.addAll(courseSlotLiterals.get(lc).get(t));
                }
                if (cell.size() > 1) {
                    model.addAtMostOne(cell);
                    posted++;
                }
            }
        }
        return posted;
    }
}
