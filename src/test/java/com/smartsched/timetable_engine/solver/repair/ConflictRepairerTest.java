package com.smartsched.timetable_engine.solver.repair;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.model.SessionKey;
import com.smartsched.timetable_engine.model.TimeSlot;
import com.smartsched.timetable_engine.solver.core.CancellationToken;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;
import com.smartsched.timetable_engine.solver.progress.WorkReporter;

class ConflictRepairerTest {

    private static final EngineSettings SETTINGS = EngineSettings.defaults();

    private static SchedulingProblem crowded(long seed) {
        Random random = new Random(seed);
        List<Course> courses = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            Set<String> students = new HashSet<>();
            for (int k = 0; k < 3; k++) {
                students.add("st" + random.nextInt(20));
            }
            courses.add(new Course("C" + i, null, "D" + (i % 3), "F" + random.nextInt(8), 2, students, null, 0));
        }
        return SchedulingProblem.of(courses,
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null), new Room("R3", null, 30, null)),
                TimeSlot.grid(2, 6));
    }

    private static ScheduleState scrambled(SchedulingProblem problem, long seed) {
        Random random = new Random(seed);
        int[] slots = new int[problem.sessionCount()];
        int[] rooms = new int[problem.sessionCount()];
        for (int s = 0; s < slots.length; s++) {
            slots[s] = random.nextInt(problem.slotCount());
            rooms[s] = random.nextInt(problem.roomCount());
        }
        return ScheduleState.fromArrays(problem, slots, rooms);
    }

    @Test
    void resolvesSimpleFacultyClash() {
        SchedulingProblem problem = SchedulingProblem.of(
                List.of(new Course("A", null, "D", "F1", 1, Set.of("s1"), null, 0),
                        new Course("B", null, "D", "F1", 1, Set.of("s2"), null, 0)),
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null)),
                TimeSlot.grid(1, 3));
        ScheduleState state = new ScheduleState(problem);
        state.assign(new SessionKey("A", 0), new Placement("MON-1", "R1"));
        state.assign(new SessionKey("B", 0), new Placement("MON-1", "R2"));
        RepairContext context = RepairContext.cold(SETTINGS, CancellationToken.none());

        RepairReport report = new ConflictRepairer(problem, null).repair(state, context, WorkReporter.NOOP);

        assertThat(report.conflictsBefore()).isEqualTo(1);
        assertThat(report.conflictsAfter()).isZero();
        assertThat(report.resolved()).isPositive();
        assertThat(report.manualReview()).isEmpty();
        assertThat(state.conflictCount()).isZero();
        assertThat(context.valueTable().isEmpty()).isFalse();
    }

    @Test
    void neverRaisesTheConflictCountWithAColdTable() {
        for (long seed = 1; seed <= 5; seed++) {
            SchedulingProblem problem = crowded(seed);
            ScheduleState state = scrambled(problem, seed);
            int before = state.conflictCount();

            RepairReport report = new ConflictRepairer(problem, null)
                    .repair(state, RepairContext.cold(SETTINGS, CancellationToken.none()), WorkReporter.NOOP);

            assertThat(report.conflictsBefore()).isEqualTo(before);
            assertThat(report.conflictsAfter()).isLessThanOrEqualTo(before);
            assertThat(state.conflictCount()).isEqualTo(report.conflictsAfter());
        }
    }

    @Test
    void parallelWavesNeverRaiseTheConflictCount() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            SchedulingProblem problem = crowded(11L);
            ScheduleState state = scrambled(problem, 11L);
            int before = state.conflictCount();
            EngineSettings settings = SETTINGS.toBuilder().superClusterMaxSize(5).build();

            RepairReport report = new ConflictRepairer(problem, pool)
                    .repair(state, RepairContext.cold(settings, CancellationToken.none()), WorkReporter.NOOP);

            assertThat(report.conflictsAfter()).isLessThanOrEqualTo(before);
            assertThat(state.conflictCount()).isEqualTo(report.conflictsAfter());
            assertThat(state.isComplete()).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void noSuperClusterEndsWithMoreConflictsThanItStartedWith() {
        EngineSettings settings = SETTINGS.toBuilder().superClusterMaxSize(5).build();
        for (long seed = 21; seed <= 24; seed++) {
            SchedulingProblem problem = crowded(seed);
            ScheduleState state = scrambled(problem, seed);
            List<RepairScope> scopes = new SuperClusterPlanner(problem, settings)
                    .plan(state, conflictingCourses(problem, state)).stream()
                    .flatMap(List::stream)
                    .collect(Collectors.toList());
            int[] before = scopes.stream().mapToInt(scope -> scopeConflicts(problem, state, scope)).toArray();

            new ConflictRepairer(problem, null)
                    .repair(state, RepairContext.cold(settings, CancellationToken.none()), WorkReporter.NOOP);

            assertThat(scopes).isNotEmpty();
            for (int i = 0; i < scopes.size(); i++) {
                assertThat(scopeConflicts(problem, state, scopes.get(i)))
                        .as("super-cluster %d with seed %d", scopes.get(i).id(), seed)
                        .isLessThanOrEqualTo(before[i]);
            }
        }
    }

    private static int[] conflictingCourses(SchedulingProblem problem, ScheduleState state) {
        return IntStream.range(0, problem.sessionCount())
                .filter(s -> state.sessionConflicts(s) > 0)
                .map(problem::courseOfSession)
                .distinct()
                .sorted()
                .toArray();
    }

    private static int scopeConflicts(SchedulingProblem problem, ScheduleState state, RepairScope scope) {
        int total = 0;
        for (int c : scope.courses()) {
            for (int s = problem.firstSession(c); s < problem.endSession(c); s++) {
                total += state.sessionConflicts(s);
            }
        }
        return total;
    }

    @Test
    void restrictedRepairLeavesOtherCoursesAlone() {
        SchedulingProblem problem = SchedulingProblem.of(
                List.of(new Course("A", null, "D", "F1", 1, Set.of("s1"), null, 0),
                        new Course("B", null, "D", "F1", 1, Set.of("s2"), null, 0),
                        new Course("X", null, "D", "F2", 1, Set.of("s3"), null, 0),
                        new Course("Y", null, "D", "F2", 1, Set.of("s4"), null, 0)),
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null)),
                TimeSlot.grid(1, 4));
        ScheduleState state = new ScheduleState(problem);
        state.assign(new SessionKey("A", 0), new Placement("MON-1", "R1"));
        state.assign(new SessionKey("B", 0), new Placement("MON-1", "R2"));
        state.assign(new SessionKey("X", 0), new Placement("MON-2", "R1"));
        state.assign(new SessionKey("Y", 0), new Placement("MON-2", "R2"));

        new ConflictRepairer(problem, null).repair(state, Set.of("A", "B"),
                RepairContext.cold(SETTINGS, CancellationToken.none()), WorkReporter.NOOP);

        assertThat(state.placement(new SessionKey("X", 0))).isEqualTo(new Placement("MON-2", "R1"));
        assertThat(state.placement(new SessionKey("Y", 0))).isEqualTo(new Placement("MON-2", "R2"));
        assertThat(state.conflictCount()).isEqualTo(1);
    }

    @Test
    void transferredEntriesLearnMoreSlowly() {
        ValueTable table = ValueTable.transferredFrom(Map.of("old|MON-1|R1", 0.0), 0.5, 0.1, 0.9);

        table.update("old|MON-1|R1", 1.0, 0.0);
        table.update("new|MON-1|R1", 1.0, 0.0);

        assertThat(table.value("old|MON-1|R1")).isEqualTo(0.1, within(1e-9));
        assertThat(table.value("new|MON-1|R1")).isEqualTo(0.5, within(1e-9));
        assertThat(ValueTable.key("CS.101", "MON-1", "R$1")).isEqualTo("CS_101|MON-1|R_1");
    }
}
