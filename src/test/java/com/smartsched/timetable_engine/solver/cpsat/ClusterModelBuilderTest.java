package com.smartsched.timetable_engine.solver.cpsat;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.google.ortools.Loader;
import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.model.SessionKey;
import com.smartsched.timetable_engine.model.TimeSlot;
import com.smartsched.timetable_engine.solver.core.OccupancyView;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Three student groups over six single-session courses: C0/C1 share three students, C2/C3 two
 * and C4/C5 one. BLOCK, taught by C2's lecturer, already holds MON-1 in room R2, so MON-1 offers
 * only R1 and nothing at all to C2.
 */
class ClusterModelBuilderTest {

    private static final EngineSettings BASE = EngineSettings.builder().priorityStudents(3).build();

    private static SchedulingProblem problem;
    private static OccupancyView reserved;
    private static int[] cluster;

    @BeforeAll
    static void setUp() {
        Loader.loadNativeLibraries();
        problem = SchedulingProblem.of(
                List.of(new Course("C0", null, "D", "F0", 1, Set.of("a", "b", "c"), null, 0),
                        new Course("C1", null, "D", "F1", 1, Set.of("a", "b", "c"), null, 0),
                        new Course("C2", null, "D", "F2", 1, Set.of("d", "e"), null, 0),
                        new Course("C3", null, "D", "F3", 1, Set.of("d", "e"), null, 0),
                        new Course("C4", null, "D", "F4", 1, Set.of("g"), null, 0),
                        new Course("C5", null, "D", "F5", 1, Set.of("g"), null, 0),
                        new Course("BLOCK", null, "D", "F2", 1, Set.of("z"), null, 0)),
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null)),
                TimeSlot.grid(1, 4));
        ScheduleState state = new ScheduleState(problem);
        state.assign(new SessionKey("BLOCK", 0), new Placement("MON-1", "R2"));
        reserved = state.occupancy();
        cluster = List.of("C0", "C1", "C2", "C3", "C4", "C5").stream().mapToInt(problem::courseIndexOf).toArray();
    }

    private static ClusterModel build(EngineSettings settings, SolverStrategy strategy) {
        return new ClusterModelBuilder(problem, settings).build(0, cluster, reserved, strategy);
    }

    @Test
    void reservedRoomAndFacultyCellsCreateNoVariables() {
        ClusterModel model = build(BASE, SolverStrategy.ESSENTIAL);

        // Five courses get R1 at MON-1 plus both rooms later; C2 only the later six.
        assertThat(model.domainSize()).isEqualTo(5 * 7 + 6);
        for (int i = 0; i < model.domainSize(); i++) {
            if (model.tripleSlot()[i] == 0) {
                assertThat(problem.room(model.tripleRoom()[i]).id()).isEqualTo("R1");
                assertThat(problem.course(problem.courseOfSession(model.tripleSession()[i])).id()).isNotEqualTo("C2");
            }
        }
    }

    @Test
    void essentialStrategyPostsNoStudentConstraints() {
        assertThat(build(BASE, SolverStrategy.ESSENTIAL).studentConstraints()).isZero();
    }

    @Test
    void relaxedStrategyKeepsOnlyTheLargestGroups() {
        // The C0/C1 group alone covers the three priority students: one constraint per slot.
        assertThat(build(BASE, SolverStrategy.RELAXED_STUDENTS).studentConstraints()).isEqualTo(4);
    }

    @Test
    void fullStrategyConstrainsEveryGroupInSmallClusters() {
        // C2/C3 at MON-1 has a single literal left, so no constraint is needed there.
        assertThat(build(BASE, SolverStrategy.FULL).studentConstraints()).isEqualTo(4 + 3 + 4);
    }

    @Test
    void largeClustersSampleOnlyTheRemainingGroups() {
        EngineSettings noneSampled = BASE.toBuilder().largeClusterSessions(1).studentSampleRate(0.0).build();
        EngineSettings allSampled = BASE.toBuilder().largeClusterSessions(1).studentSampleRate(1.0).build();

        assertThat(build(noneSampled, SolverStrategy.FULL).studentConstraints()).isEqualTo(4);
        assertThat(build(allSampled, SolverStrategy.FULL).studentConstraints()).isEqualTo(11);
    }

    @Test
    void priorityGroupsAreNeverSampledAway() {
        EngineSettings everyonePriority = BASE.toBuilder()
                .priorityStudents(200)
                .largeClusterSessions(1)
                .studentSampleRate(0.0)
                .build();

        assertThat(build(everyonePriority, SolverStrategy.FULL).studentConstraints()).isEqualTo(11);
    }
}
