package com.smartsched.timetable_engine.solver.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.model.ConflictType;
import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.model.SessionKey;
import com.smartsched.timetable_engine.model.Severity;
import com.smartsched.timetable_engine.model.TimeSlot;

class ConflictDetectorTest {

    private static SchedulingProblem problem() {
        return SchedulingProblem.of(
                List.of(new Course("MATH", null, "D1", "F1", 1, Set.of("s1", "s2", "s3", "s4", "s5", "s6"), null, 0),
                        new Course("PHYS", null, "D1", "F1", 1, Set.of("s1", "s2", "s3", "s4", "s5"), null, 0),
                        new Course("CHEM", null, "D2", "F2", 1, Set.of("s9"), null, 0)),
                List.of(new Room("R1", null, 40, null), new Room("R2", null, 40, null)),
                TimeSlot.grid(1, 2));
    }

    @Test
    void cleanScheduleHasNoConflicts() {
        ScheduleState state = new ScheduleState(problem());
        state.assign(new SessionKey("MATH", 0), new Placement("MON-1", "R1"));
        state.assign(new SessionKey("PHYS", 0), new Placement("MON-2", "R1"));
        state.assign(new SessionKey("CHEM", 0), new Placement("MON-1", "R2"));

        assertThat(ConflictDetector.detect(state)).isEmpty();
    }

    @Test
    void reportsFacultyRoomAndStudentOverlapsOrderedBySeverity() {
        ScheduleState state = new ScheduleState(problem());
        state.assign(new SessionKey("MATH", 0), new Placement("MON-1", "R1"));
        state.assign(new SessionKey("PHYS", 0), new Placement("MON-1", "R2"));
        state.assign(new SessionKey("CHEM", 0), new Placement("MON-1", "R1"));

        List<Conflict> conflicts = ConflictDetector.detect(state);

        assertThat(conflicts).extracting(Conflict::type)
                .containsExactly(ConflictType.FACULTY, ConflictType.ROOM, ConflictType.STUDENT);
        Conflict faculty = conflicts.get(0);
        assertThat(faculty.id()).isEqualTo("faculty:MON-1:F1");
        assertThat(faculty.courseIds()).containsExactly("MATH", "PHYS");
        assertThat(faculty.severity()).isEqualTo(Severity.CRITICAL);

        Conflict room = conflicts.get(1);
        assertThat(room.resourceId()).isEqualTo("R1");
        assertThat(room.courseIds()).containsExactly("CHEM", "MATH");

        Conflict student = conflicts.get(2);
        assertThat(student.id()).isEqualTo("student:MON-1:MATH+PHYS");
        assertThat(student.affectedCount()).isEqualTo(5);
        assertThat(student.severity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void detectedConflictTotalsMatchIncrementalCount() {
        ScheduleState state = new ScheduleState(problem());
        state.assign(new SessionKey("MATH", 0), new Placement("MON-1", "R1"));
        state.assign(new SessionKey("PHYS", 0), new Placement("MON-1", "R2"));

        int detected = ConflictDetector.detect(state).stream().mapToInt(Conflict::affectedCount).sum();

        assertThat(detected).isEqualTo(state.conflictCount());
    }

    @Test
    void studentInThreeCoursesCountsTwoExcessBookings() {
        SchedulingProblem problem = SchedulingProblem.of(
                List.of(new Course("A", null, "D1", "F1", 1, Set.of("s1"), null, 0),
                        new Course("B", null, "D1", "F2", 1, Set.of("s1"), null, 0),
                        new Course("C", null, "D1", "F3", 1, Set.of("s1"), null, 0)),
                List.of(new Room("R1", null, 40, null), new Room("R2", null, 40, null),
                        new Room("R3", null, 40, null)),
                TimeSlot.grid(1, 2));
        ScheduleState state = new ScheduleState(problem);
        state.assign(new SessionKey("A", 0), new Placement("MON-1", "R1"));
        state.assign(new SessionKey("B", 0), new Placement("MON-1", "R2"));
        state.assign(new SessionKey("C", 0), new Placement("MON-1", "R3"));

        List<Conflict> conflicts = ConflictDetector.detect(state);

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.id()).isEqualTo("student:MON-1:A+B+C");
            assertThat(conflict.affectedCount()).isEqualTo(2);
            assertThat(conflict.severity()).isEqualTo(Severity.LOW);
        });
        assertThat(state.conflictCount()).isEqualTo(2);
    }
}
