package com.smartsched.timetable_engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.smartsched.timetable_engine.dto.AssignmentEntry;
import com.smartsched.timetable_engine.dto.CatalogPayload;
import com.smartsched.timetable_engine.dto.CourseAdditionRequest;
import com.smartsched.timetable_engine.dto.CourseAdditionResponse;
import com.smartsched.timetable_engine.dto.CourseRemovalRequest;
import com.smartsched.timetable_engine.dto.CourseRemovalResponse;
import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.solver.core.ConflictDetector;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

class IncrementalUpdateServiceTest {

    private final IncrementalUpdateService service = new IncrementalUpdateService();

    private static final Course EXISTING = new Course("EX", null, "D1", "F1", 1, Set.of("s1", "s2", "s3"), null, 0);
    private static final List<AssignmentEntry> ASSIGNMENT = List.of(new AssignmentEntry("EX", 0, "MON-1", "R1"));

    private static CatalogPayload catalog() {
        return new CatalogPayload(List.of(EXISTING),
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null)),
                null, null, null, 3, 2);
    }

    @Test
    void addsEverySessionWithoutTouchingExistingPlacements() {
        Course added = new Course("NEW", null, "D1", "F2", 3, Set.of("s1", "s2", "s3"), null, 0);

        CourseAdditionResponse response = service.addCourse(new CourseAdditionRequest(catalog(), ASSIGNMENT, added));

        assertThat(response.success()).isTrue();
        assertThat(response.assignedSessions()).extracting(AssignmentEntry::slotId)
                .containsExactly("MON-2", "TUE-1", "WED-1");
        assertThat(response.assignment()).contains(ASSIGNMENT.get(0)).hasSize(4);
    }

    @Test
    void rollsBackWhenASessionCannotBePlaced() {
        // F1 already teaches at MON-1, leaving five free periods for six sessions
        Course added = new Course("HEAVY", null, "D1", "F1", 6, Set.of("s9"), null, 0);

        CourseAdditionResponse response = service.addCourse(new CourseAdditionRequest(catalog(), ASSIGNMENT, added));

        assertThat(response.success()).isFalse();
        assertThat(response.assignedSessions()).isEmpty();
        assertThat(response.assignment()).containsExactlyElementsOf(ASSIGNMENT);
    }

    @Test
    void refusesToAddAScheduledCourseTwice() {
        assertThatThrownBy(() -> service.addCourse(new CourseAdditionRequest(catalog(), ASSIGNMENT, EXISTING)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updateReplacesOnlyTheCoursesOwnSessions() {
        Course changed = new Course("EX", null, "D1", "F1", 2, Set.of("s1"), null, 0);
        List<AssignmentEntry> assignment = List.of(new AssignmentEntry("EX", 0, "MON-1", "R1"),
                new AssignmentEntry("OTHER", 0, "MON-1", "R2"));
        CatalogPayload catalog = new CatalogPayload(
                List.of(EXISTING, new Course("OTHER", null, "D2", "F3", 1, Set.of("s7"), null, 0)),
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null)),
                null, null, null, 3, 2);

        CourseAdditionResponse response = service.updateCourse(new CourseAdditionRequest(catalog, assignment, changed));

        assertThat(response.success()).isTrue();
        assertThat(response.assignedSessions()).hasSize(2);
        assertThat(response.assignment()).contains(new AssignmentEntry("OTHER", 0, "MON-1", "R2"));
    }

    @Test
    void updatingAnUnknownCourseIsNotFound() {
        Course stranger = new Course("NOPE", null, "D1", "F1", 1, Set.of(), null, 0);

        assertThatThrownBy(() -> service.updateCourse(new CourseAdditionRequest(catalog(), ASSIGNMENT, stranger)))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void removeDropsOnlyTheNamedCourse() {
        List<AssignmentEntry> assignment = List.of(new AssignmentEntry("EX", 0, "MON-1", "R1"),
                new AssignmentEntry("NEW", 0, "MON-2", "R1"), new AssignmentEntry("NEW", 1, "TUE-1", "R1"));

        CourseRemovalResponse response = service.removeCourse(new CourseRemovalRequest(assignment, "NEW"));

        assertThat(response.removedSessions()).hasSize(2);
        assertThat(response.assignment()).containsExactly(new AssignmentEntry("EX", 0, "MON-1", "R1"));
        assertThatThrownBy(() -> service.removeCourse(new CourseRemovalRequest(assignment, "GONE")))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void addingACourseLeavesTheConflictReportUnchanged() {
        // CLASH shares faculty F1 with EX at MON-1: one conflict exists before the addition
        Course clash = new Course("CLASH", null, "D1", "F1", 1, Set.of("s8"), null, 0);
        Course added = new Course("NEW", null, "D1", "F2", 3, Set.of("s1", "s2", "s8"), null, 0);
        List<Room> rooms = List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null));
        List<AssignmentEntry> assignment = List.of(new AssignmentEntry("EX", 0, "MON-1", "R1"),
                new AssignmentEntry("CLASH", 0, "MON-1", "R2"));
        CatalogPayload catalog = new CatalogPayload(List.of(EXISTING, clash), rooms, null, null, null, 3, 2);
        SchedulingProblem full = CatalogMapper.toProblem(
                new CatalogPayload(List.of(EXISTING, clash, added), rooms, null, null, null, 3, 2));
        List<Conflict> before = ConflictDetector.detect(CatalogMapper.loadAssignment(full, assignment));

        CourseAdditionResponse response = service.addCourse(new CourseAdditionRequest(catalog, assignment, added));

        assertThat(response.success()).isTrue();
        List<Conflict> after = ConflictDetector.detect(CatalogMapper.loadAssignment(full, response.assignment()));
        assertThat(before).extracting(Conflict::id).containsExactly("faculty:MON-1:F1");
        assertThat(after).containsExactlyElementsOf(before);
    }

    @Test
    void entryWithoutACourseIdIsBadInput() {
        List<AssignmentEntry> broken = List.of(new AssignmentEntry("EX", 0, "MON-1", "R1"),
                new AssignmentEntry(null, 0, "MON-2", "R1"));
        Course added = new Course("NEW", null, "D1", "F2", 1, Set.of("s4"), null, 0);

        assertThatThrownBy(() -> service.addCourse(new CourseAdditionRequest(catalog(), broken, added)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("course, slot and room are required");
        assertThatThrownBy(() -> service.updateCourse(new CourseAdditionRequest(catalog(), broken, EXISTING)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.removeCourse(new CourseRemovalRequest(broken, "EX")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
