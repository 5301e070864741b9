package com.smartsched.timetable_engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.dto.AssignmentEntry;
import com.smartsched.timetable_engine.dto.CatalogPayload;
import com.smartsched.timetable_engine.dto.ConflictDetectionRequest;
import com.smartsched.timetable_engine.dto.ConflictResolutionRequest;
import com.smartsched.timetable_engine.dto.ConflictResolutionResponse;
import com.smartsched.timetable_engine.dto.ResolutionDetail;
import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.model.ConflictType;
import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.solver.repair.ValueTable;

@ExtendWith(MockitoExtension.class)
class ConflictServiceTest {

    private static final String FACULTY_CLASH = "faculty:MON-1:F1";

    @Mock
    private ValueTableService valueTableService;

    private ConflictService service;

    @BeforeEach
    void setUp() {
        service = new ConflictService(valueTableService, EngineSettings.defaults());
    }

    private static CatalogPayload catalog() {
        return new CatalogPayload(
                List.of(new Course("A", null, "D1", "F1", 1, Set.of("s1"), null, 0),
                        new Course("B", null, "D1", "F1", 1, Set.of("s2"), null, 0)),
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null)),
                null, null, null, 1, 3);
    }

    private static List<AssignmentEntry> clashing() {
        return List.of(new AssignmentEntry("A", 0, "MON-1", "R1"), new AssignmentEntry("B", 0, "MON-1", "R2"));
    }

    @Test
    void detectsTheFacultyClash() {
        List<Conflict> conflicts = service.detectConflicts(new ConflictDetectionRequest(catalog(), clashing()));

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.id()).isEqualTo(FACULTY_CLASH);
            assertThat(conflict.type()).isEqualTo(ConflictType.FACULTY);
        });
    }

    @Test
    void autoResolutionMovesOneSessionAndPersistsLearning() {
        when(valueTableService.load("org-1", "2024-1")).thenReturn(new ValueTable(0.5, 0.1, 0.9));

        ConflictResolutionResponse response = service.resolve(
                new ConflictResolutionRequest(catalog(), clashing(), FACULTY_CLASH, true, "org-1", "2024-1"));

        assertThat(response.resolved()).isEqualTo(1);
        assertThat(response.conflictsBefore()).isEqualTo(1);
        assertThat(response.conflictsAfter()).isZero();
        assertThat(response.details()).extracting(ResolutionDetail::outcome).containsExactly(ResolutionDetail.RESOLVED);
        assertThat(response.manualReview()).isEmpty();
        verify(valueTableService).save(eq("org-1"), eq("2024-1"), any(ValueTable.class));
    }

    @Test
    void manualModeOnlyReports() {
        ConflictResolutionResponse response = service.resolve(
                new ConflictResolutionRequest(catalog(), clashing(), FACULTY_CLASH, false, "org-1", "2024-1"));

        assertThat(response.resolved()).isZero();
        assertThat(response.manualReview()).containsExactly("A", "B");
        assertThat(response.assignment()).containsExactlyElementsOf(clashing());
        verify(valueTableService, never()).load(any(), any());
    }

    @Test
    void unknownConflictIsNotFound() {
        assertThatThrownBy(() -> service.resolve(
                new ConflictResolutionRequest(catalog(), clashing(), "room:MON-9:R1", true, null, null)))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void malformedAssignmentIsBadInput() {
        List<AssignmentEntry> duplicate = List.of(new AssignmentEntry("A", 0, "MON-1", "R1"),
                new AssignmentEntry("A", 0, "MON-2", "R1"));

        assertThatThrownBy(() -> service.detectConflicts(new ConflictDetectionRequest(catalog(), duplicate)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void partlyRepairedStudentOverlapStaysUnderManualReview() {
        when(valueTableService.load("org-1", "2024-1")).thenReturn(new ValueTable(0.5, 0.1, 0.9));
        CatalogPayload catalog = new CatalogPayload(
                List.of(new Course("A", null, "D1", "F1", 1, Set.of("s1"), null, 0),
                        new Course("B", null, "D1", "F2", 1, Set.of("s1"), null, 0),
                        new Course("C", null, "D1", "F3", 1, Set.of("s1"), null, 0)),
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null),
                        new Room("R3", null, 30, null)),
                null, null, null, 1, 2);
        List<AssignmentEntry> tripleBooked = List.of(new AssignmentEntry("A", 0, "MON-1", "R1"),
                new AssignmentEntry("B", 0, "MON-1", "R2"), new AssignmentEntry("C", 0, "MON-1", "R3"));

        ConflictResolutionResponse response = service.resolve(new ConflictResolutionRequest(catalog, tripleBooked,
                "student:MON-1:A+B+C", true, "org-1", "2024-1"));

        // Two slots for three courses: at least two of them still collide at one slot.
        assertThat(response.conflictsAfter()).isGreaterThanOrEqualTo(1);
        assertThat(response.resolved()).isZero();
        assertThat(response.details()).extracting(ResolutionDetail::outcome)
                .containsExactly(ResolutionDetail.MANUAL_REVIEW);
        assertThat(response.manualReview()).isNotEmpty();
    }
}
