package com.smartsched.timetable_engine.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.smartsched.timetable_engine.dto.AssignmentEntry;
import com.smartsched.timetable_engine.dto.CatalogPayload;
import com.smartsched.timetable_engine.dto.CourseAdditionRequest;
import com.smartsched.timetable_engine.dto.CourseAdditionResponse;
import com.smartsched.timetable_engine.dto.CourseRemovalRequest;
import com.smartsched.timetable_engine.dto.CourseRemovalResponse;
import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.solver.core.MoveJournal;
import com.smartsched.timetable_engine.solver.core.MoveResult;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Point updates to an existing assignment. A new course's sessions are placed one by one through
 * the validated apply, preferring days the course does not use yet; existing assignments are
 * never moved. If any session has no conflict-free placement the whole addition is rolled back.
 */
@Service
public class IncrementalUpdateService {

    private static final Logger logger = LoggerFactory.getLogger(IncrementalUpdateService.class);

    public CourseAdditionResponse addCourse(CourseAdditionRequest request) {
        Course course = request.course();
        if (course == null) {
            throw new IllegalArgumentException("Course to add is required.");
        }
        boolean alreadyScheduled = CatalogMapper.checkedEntries(request.assignment()).stream()
                .anyMatch(e -> e.courseId().equals(course.id()));
        if (alreadyScheduled) {
            throw new IllegalArgumentException("Course " + course.id() + " is already part of the assignment.");
        }
        SchedulingProblem problem = problemWith(request.catalog(), course);
        ScheduleState state = CatalogMapper.loadAssignment(problem, request.assignment());
        List<AssignmentEntry> existing = CatalogMapper.toEntries(state.assignments());

        int c = problem.courseIndexOf(course.id());
        MoveJournal journal = new MoveJournal();
        Set<Integer> usedDays = new HashSet<>();
        List<AssignmentEntry> placed = new ArrayList<>();
        for (int s = problem.firstSession(c); s < problem.endSession(c); s++) {
            int[] target = findPlacement(problem, state, s, usedDays);
            MoveResult result = target == null ? MoveResult.rejected() : state.applyIndex(s, target[0], target[1], journal);
            if (!result.applied()) {
                state.rollback(journal);
                String message = "No conflict-free placement for session " + problem.session(s) + " of course "
                        + course.id();
                logger.warn("!!! {}", message);
                return new CourseAdditionResponse(false, List.of(), existing, message);
            }
            usedDays.add(problem.slot(target[0]).day());
            Placement placement = state.placement(problem.session(s));
            placed.add(new AssignmentEntry(course.id(), problem.session(s).index(), placement.slotId(),
                    placement.roomId()));
        }
        logger.info("Added course {} with {} sessions", course.id(), placed.size());
        return new CourseAdditionResponse(true, placed, CatalogMapper.toEntries(state.assignments()),
                "Added " + placed.size() + " sessions");
    }

    /** Replaces a course's definition and re-places only its sessions. */
    public CourseAdditionResponse updateCourse(CourseAdditionRequest request) {
        Course course = request.course();
        if (course == null) {
            throw new IllegalArgumentException("Course to update is required.");
        }
        List<AssignmentEntry> others = new ArrayList<>();
        boolean found = false;
        for (AssignmentEntry entry : CatalogMapper.checkedEntries(request.assignment())) {
            if (entry.courseId().equals(course.id())) {
                found = true;
            } else {
                others.add(entry);
            }
        }
        if (!found) {
            throw new NoSuchElementException("Course " + course.id() + " is not part of the assignment.");
        }
        CourseAdditionResponse response = addCourse(new CourseAdditionRequest(request.catalog(), others, course));
        if (!response.success()) {
            return new CourseAdditionResponse(false, List.of(), request.assignment(), response.message());
        }
        return response;
    }

    public CourseRemovalResponse removeCourse(CourseRemovalRequest request) {
        if (request.courseId() == null) {
            throw new IllegalArgumentException("Course id is required.");
        }
        List<AssignmentEntry> removed = new ArrayList<>();
        List<AssignmentEntry> kept = new ArrayList<>();
        for (AssignmentEntry entry : CatalogMapper.checkedEntries(request.assignment())) {
            (entry.courseId().equals(request.courseId()) ? removed : kept).add(entry);
        }
        if (removed.isEmpty()) {
            throw new NoSuchElementException("Course " + request.courseId() + " has no assigned sessions.");
        }
        logger.info("Removed course {} ({} sessions)", request.courseId(), removed.size());
        return new CourseRemovalResponse(removed, kept);
    }

    private static SchedulingProblem problemWith(CatalogPayload catalog, Course course) {
        if (catalog == null) {
            throw new IllegalArgumentException("A catalog of courses, rooms and time slots is required.");
        }
        List<Course> others = new ArrayList<>();
        if (catalog.courses() != null) {
            catalog.courses().stream().filter(c -> !c.id().equals(course.id())).forEach(others::add);
        }
        CatalogPayload base = new CatalogPayload(others, catalog.rooms(), catalog.faculty(), catalog.preferences(),
                catalog.slots(), catalog.days(), catalog.periodsPerDay());
        return CatalogMapper.toProblem(base).withCourse(course);
    }

    // Earliest clash-free pair, on a day the course has not used yet when one exists.
    private static int[] findPlacement(SchedulingProblem problem, ScheduleState state, int s, Set<Integer> usedDays) {
        int c = problem.courseOfSession(s);
        int[] fallback = null;
        for (int t = 0; t < problem.slotCount(); t++) {
            boolean freshDay = !usedDays.contains(problem.slot(t).day());
            if (!freshDay && fallback != null) {
                continue;
            }
            for (int r : problem.roomsForCourse(c)) {
                if (problem.fitsRoom(c, r) && state.introducedAtIndex(s, t, r) == 0) {
                    if (freshDay) {
                        return new int[] { t, r };
                    }
                    fallback = new int[] { t, r };
                    break;
                }
            }
        }
        return fallback;
    }
}
