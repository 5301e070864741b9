package com.smartsched.timetable_engine.solver.repair;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Enumerates (slot, room) pairs a session could move to without introducing any overlap against
 * the current state, ranked by learned value when the table has entries and by earliest slot
 * (smallest adequate room first) otherwise.
 */
final class FeasibleSlotGenerator {

    private final SchedulingProblem problem;
    private final int maxCandidates;

    FeasibleSlotGenerator(SchedulingProblem problem, int maxCandidates) {
        this.problem = problem;
        this.maxCandidates = Math.max(1, maxCandidates);
    }

    List<Candidate> candidates(ScheduleState state, int session, ValueTable table) {
        int c = problem.courseOfSession(session);
        String courseId = problem.course(c).id();
        int currentSlot = state.slotIndex(session);
        int currentRoom = state.roomIndex(session);
        boolean learned = !table.isEmpty();

        List<Candidate> found = new ArrayList<>();
        outer:
        for (int t = 0; t < problem.slotCount(); t++) {
            for (int r : problem.roomsForCourse(c)) {
                if (t == currentSlot && r == currentRoom) {
                    continue;
                }
                if (state.introducedAtIndex(session, t, r) != 0) {
                    continue;
                }
                String key = ValueTable.key(courseId, problem.slot(t).id(), problem.room(r).id());
                found.add(new Candidate(t, r, key, learned ? table.value(key) : 0.0));
                if (!learned && found.size() >= maxCandidates) {
                    break outer;
                }
            }
        }
        if (learned) {
            found.sort(Comparator.comparingDouble(Candidate::value).reversed()
                    .thenComparingInt(Candidate::slot));
            if (found.size() > maxCandidates) {
                return new ArrayList<>(found.subList(0, maxCandidates));
            }
        }
        return found;
    }
}
