package com.smartsched.timetable_engine.solver.core;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.model.SessionKey;

/**
 * The live assignment plus its occupancy indices (faculty x slot, room x slot, student x slot).
 * <p>
 * Conflicts are counted as the excess occupancy of every (resource, slot) cell, i.e. a cell
 * holding n sessions contributes {@code max(0, n - 1)}. The count is maintained incrementally.
 * <p>
 * Mutation goes through a small set of operations: {@link #assign} places an unassigned session
 * unconditionally (initial load), {@link #applyIfConflictFree} and {@link #trySwap} consult the
 * conflict oracle first, and {@link #rollback} undoes a journal. Nothing overwrites a placement
 * in place. All operations are atomic with respect to each other.
 */
public final class ScheduleState {

    private final SchedulingProblem problem;
    private final int slotCount;

    private final int[] slotOf;
    private final int[] roomOf;
    private final int[] facultyLoad;
    private final int[] roomLoad;
    private final int[] studentLoad;

    private int conflicts;
    private int capacityViolations;
    private int preferenceMisses;
    private int assigned;

    public ScheduleState(SchedulingProblem problem) {
        this.problem = problem;
        this.slotCount = problem.slotCount();
        this.slotOf = new int[problem.sessionCount()];
        this.roomOf = new int[problem.sessionCount()];
        Arrays.fill(slotOf, -1);
        Arrays.fill(roomOf, -1);
        this.facultyLoad = new int[problem.facultyCount() * slotCount];
        this.roomLoad = new int[problem.roomCount() * slotCount];
        this.studentLoad = new int[problem.studentCount() * slotCount];
    }

    /** Loads a complete chromosome-style assignment (slot and room index per session). */
    public static ScheduleState fromArrays(SchedulingProblem problem, int[] slots, int[] rooms) {
        ScheduleState state = new ScheduleState(problem);
        for (int s = 0; s < slots.length; s++) {
            if (slots[s] >= 0) {
                state.add(s, slots[s], rooms[s]);
            }
        }
        return state;
    }

    public synchronized ScheduleState copy() {
        return fromArrays(problem, slotOf, roomOf);
    }

    // ---------------------------------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------------------------------

    /**
     * Places an unassigned session without consulting the oracle.
     *
     * @return the number of conflicts the placement introduced
     */
    public synchronized int assign(SessionKey key, Placement placement) {
        return assignIndex(problem.sessionIndexOf(key), problem.slotIndexOf(placement.slotId()),
                problem.roomIndexOf(placement.roomId()));
    }

    public synchronized int assignIndex(int s, int t, int r) {
        if (slotOf[s] >= 0) {
            throw new IllegalStateException("Session " + problem.session(s) + " is already assigned.");
        }
        return add(s, t, r);
    }

    /**
     * Moves (or places) a session only if the target introduces zero new faculty, room or student
     * overlaps against the current state, and the room is one the course may use.
     */
    public synchronized MoveResult applyIfConflictFree(SessionKey key, Placement target, MoveJournal journal) {
        return applyIndex(problem.sessionIndexOf(key), problem.slotIndexOf(target.slotId()),
                problem.roomIndexOf(target.roomId()), journal);
    }

    public synchronized MoveResult applyIndex(int s, int t, int r, MoveJournal journal) {
        if (slotOf[s] == t && roomOf[s] == r) {
            return MoveResult.rejected();
        }
        if (!roomAllowed(s, r) || introducedAt(s, t, r) != 0) {
            return MoveResult.rejected();
        }
        int before = conflicts;
        Placement previous = placementOf(s);
        if (slotOf[s] >= 0) {
            remove(s);
        }
        add(s, t, r);
        if (journal != null) {
            journal.record(problem.session(s), previous, placementOf(s));
        }
        return new MoveResult(true, conflicts - before);
    }

    /**
     * Exchanges the placements of two assigned sessions if, with both lifted out, each one's new
     * position is conflict-free. The state is left untouched when the swap is rejected.
     */
    public synchronized MoveResult trySwap(SessionKey a, SessionKey b, MoveJournal journal) {
        int sa = problem.sessionIndexOf(a);
        int sb = problem.sessionIndexOf(b);
        if (sa == sb || slotOf[sa] < 0 || slotOf[sb] < 0) {
            return MoveResult.rejected();
        }
        int ta = slotOf[sa], ra = roomOf[sa], tb = slotOf[sb], rb = roomOf[sb];
        if ((ta == tb && ra == rb) || !roomAllowed(sa, rb) || !roomAllowed(sb, ra)) {
            return MoveResult.rejected();
        }
        int before = conflicts;
        remove(sa);
        remove(sb);
        if (introducedAt(sa, tb, rb) == 0) {
            add(sa, tb, rb);
            if (introducedAt(sb, ta, ra) == 0) {
                add(sb, ta, ra);
                if (journal != null) {
                    journal.record(a, new Placement(problem.slot(ta).id(), problem.room(ra).id()), placementOf(sa));
                    journal.record(b, new Placement(problem.slot(tb).id(), problem.room(rb).id()), placementOf(sb));
                }
                return new MoveResult(true, conflicts - before);
            }
            remove(sa);
        }
        add(sa, ta, ra);
        add(sb, tb, rb);
        return MoveResult.rejected();
    }

    /** Lifts a session out of the schedule, returning its previous placement (or null). */
    public synchronized Placement remove(SessionKey key, MoveJournal journal) {
        int s = problem.sessionIndexOf(key);
        Placement previous = placementOf(s);
        if (previous != null) {
            remove(s);
            if (journal != null) {
                journal.record(key, previous, null);
            }
        }
        return previous;
    }

    /** Restores every session touched by the journal to its placement before the first entry. */
    public synchronized void rollback(MoveJournal journal) {
        List<MoveJournal.Entry> entries = journal.entries();
        for (int i = entries.size() - 1; i >= 0; i--) {
            MoveJournal.Entry entry = entries.get(i);
            int s = problem.sessionIndexOf(entry.session());
            if (slotOf[s] >= 0) {
                remove(s);
            }
            if (entry.previous() != null) {
                add(s, problem.slotIndexOf(entry.previous().slotId()), problem.roomIndexOf(entry.previous().roomId()));
            }
        }
    }

    // ---------------------------------------------------------------------------------------
    // Oracle and queries
    // ---------------------------------------------------------------------------------------

    /** Conflict oracle: overlaps the session would introduce at the target, ignoring itself. */
    public synchronized int conflictsIntroducedBy(SessionKey key, Placement target) {
        return introducedAt(problem.sessionIndexOf(key), problem.slotIndexOf(target.slotId()),
                problem.roomIndexOf(target.roomId()));
    }

    public synchronized int introducedAtIndex(int s, int t, int r) {
        return introducedAt(s, t, r);
    }

    /** Overlaps the session currently takes part in (0 when it is clash-free or unassigned). */
    public synchronized int sessionConflicts(int s) {
        int t = slotOf[s];
        if (t < 0) {
            return 0;
        }
        int c = problem.courseOfSession(s);
        int total = Math.max(0, facultyLoad[problem.facultyOfCourse(c) * slotCount + t] - 1)
                + Math.max(0, roomLoad[roomOf[s] * slotCount + t] - 1);
        for (int st : problem.studentsOfCourse(c)) {
            total += Math.max(0, studentLoad[st * slotCount + t] - 1);
        }
        return total;
    }

    public synchronized int sessionConflicts(SessionKey key) {
        return sessionConflicts(problem.sessionIndexOf(key));
    }

    public synchronized Placement placement(SessionKey key) {
        return placementOf(problem.sessionIndexOf(key));
    }

    public synchronized int slotIndex(int s) { return slotOf[s]; }
    public synchronized int roomIndex(int s) { return roomOf[s]; }

    public synchronized Map<SessionKey, Placement> assignments() {
        Map<SessionKey, Placement> result = new LinkedHashMap<>();
        for (int s = 0; s < slotOf.length; s++) {
            if (slotOf[s] >= 0) {
                result.put(problem.session(s), placementOf(s));
            }
        }
        return result;
    }

    public synchronized int[] slotArray() { return slotOf.clone(); }
    public synchronized int[] roomArray() { return roomOf.clone(); }

    public synchronized OccupancyView occupancy() {
        return new OccupancyView(slotCount, facultyLoad.clone(), roomLoad.clone(), studentLoad.clone());
    }

    public synchronized int conflictCount() { return conflicts; }
    public synchronized int capacityViolations() { return capacityViolations; }
    public synchronized int preferenceMisses() { return preferenceMisses; }
    public synchronized int assignedCount() { return assigned; }
    public synchronized boolean isComplete() { return assigned == slotOf.length; }

    public SchedulingProblem problem() {
        return problem;
    }

    // ---------------------------------------------------------------------------------------
    // Internals (callers hold the monitor)
    // ---------------------------------------------------------------------------------------

    private boolean roomAllowed(int s, int r) {
        for (int allowed : problem.roomsForCourse(problem.courseOfSession(s))) {
            if (allowed == r) {
                return true;
            }
        }
        return false;
    }

    private int introducedAt(int s, int t, int r) {
        int c = problem.courseOfSession(s);
        int self = slotOf[s] == t ? 1 : 0;
        int selfRoom = self == 1 && roomOf[s] == r ? 1 : 0;
        int introduced = 0;
        if (facultyLoad[problem.facultyOfCourse(c) * slotCount + t] - self >= 1) {
            introduced++;
        }
        if (roomLoad[r * slotCount + t] - selfRoom >= 1) {
            introduced++;
        }
        for (int st : problem.studentsOfCourse(c)) {
            if (studentLoad[st * slotCount + t] - self >= 1) {
                introduced++;
            }
        }
        return introduced;
    }

    private int add(int s, int t, int r) {
        int c = problem.courseOfSession(s);
        int introduced = 0;
        if (facultyLoad[problem.facultyOfCourse(c) * slotCount + t]++ >= 1) {
            introduced++;
        }
        if (roomLoad[r * slotCount + t]++ >= 1) {
            introduced++;
        }
        for (int st : problem.studentsOfCourse(c)) {
            if (studentLoad[st * slotCount + t]++ >= 1) {
                introduced++;
            }
        }
        if (!problem.fitsRoom(c, r)) {
            capacityViolations++;
        }
        preferenceMisses += problem.preferenceMisses(c, t, r);
        slotOf[s] = t;
        roomOf[s] = r;
        assigned++;
        conflicts += introduced;
        return introduced;
    }

    private void remove(int s) {
        int c = problem.courseOfSession(s);
        int t = slotOf[s];
        int r = roomOf[s];
        int removed = 0;
        if (--facultyLoad[problem.facultyOfCourse(c) * slotCount + t] >= 1) {
            removed++;
        }
        if (--roomLoad[r * slotCount + t] >= 1) {
            removed++;
        }
        for (int st : problem.studentsOfCourse(c)) {
            if (--studentLoad[st * slotCount + t] >= 1) {
                removed++;
            }
        }
        if (!problem.fitsRoom(c, r)) {
            capacityViolations--;
        }
        preferenceMisses -= problem.preferenceMisses(c, t, r);
        slotOf[s] = -1;
        roomOf[s] = -1;
        assigned--;
        conflicts -= removed;
    }

    private Placement placementOf(int s) {
        if (slotOf[s] < 0) {
            return null;
        }
        return new Placement(problem.slot(slotOf[s]).id(), problem.room(roomOf[s]).id());
    }
}
