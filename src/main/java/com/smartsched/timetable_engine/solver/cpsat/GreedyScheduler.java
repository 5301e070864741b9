package com.smartsched.timetable_engine.solver.cpsat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartsched.timetable_engine.solver.core.OccupancyView;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Fallback placement for a cluster. Sessions are processed largest enrollment first (fewest
 * domain pairs breaking ties) and take the earliest capacity-adequate pair whose room, faculty and
 * a bounded sample of students are free. When no such pair exists the session takes the least
 * conflicting capacity-adequate pair and the overlap is left for repair. Always completes.
 */
public class GreedyScheduler {

    private static final Logger logger = LoggerFactory.getLogger(GreedyScheduler.class);

    private static final long FACULTY = 1L << 61;
    private static final long ROOM = 1L << 62;
    private static final long STUDENT = 0L;

    private final SchedulingProblem problem;
    private final int studentSample;

    public GreedyScheduler(SchedulingProblem problem, int studentSample) {
        this.problem = problem;
        this.studentSample = Math.max(1, studentSample);
    }

    /**
     * @return {@code [slots, rooms]}, each aligned with {@code sessions}
     */
    public int[][] schedule(int[] sessions, OccupancyView reserved) {
        int slotCount = problem.slotCount();
        Set<Long> taken = new HashSet<>();
        int[] slots = new int[sessions.length];
        int[] rooms = new int[sessions.length];

        List<Integer> order = new ArrayList<>(sessions.length);
        for (int i = 0; i < sessions.length; i++) {
            order.add(i);
        }
        order.sort(Comparator
                .comparingInt((Integer i) -> -problem.studentsOfCourse(problem.courseOfSession(sessions[i])).length)
                .thenComparingLong(i -> problem.domainPairs(problem.courseOfSession(sessions[i])))
                .thenComparingInt(i -> sessions[i]));

        int relaxed = 0;
        for (int i : order) {
            int s = sessions[i];
            int c = problem.courseOfSession(s);
            int f = problem.facultyOfCourse(c);
            int[] sample = sampleStudents(problem.studentsOfCourse(c));
            int[] courseRooms = problem.roomsForCourse(c);

            int chosenSlot = -1;
            int chosenRoom = -1;
            search:
            for (int t = 0; t < slotCount; t++) {
                if (busy(taken, reserved.facultyBusy(f, t), FACULTY, f, t, slotCount)) {
                    continue;
                }
                boolean studentsFree = true;
                for (int st : sample) {
                    if (busy(taken, reserved.studentBusy(st, t), STUDENT, st, t, slotCount)) {
                        studentsFree = false;
                        break;
                    }
                }
                if (!studentsFree) {
                    continue;
                }
                for (int r : courseRooms) {
                    if (!busy(taken, reserved.roomBusy(r, t), ROOM, r, t, slotCount)) {
                        chosenSlot = t;
                        chosenRoom = r;
                        break search;
                    }
                }
            }

            if (chosenSlot < 0) {
                relaxed++;
                int best = Integer.MAX_VALUE;
                for (int t = 0; t < slotCount && best > 0; t++) {
                    int base = busy(taken, reserved.facultyBusy(f, t), FACULTY, f, t, slotCount) ? 1 : 0;
                    for (int st : problem.studentsOfCourse(c)) {
                        if (busy(taken, reserved.studentBusy(st, t), STUDENT, st, t, slotCount)) {
                            base++;
                        }
                    }
                    for (int r : courseRooms) {
                        int cost = base + (busy(taken, reserved.roomBusy(r, t), ROOM, r, t, slotCount) ? 1 : 0);
                        if (cost < best) {
                            best = cost;
                            chosenSlot = t;
                            chosenRoom = r;
                        }
                    }
                }
            }

            slots[i] = chosenSlot;
            rooms[i] = chosenRoom;
            taken.add(key(FACULTY, f, chosenSlot, slotCount));
            taken.add(key(ROOM, chosenRoom, chosenSlot, slotCount));
            for (int st : problem.studentsOfCourse(c)) {
                taken.add(key(STUDENT, st, chosenSlot, slotCount));
            }
        }
        if (relaxed > 0) {
            logger.warn("Greedy placement relaxed {} of {} sessions to capacity-only", relaxed, sessions.length);
        }
        return new int[][] { slots, rooms };
    }

    private int[] sampleStudents(int[] students) {
        if (students.length <= studentSample) {
            return students;
        }
        int[] sample = new int[studentSample];
        double stride = (double) students.length / studentSample;
        for (int i = 0; i < studentSample; i++) {
            sample[i] = students[(int) (i * stride)];
        }
        return sample;
    }

    private static boolean busy(Set<Long> taken, boolean reserved, long kind, int resource, int t, int slotCount) {
        return reserved || taken.contains(key(kind, resource, t, slotCount));
    }

    private static long key(long kind, int resource, int t, int slotCount) {
        return kind | ((long) resource * slotCount + t);
    }
}
