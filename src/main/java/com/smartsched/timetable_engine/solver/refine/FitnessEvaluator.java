package com.smartsched.timetable_engine.solver.refine;

import java.util.Arrays;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Scores chromosomes as {@code conflictWeight * conflicts + capacityWeight * capacityViolations
 * + preferenceWeight * preferenceMisses}. Conflicts are counted the same way as in the live
 * schedule state (excess occupancy per resource and slot).
 * <p>
 * Occupancy counters live in per-thread scratch arrays that are invalidated by bumping a stamp
 * instead of being cleared, so an evaluation allocates nothing.
 */
public class FitnessEvaluator {

    private final SchedulingProblem problem;
    private final double conflictWeight;
    private final double capacityWeight;
    private final double preferenceWeight;
    private final ThreadLocal<Scratch> scratch;

    public FitnessEvaluator(SchedulingProblem problem, EngineSettings settings) {
        this.problem = problem;
        this.conflictWeight = settings.getConflictWeight();
        this.capacityWeight = settings.getCapacityWeight();
        this.preferenceWeight = settings.getPreferenceWeight();
        int cells = (problem.facultyCount() + problem.roomCount() + problem.studentCount()) * problem.slotCount();
        this.scratch = ThreadLocal.withInitial(() -> new Scratch(cells));
    }

    public Fitness evaluate(Chromosome chromosome) {
        Scratch work = scratch.get();
        int stamp = work.nextStamp();
        int slotCount = problem.slotCount();
        int roomBase = problem.facultyCount() * slotCount;
        int studentBase = roomBase + problem.roomCount() * slotCount;

        int conflicts = 0;
        int capacity = 0;
        int preference = 0;
        for (int s = 0; s < chromosome.length(); s++) {
            int t = chromosome.slot(s);
            int r = chromosome.room(s);
            int c = problem.courseOfSession(s);
            conflicts += work.occupy(problem.facultyOfCourse(c) * slotCount + t, stamp);
            conflicts += work.occupy(roomBase + r * slotCount + t, stamp);
            for (int st : problem.studentsOfCourse(c)) {
                conflicts += work.occupy(studentBase + st * slotCount + t, stamp);
            }
            if (!problem.fitsRoom(c, r)) {
                capacity++;
            }
            preference += problem.preferenceMisses(c, t, r);
        }
        double cost = conflictWeight * conflicts + capacityWeight * capacity + preferenceWeight * preference;
        return new Fitness(conflicts, capacity, preference, cost);
    }

    private static final class Scratch {
        private final int[] stamps;
        private final int[] counts;
        private int stamp;

        Scratch(int cells) {
            this.stamps = new int[cells];
            this.counts = new int[cells];
        }

        int nextStamp() {
            if (++stamp == Integer.MAX_VALUE) {
                Arrays.fill(stamps, 0);
                stamp = 1;
            }
            return stamp;
        }

        /** Occupies a cell; returns 1 if it was already occupied in this evaluation. */
        int occupy(int cell, int current) {
            if (stamps[cell] != current) {
                stamps[cell] = current;
                counts[cell] = 1;
                return 0;
            }
            counts[cell]++;
            return 1;
        }
    }
}
