package com.smartsched.timetable_engine.solver.refine;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.model.Cluster;
import com.smartsched.timetable_engine.model.Course;
import com.smartsched.timetable_engine.model.Room;
import com.smartsched.timetable_engine.model.TimeSlot;
import com.smartsched.timetable_engine.solver.core.CancellationToken;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;
import com.smartsched.timetable_engine.solver.progress.WorkReporter;

class PopulationRefinerTest {

    // Faculty F0 teaches 12 sessions over 4 slots, so some conflicts can never be removed.
    private static SchedulingProblem overloaded() {
        List<Course> courses = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            courses.add(new Course("C" + i, null, "D", "F" + (i % 3), 3, Set.of("s" + i), null, 0));
        }
        return SchedulingProblem.of(courses,
                List.of(new Room("R1", null, 30, null), new Room("R2", null, 30, null), new Room("R3", null, 30, null)),
                TimeSlot.grid(1, 4));
    }

    private static ChromosomeLayout layout(SchedulingProblem problem) {
        List<Cluster> clusters = List.of(
                new Cluster(0, List.of("C0", "C1", "C2", "C3")),
                new Cluster(1, List.of("C4", "C5", "C6", "C7")),
                new Cluster(2, List.of("C8", "C9", "C10", "C11")));
        return ChromosomeLayout.of(problem, clusters);
    }

    private static Chromosome piledUp(SchedulingProblem problem) {
        return new Chromosome(new int[problem.sessionCount()], new int[problem.sessionCount()]);
    }

    @Test
    void cacheStaysBoundedOverAThousandGenerations() {
        SchedulingProblem problem = overloaded();
        EngineSettings settings = EngineSettings.builder()
                .generations(1000)
                .plateauGenerations(1_000_000)
                .refinerTimeBudgetSeconds(600.0)
                .cacheMaxEntries(50)
                .cacheEvictionInterval(5)
                .build();

        RefinementResult result = new PopulationRefiner(problem, settings)
                .refine(piledUp(problem), layout(problem), CancellationToken.none(), WorkReporter.NOOP);

        assertThat(result.generationsRun()).isEqualTo(1000);
        assertThat(result.cachePeakSize()).isLessThanOrEqualTo(50);
    }

    @Test
    void elitismNeverLosesTheSeed() {
        SchedulingProblem problem = overloaded();
        EngineSettings settings = EngineSettings.builder().generations(40).build();

        RefinementResult result = new PopulationRefiner(problem, settings)
                .refine(piledUp(problem), layout(problem), CancellationToken.none(), WorkReporter.NOOP);

        assertThat(result.bestFitness().cost()).isLessThanOrEqualTo(result.seedFitness().cost());
        assertThat(result.improved()).isTrue();
    }

    @Test
    void fitnessMatchesTheScheduleState() {
        SchedulingProblem problem = overloaded();
        int[] slots = new int[problem.sessionCount()];
        int[] rooms = new int[problem.sessionCount()];
        for (int s = 0; s < slots.length; s++) {
            slots[s] = s % 4;
            rooms[s] = (s / 4) % 3;
        }
        ScheduleState state = ScheduleState.fromArrays(problem, slots, rooms);

        Fitness fitness = new FitnessEvaluator(problem, EngineSettings.defaults()).evaluate(new Chromosome(slots, rooms));

        assertThat(fitness.conflicts()).isEqualTo(state.conflictCount());
        assertThat(fitness.capacityViolations()).isEqualTo(state.capacityViolations());
    }

    @Test
    void signatureIsStableAcrossCopies() {
        int[] slots = { 1, 2, 3 };
        int[] rooms = { 0, 0, 1 };
        Chromosome original = new Chromosome(slots, rooms);
        Chromosome copy = original.copy();

        assertThat(copy.signature()).isEqualTo(original.signature());
        assertThat(copy).isEqualTo(original);
        assertThat(Arrays.equals(copy.slotGenes(), slots)).isTrue();
    }
}
