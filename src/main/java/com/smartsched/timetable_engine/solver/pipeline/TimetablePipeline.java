package com.smartsched.timetable_engine.solver.pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.model.Cluster;
import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.solver.clustering.LouvainClusterer;
import com.smartsched.timetable_engine.solver.core.CancellationToken;
import com.smartsched.timetable_engine.solver.core.ConflictDetector;
import com.smartsched.timetable_engine.solver.core.OccupancyView;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;
import com.smartsched.timetable_engine.solver.cpsat.ClusterSolveResult;
import com.smartsched.timetable_engine.solver.cpsat.ClusterSolver;
import com.smartsched.timetable_engine.solver.cpsat.GreedyScheduler;
import com.smartsched.timetable_engine.solver.cpsat.SolveOutcome;
import com.smartsched.timetable_engine.solver.progress.JobProgress;
import com.smartsched.timetable_engine.solver.progress.Stage;
import com.smartsched.timetable_engine.solver.progress.WorkReporter;
import com.smartsched.timetable_engine.solver.refine.Chromosome;
import com.smartsched.timetable_engine.solver.refine.ChromosomeLayout;
import com.smartsched.timetable_engine.solver.refine.Fitness;
import com.smartsched.timetable_engine.solver.refine.FitnessEvaluator;
import com.smartsched.timetable_engine.solver.refine.PopulationRefiner;
import com.smartsched.timetable_engine.solver.refine.RefinementResult;
import com.smartsched.timetable_engine.solver.refine.WeightProfile;
import com.smartsched.timetable_engine.solver.repair.ConflictRepairer;
import com.smartsched.timetable_engine.solver.repair.RepairContext;
import com.smartsched.timetable_engine.solver.repair.RepairReport;
import com.smartsched.timetable_engine.solver.repair.ValueTable;

/**
 * Runs one generation end to end: clustering, per-cluster solving, population refinement,
 * conflict repair and the final conflict report. Refinement and repair run once per requested
 * variant, each under its own {@link WeightProfile}.
 * <p>
 * Clusters are solved in batches of the pool size. Every cluster in a batch sees the same frozen
 * occupancy of all previously committed clusters, so workers share no mutable state; overlaps
 * between clusters of the same batch are left to the later stages. A failing refinement or repair
 * keeps the schedule it started from. Only cancellation escapes, as {@link CancellationException}.
 */
public class TimetablePipeline {

    private static final Logger logger = LoggerFactory.getLogger(TimetablePipeline.class);

    private final EngineSettings settings;
    private final ExecutorService clusterPool;
    private final ExecutorService repairPool;

    public TimetablePipeline(EngineSettings settings, ExecutorService clusterPool, ExecutorService repairPool) {
        this.settings = settings;
        this.clusterPool = clusterPool;
        this.repairPool = repairPool;
    }

    public PipelineResult run(SchedulingProblem problem, ValueTable valueTable, JobProgress progress,
                              CancellationToken token) {
        return run(problem, valueTable, 1, progress, token);
    }

    /**
     * Clusters and solves once, then refines and repairs one schedule per weight profile. Variants
     * are ranked by conflicts, then by cost under the configured weights, then by variant number.
     */
    public PipelineResult run(SchedulingProblem problem, ValueTable valueTable, int variantCount,
                              JobProgress progress, CancellationToken token) {
        WeightProfile[] profiles = WeightProfile.first(variantCount);
        Map<String, Double> stageSeconds = new LinkedHashMap<>();
        long mark = System.nanoTime();

        progress.enterStage(Stage.LOADING);
        progress.reporter(Stage.LOADING).report(1, 1);
        logger.info(">>> Generation input: {} courses, {} sessions, {} rooms, {} slots, {} students, {} variants",
                problem.courseCount(), problem.sessionCount(), problem.roomCount(), problem.slotCount(),
                problem.studentCount(), profiles.length);
        mark = lap(stageSeconds, Stage.LOADING, mark);

        token.throwIfCancelled();
        progress.enterStage(Stage.CLUSTERING);
        List<Cluster> clusters = new LouvainClusterer(settings.getClusterMaxSize(), settings.getClusterMinSize(),
                settings.getClusteringMaxPasses(), settings.getSeed()).cluster(problem);
        progress.reporter(Stage.CLUSTERING).report(1, 1);
        mark = lap(stageSeconds, Stage.CLUSTERING, mark);

        token.throwIfCancelled();
        progress.enterStage(Stage.CONSTRAINT_SOLVING);
        ScheduleState solvedState = new ScheduleState(problem);
        List<ClusterSolveResult> solved = solveClusters(problem, clusters, solvedState, progress, token);
        int afterSolving = solvedState.conflictCount();
        logger.info(">>> Constraint solving complete: {} conflicts, {} capacity violations", afterSolving,
                solvedState.capacityViolations());
        mark = lap(stageSeconds, Stage.CONSTRAINT_SOLVING, mark);

        token.throwIfCancelled();
        progress.enterStage(Stage.POPULATION_REFINEMENT);
        ChromosomeLayout layout = ChromosomeLayout.of(problem, clusters);
        WorkReporter refineReporter = progress.reporter(Stage.POPULATION_REFINEMENT);
        List<VariantRun> runs = new ArrayList<>(profiles.length);
        for (int i = 0; i < profiles.length; i++) {
            token.throwIfCancelled();
            VariantRun run = new VariantRun(i + 1, profiles[i]);
            run.refine(problem, solvedState, layout, token, share(refineReporter, i, profiles.length));
            runs.add(run);
        }
        mark = lap(stageSeconds, Stage.POPULATION_REFINEMENT, mark);

        token.throwIfCancelled();
        progress.enterStage(Stage.CONFLICT_REPAIR);
        WorkReporter repairReporter = progress.reporter(Stage.CONFLICT_REPAIR);
        for (int i = 0; i < runs.size(); i++) {
            token.throwIfCancelled();
            runs.get(i).repair(problem, valueTable, token, share(repairReporter, i, runs.size()));
        }
        mark = lap(stageSeconds, Stage.CONFLICT_REPAIR, mark);

        token.throwIfCancelled();
        progress.enterStage(Stage.FINALIZING);
        List<ScheduleVariant> variants = rank(problem, runs);
        VariantRun best = runs.stream()
                .filter(r -> r.number == variants.get(0).variantNumber())
                .findFirst()
                .orElseThrow();
        ScheduleState state = best.state;
        List<Conflict> conflicts = ConflictDetector.detect(state);
        progress.reporter(Stage.FINALIZING).report(1, 1);
        lap(stageSeconds, Stage.FINALIZING, mark);

        RepairReport repair = best.repair;
        GenerationStatistics statistics = new GenerationStatistics(
                problem.courseCount(), problem.sessionCount(), clusters.size(),
                count(solved, SolveOutcome.OPTIMAL), count(solved, SolveOutcome.FEASIBLE),
                (int) solved.stream().filter(r -> r.outcome().usedGreedy()).count(),
                solved.stream().filter(ClusterSolveResult::suspectedModelingDefect)
                        .map(ClusterSolveResult::clusterId).collect(Collectors.toList()),
                afterSolving, best.afterRefinement, state.conflictCount(), best.generationsRun,
                repair.resolved(), repair.rejected(), repair.rolledBackScopes(), repair.manualReview(),
                state.capacityViolations(), state.preferenceMisses(), stageSeconds);
        logger.info(">>> Generation finished: conflicts {} -> {} -> {}, {} reported conflicts, best variant {} ({})",
                afterSolving, best.afterRefinement, state.conflictCount(), conflicts.size(), best.number,
                best.profile);
        return new PipelineResult(state.assignments(), conflicts, statistics, variants);
    }

    private List<ScheduleVariant> rank(SchedulingProblem problem, List<VariantRun> runs) {
        FitnessEvaluator evaluator = new FitnessEvaluator(problem, settings);
        List<VariantRun> ordered = new ArrayList<>(runs);
        for (VariantRun run : ordered) {
            run.fitness = evaluator.evaluate(new Chromosome(run.state.slotArray(), run.state.roomArray()));
        }
        ordered.sort(Comparator.<VariantRun>comparingInt(r -> r.fitness.conflicts())
                .thenComparingDouble(r -> r.fitness.cost())
                .thenComparingInt(r -> r.number));
        List<ScheduleVariant> variants = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            VariantRun run = ordered.get(i);
            variants.add(new ScheduleVariant(run.number, i + 1, run.profile, run.profile.weights(settings),
                    run.fitness.conflicts(), run.fitness.capacityViolations(), run.fitness.preferenceMisses(),
                    run.fitness.cost(), run.state.assignments()));
        }
        return variants;
    }

    // Maps one variant's units of work onto its share of the stage.
    private static WorkReporter share(WorkReporter stage, int index, int count) {
        return (done, total) -> stage.report(index * total + done, count * total);
    }

    /** Refinement and repair of one variant. A failing stage keeps the schedule it started from. */
    private final class VariantRun {

        private final int number;
        private final WeightProfile profile;
        private ScheduleState state;
        private int generationsRun;
        private int afterRefinement;
        private RepairReport repair;
        private Fitness fitness;

        VariantRun(int number, WeightProfile profile) {
            this.number = number;
            this.profile = profile;
        }

        void refine(SchedulingProblem problem, ScheduleState seedState, ChromosomeLayout layout,
                    CancellationToken token, WorkReporter reporter) {
            state = seedState.copy();
            try {
                Chromosome seed = new Chromosome(seedState.slotArray(), seedState.roomArray());
                RefinementResult refined = new PopulationRefiner(problem, profile.applyTo(settings))
                        .refine(seed, layout, token, reporter);
                generationsRun = refined.generationsRun();
                if (refined.improved()) {
                    state = ScheduleState.fromArrays(problem, refined.best().slotGenes(), refined.best().roomGenes());
                }
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("!!! Population refinement of variant {} failed, keeping solver output: {}", number,
                        e.getMessage(), e);
            }
            afterRefinement = state.conflictCount();
        }

        void repair(SchedulingProblem problem, ValueTable valueTable, CancellationToken token,
                    WorkReporter reporter) {
            repair = RepairReport.unchanged(afterRefinement);
            ScheduleState working = state.copy();
            try {
                repair = new ConflictRepairer(problem, repairPool).repair(working,
                        new RepairContext(valueTable, settings, token), reporter);
                state = working;
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("!!! Conflict repair of variant {} failed, keeping refined schedule: {}", number,
                        e.getMessage(), e);
            }
        }
    }

    private List<ClusterSolveResult> solveClusters(SchedulingProblem problem, List<Cluster> clusters,
                                                   ScheduleState state, JobProgress progress,
                                                   CancellationToken token) {
        ClusterSolver solver = new ClusterSolver(problem, settings);
        GreedyScheduler greedy = new GreedyScheduler(problem, settings.getGreedyStudentSample());
        int batchSize = Math.max(1, settings.getSolverParallelism());
        List<ClusterSolveResult> results = new ArrayList<>(clusters.size());

        for (int from = 0; from < clusters.size(); from += batchSize) {
            token.throwIfCancelled();
            List<Cluster> batch = clusters.subList(from, Math.min(clusters.size(), from + batchSize));
            OccupancyView reserved = state.occupancy();
            List<Future<ClusterSolveResult>> futures = new ArrayList<>(batch.size());
            for (Cluster cluster : batch) {
                futures.add(clusterPool.submit(() -> solver.solve(cluster, reserved, token)));
            }
            for (int i = 0; i < batch.size(); i++) {
                ClusterSolveResult result = await(futures, i, batch.get(i), problem, greedy, reserved);
                for (int k = 0; k < result.sessions().length; k++) {
                    state.assignIndex(result.sessions()[k], result.slots()[k], result.rooms()[k]);
                }
                results.add(result);
            }
            progress.reporter(Stage.CONSTRAINT_SOLVING).report(results.size(), clusters.size());
        }
        return results;
    }

    private ClusterSolveResult await(List<Future<ClusterSolveResult>> futures, int i, Cluster cluster,
                                     SchedulingProblem problem, GreedyScheduler greedy, OccupancyView reserved) {
        try {
            return futures.get(i).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new CancellationException("Interrupted while solving clusters");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException) {
                futures.forEach(f -> f.cancel(true));
                throw (CancellationException) e.getCause();
            }
            logger.error("!!! Cluster {} solver crashed, placing it greedily", cluster.id(), e.getCause());
            int[] sessions = cluster.courseIds().stream()
                    .mapToInt(problem::courseIndexOf)
                    .flatMap(c -> IntStream.range(problem.firstSession(c), problem.endSession(c)))
                    .toArray();
            int[][] placed = greedy.schedule(sessions, reserved);
            return new ClusterSolveResult(cluster.id(), sessions, placed[0], placed[1], SolveOutcome.GREEDY_AFTER_SOLVER,
                    null, false, 0.0);
        }
    }

    private static int count(List<ClusterSolveResult> results, SolveOutcome outcome) {
        return (int) results.stream().filter(r -> r.outcome() == outcome).count();
    }

    private static long lap(Map<String, Double> stageSeconds, Stage stage, long mark) {
        long now = System.nanoTime();
        stageSeconds.put(stage.name(), (now - mark) / 1e9);
        return now;
    }
}
