package com.smartsched.timetable_engine.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.smartsched.timetable_engine.solver.pipeline.TimetablePipeline;
import com.smartsched.timetable_engine.solver.progress.ProgressCoordinator;

/**
 * Binds {@code engine.*} properties and wires the worker pools the pipeline runs on.
 */
@Configuration
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${engine.clustering.max-size:15}") private int clusterMaxSize;
    @Value("${engine.clustering.super-max-size:50}") private int superClusterMaxSize;
    @Value("${engine.clustering.min-size:3}") private int clusterMinSize;
    @Value("${engine.clustering.max-passes:10}") private int clusteringMaxPasses;
    @Value("${engine.seed:42}") private long seed;

    @Value("${engine.solver.strategy-timeout-seconds:5}") private double strategyTimeoutSeconds;
    @Value("${engine.solver.search-workers:4}") private int searchWorkers;
    @Value("${engine.solver.parallelism:4}") private int solverParallelism;
    @Value("${engine.solver.capacity-precheck-ratio:0.5}") private double capacityPrecheckRatio;
    @Value("${engine.solver.priority-students:200}") private int priorityStudents;
    @Value("${engine.solver.student-sample-rate:0.25}") private double studentSampleRate;
    @Value("${engine.solver.large-cluster-sessions:60}") private int largeClusterSessions;
    @Value("${engine.solver.greedy-student-sample:50}") private int greedyStudentSample;

    @Value("${engine.refiner.population:20}") private int population;
    @Value("${engine.refiner.generations:50}") private int generations;
    @Value("${engine.refiner.mutation-rate:0.02}") private double mutationRate;
    @Value("${engine.refiner.elite:2}") private int eliteCount;
    @Value("${engine.refiner.tournament:3}") private int tournamentSize;
    @Value("${engine.refiner.plateau:15}") private int plateauGenerations;
    @Value("${engine.refiner.cache-max-entries:500}") private int cacheMaxEntries;
    @Value("${engine.refiner.cache-eviction-interval:5}") private int cacheEvictionInterval;
    @Value("${engine.refiner.time-budget-seconds:60}") private double refinerTimeBudgetSeconds;
    @Value("${engine.refiner.conflict-weight:1000}") private double conflictWeight;
    @Value("${engine.refiner.capacity-weight:100}") private double capacityWeight;
    @Value("${engine.refiner.preference-weight:1}") private double preferenceWeight;
    @Value("${engine.refiner.default-variants:1}") private int defaultVariants;

    @Value("${engine.repair.max-iterations:50}") private int repairMaxIterations;
    @Value("${engine.repair.max-candidates:200}") private int repairMaxCandidates;
    @Value("${engine.repair.time-budget-seconds:30}") private double repairTimeBudgetSeconds;
    @Value("${engine.repair.alpha-new:0.5}") private double alphaNew;
    @Value("${engine.repair.alpha-transferred:0.1}") private double alphaTransferred;
    @Value("${engine.repair.gamma:0.9}") private double gamma;
    @Value("${engine.repair.parallel:true}") private boolean parallelRepair;

    @Value("${engine.progress.interval-ms:250}") private long progressIntervalMs;
    @Value("${engine.progress.catch-up:0.35}") private double catchUpFactor;
    @Value("${engine.progress.min-step:0.05}") private double minStep;
    @Value("${engine.progress.creep:0.01}") private double creepStep;
    @Value("${engine.jobs.retained:100}") private int retainedJobs;

    @Bean
    public EngineSettings engineSettings() {
        EngineSettings settings = EngineSettings.builder()
                .clusterMaxSize(clusterMaxSize)
                .superClusterMaxSize(superClusterMaxSize)
                .clusterMinSize(clusterMinSize)
                .clusteringMaxPasses(clusteringMaxPasses)
                .seed(seed)
                .strategyTimeoutSeconds(strategyTimeoutSeconds)
                .searchWorkers(searchWorkers)
                .solverParallelism(solverParallelism)
                .capacityPrecheckRatio(capacityPrecheckRatio)
                .priorityStudents(priorityStudents)
                .studentSampleRate(studentSampleRate)
                .largeClusterSessions(largeClusterSessions)
                .greedyStudentSample(greedyStudentSample)
                .population(population)
                .generations(generations)
                .mutationRate(mutationRate)
                .eliteCount(eliteCount)
                .tournamentSize(tournamentSize)
                .plateauGenerations(plateauGenerations)
                .cacheMaxEntries(cacheMaxEntries)
                .cacheEvictionInterval(cacheEvictionInterval)
                .refinerTimeBudgetSeconds(refinerTimeBudgetSeconds)
                .conflictWeight(conflictWeight)
                .capacityWeight(capacityWeight)
                .preferenceWeight(preferenceWeight)
                .defaultVariants(defaultVariants)
                .repairMaxIterations(repairMaxIterations)
                .repairMaxCandidates(repairMaxCandidates)
                .repairTimeBudgetSeconds(repairTimeBudgetSeconds)
                .alphaNew(alphaNew)
                .alphaTransferred(alphaTransferred)
                .gamma(gamma)
                .parallelRepair(parallelRepair)
                .progressIntervalMs(progressIntervalMs)
                .catchUpFactor(catchUpFactor)
                .minStep(minStep)
                .creepStep(creepStep)
                .retainedJobs(retainedJobs)
                .build();
        logger.info("Engine settings: clusters<={}, super-clusters<={}, strategy timeout {}s, population {}x{}, "
                + "mutation {}", clusterMaxSize, superClusterMaxSize, strategyTimeoutSeconds, population, generations,
                mutationRate);
        return settings;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService clusterSolverExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, solverParallelism), named("cluster-solver"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService conflictRepairExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, solverParallelism), named("conflict-repair"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generationJobExecutor() {
        return Executors.newFixedThreadPool(2, named("generation-job"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService progressScheduler() {
        return Executors.newSingleThreadScheduledExecutor(named("progress-reporter"));
    }

    @Bean
    public ProgressCoordinator progressCoordinator(@Qualifier("progressScheduler") ScheduledExecutorService scheduler,
                                                   EngineSettings settings) {
        return new ProgressCoordinator(scheduler, settings);
    }

    @Bean
    public TimetablePipeline timetablePipeline(EngineSettings settings,
                                               @Qualifier("clusterSolverExecutor") ExecutorService clusterPool,
                                               @Qualifier("conflictRepairExecutor") ExecutorService repairPool) {
        return new TimetablePipeline(settings, clusterPool, repairPool);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
