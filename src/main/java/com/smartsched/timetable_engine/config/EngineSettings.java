package com.smartsched.timetable_engine.config;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for every pipeline stage. The thresholds here were calibrated empirically and are
 * meant to be overridden per deployment through {@code engine.*} properties.
 */
@Value
@Builder(toBuilder = true)
public class EngineSettings {

    // --- Clustering ---
    @Builder.Default int clusterMaxSize = 15;
    @Builder.Default int superClusterMaxSize = 50;
    @Builder.Default int clusterMinSize = 3;
    @Builder.Default int clusteringMaxPasses = 10;
    @Builder.Default long seed = 42L;

    // --- Constraint solving ---
    @Builder.Default double strategyTimeoutSeconds = 5.0;
    @Builder.Default int searchWorkers = 4;
    @Builder.Default int solverParallelism = 4;
    @Builder.Default double capacityPrecheckRatio = 0.5;
    @Builder.Default int priorityStudents = 200;
    @Builder.Default double studentSampleRate = 0.25;
    @Builder.Default int largeClusterSessions = 60;
    @Builder.Default int greedyStudentSample = 50;

    // --- Population refinement ---
    @Builder.Default int population = 20;
    @Builder.Default int generations = 50;
    @Builder.Default double mutationRate = 0.02;
    @Builder.Default int eliteCount = 2;
    @Builder.Default int tournamentSize = 3;
    @Builder.Default int plateauGenerations = 15;
    @Builder.Default int cacheMaxEntries = 500;
    @Builder.Default int cacheEvictionInterval = 5;
    @Builder.Default double refinerTimeBudgetSeconds = 60.0;
    @Builder.Default double conflictWeight = 1000.0;
    @Builder.Default double capacityWeight = 100.0;
    @Builder.Default double preferenceWeight = 1.0;
    @Builder.Default int defaultVariants = 1;

    // --- Conflict repair ---
    @Builder.Default int repairMaxIterations = 50;
    @Builder.Default int repairMaxCandidates = 200;
    @Builder.Default double repairTimeBudgetSeconds = 30.0;
    @Builder.Default double alphaNew = 0.5;
    @Builder.Default double alphaTransferred = 0.1;
    @Builder.Default double gamma = 0.9;
    @Builder.Default boolean parallelRepair = true;

    // --- Progress / jobs ---
    @Builder.Default long progressIntervalMs = 250L;
    @Builder.Default double catchUpFactor = 0.35;
    @Builder.Default double minStep = 0.05;
    @Builder.Default double creepStep = 0.01;
    @Builder.Default int retainedJobs = 100;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
