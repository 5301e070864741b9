package com.smartsched.timetable_engine.solver.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Run summary attached to a completed generation.
 */
public record GenerationStatistics(int courses,
                                   int sessions,
                                   int clusters,
                                   int optimalClusters,
                                   int feasibleClusters,
                                   int greedyClusters,
                                   List<Integer> suspectedModelingDefects,
                                   int conflictsAfterSolving,
                                   int conflictsAfterRefinement,
                                   int conflictsAfterRepair,
                                   int generationsRun,
                                   int repairResolved,
                                   int repairRejected,
                                   int rolledBackScopes,
                                   List<String> manualReview,
                                   int capacityViolations,
                                   int preferenceMisses,
                                   Map<String, Double> stageSeconds) {
}
