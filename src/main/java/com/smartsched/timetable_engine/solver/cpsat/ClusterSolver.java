package com.smartsched.timetable_engine.solver.cpsat;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.model.Cluster;
import com.smartsched.timetable_engine.solver.core.CancellationToken;
import com.smartsched.timetable_engine.solver.core.OccupancyView;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Solves one cluster: capacity pre-check, then the strategy ladder, then greedy. Each call owns
 * its own model and solver; only the problem and the reservation view are shared.
 */
public class ClusterSolver {

    private static final Logger logger = LoggerFactory.getLogger(ClusterSolver.class);

    static final double ZERO_TIME_SECONDS = 0.05;
    static final long LARGE_DOMAIN = 1_000L;

    private final SchedulingProblem problem;
    private final EngineSettings settings;
    private final ClusterModelBuilder builder;
    private final GreedyScheduler greedy;

    public ClusterSolver(SchedulingProblem problem, EngineSettings settings) {
        Loader.loadNativeLibraries();
        this.problem = problem;
        this.settings = settings;
        this.builder = new ClusterModelBuilder(problem, settings);
        this.greedy = new GreedyScheduler(problem, settings.getGreedyStudentSample());
    }

    public ClusterSolveResult solve(Cluster cluster, OccupancyView reserved, CancellationToken token) {
        long started = System.nanoTime();
        int[] courses = cluster.courseIds().stream().mapToInt(problem::courseIndexOf).toArray();
        int[] sessions = sessionsOf(courses);

        if (!passesCapacityPrecheck(courses, sessions.length, reserved)) {
            logger.warn("Cluster {}: capacity pre-check failed for {} sessions, using greedy", cluster.id(),
                    sessions.length);
            return greedyResult(cluster, sessions, reserved, SolveOutcome.GREEDY_CAPACITY_PRECHECK, false, started);
        }

        boolean suspected = false;
        for (SolverStrategy strategy : SolverStrategy.values()) {
            token.throwIfCancelled();
            ClusterModel built = builder.build(cluster.id(), courses, reserved, strategy);
            CpSolver solver = new CpSolver();
            solver.getParameters().setMaxTimeInSeconds(settings.getStrategyTimeoutSeconds());
            solver.getParameters().setNumSearchWorkers(settings.getSearchWorkers());
            solver.getParameters().setRandomSeed((int) settings.getSeed());

            Runnable stop = solver::stopSearch;
            token.onCancel(stop);
            CpSolverStatus status;
            try {
                status = solver.solve(built.model());
            } finally {
                token.removeHook(stop);
            }
            token.throwIfCancelled();

            logger.debug("Cluster {} strategy {}: {} vars, {} student constraints -> {} in {}s", cluster.id(), strategy,
                    built.domainSize(), built.studentConstraints(), status, solver.wallTime());

            if (status == CpSolverStatus.OPTIMAL || status == CpSolverStatus.FEASIBLE) {
                int[] slots = new int[sessions.length];
                int[] rooms = new int[sessions.length];
                extract(solver, built, sessions, slots, rooms);
                SolveOutcome outcome = status == CpSolverStatus.OPTIMAL ? SolveOutcome.OPTIMAL : SolveOutcome.FEASIBLE;
                logger.info("Cluster {} solved with {} ({} sessions)", cluster.id(), strategy, sessions.length);
                return new ClusterSolveResult(cluster.id(), sessions, slots, rooms, outcome, strategy, suspected,
                        elapsed(started));
            }
            if (status == CpSolverStatus.INFEASIBLE && solver.wallTime() < ZERO_TIME_SECONDS
                    && built.domainSize() >= LARGE_DOMAIN && !hasEmptySession(built, sessions)) {
                suspected = true;
                logger.error("!!! Cluster {} strategy {} reported INFEASIBLE in {}s over {} domain triples; "
                        + "this indicates a modeling defect", cluster.id(), strategy, solver.wallTime(), built.domainSize());
            } else if (status == CpSolverStatus.MODEL_INVALID) {
                suspected = true;
                logger.error("!!! Cluster {} strategy {} produced an invalid model: {}", cluster.id(), strategy,
                        built.model().validate());
            } else {
                logger.warn("Cluster {} strategy {} ended with {}", cluster.id(), strategy, status);
            }
        }
        logger.warn("Cluster {}: all strategies failed, falling back to greedy", cluster.id());
        return greedyResult(cluster, sessions, reserved, SolveOutcome.GREEDY_AFTER_SOLVER, suspected, started);
    }

    private ClusterSolveResult greedyResult(Cluster cluster, int[] sessions, OccupancyView reserved,
                                            SolveOutcome outcome, boolean suspected, long started) {
        int[][] placed = greedy.schedule(sessions, reserved);
        return new ClusterSolveResult(cluster.id(), sessions, placed[0], placed[1], outcome, null, suspected,
                elapsed(started));
    }

    // Usable (slot, room) cells must cover at least the configured share of required sessions.
    private boolean passesCapacityPrecheck(int[] courses, int sessionCount, OccupancyView reserved) {
        Set<Integer> usableRooms = new HashSet<>();
        for (int c : courses) {
            for (int r : problem.roomsForCourse(c)) {
                usableRooms.add(r);
            }
        }
        long freeCells = 0;
        for (int r : usableRooms) {
            for (int t = 0; t < problem.slotCount(); t++) {
                if (!reserved.roomBusy(r, t)) {
                    freeCells++;
                }
            }
        }
        return freeCells >= settings.getCapacityPrecheckRatio() * sessionCount;
    }

    private static void extract(CpSolver solver, ClusterModel built, int[] sessions, int[] slots, int[] rooms) {
        Map<Integer, Integer> position = new HashMap<>();
        for (int i = 0; i < sessions.length; i++) {
            position.put(sessions[i], i);
        }
        for (int v = 0; v < built.domainSize(); v++) {
            if (solver.booleanValue(built.variables().get(v))) {
                int i = position.get(built.tripleSession()[v]);
                slots[i] = built.tripleSlot()[v];
                rooms[i] = built.tripleRoom()[v];
            }
        }
    }

    // A session with no remaining domain is a true infeasibility, not a modeling defect.
    private static boolean hasEmptySession(ClusterModel built, int[] sessions) {
        Set<Integer> covered = new HashSet<>();
        for (int s : built.tripleSession()) {
            covered.add(s);
        }
        return covered.size() < sessions.length;
    }

    private int[] sessionsOf(int[] courses) {
        int total = 0;
        for (int c : courses) {
            total += problem.endSession(c) - problem.firstSession(c);
        }
        int[] sessions = new int[total];
        int i = 0;
        for (int c : courses) {
            for (int s = problem.firstSession(c); s < problem.endSession(c); s++) {
                sessions[i++] = s;
            }
        }
        return sessions;
    }

    private static double elapsed(long started) {
        return (System.nanoTime() - started) / 1e9;
    }
}
