package com.smartsched.timetable_engine.solver.repair;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartsched.timetable_engine.solver.core.MoveJournal;
import com.smartsched.timetable_engine.solver.core.MoveResult;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;
import com.smartsched.timetable_engine.solver.progress.WorkReporter;

/**
 * Local-search repair of residual conflicts.
 * <p>
 * Within a super-cluster, conflicting sessions are moved one at a time to candidates the oracle
 * accepts, falling back to pairwise swaps inside the scope. Every mutation goes through the
 * state's validated operations and a move only counts as resolved when it lowered the conflict
 * count. A scope whose conflicts did not drop is rolled back and its courses are flagged for
 * manual review; if the whole pass ends with more conflicts than it started with, everything is
 * rolled back.
 */
public class ConflictRepairer {

    private static final Logger logger = LoggerFactory.getLogger(ConflictRepairer.class);
    private static final int MAX_SWAP_PARTNERS = 64;

    private final SchedulingProblem problem;
    private final ExecutorService executor;

    private record ScopeOutcome(RepairScope scope, MoveJournal journal, boolean committed, int resolved,
                                int rejected, List<String> unresolved) {}

    /**
     * @param executor pool for repairing disjoint super-clusters concurrently, or null to run
     *                 every scope on the calling thread
     */
    public ConflictRepairer(SchedulingProblem problem, ExecutorService executor) {
        this.problem = problem;
        this.executor = executor;
    }

    public RepairReport repair(ScheduleState state, RepairContext context, WorkReporter reporter) {
        return repair(state, null, context, reporter);
    }

    /**
     * Repairs conflicts among the given course ids only (all conflicting courses when null).
     */
    public RepairReport repair(ScheduleState state, Set<String> restrictTo, RepairContext context,
                               WorkReporter reporter) {
        int before = state.conflictCount();
        int[] conflicting = conflictingCourses(state, restrictTo);
        if (before == 0 || conflicting.length == 0) {
            reporter.report(1, 1);
            return RepairReport.unchanged(before);
        }

        SuperClusterPlanner planner = new SuperClusterPlanner(problem, context.settings());
        List<List<RepairScope>> waves = planner.plan(state, conflicting);
        int scopes = waves.stream().mapToInt(List::size).sum();
        FeasibleSlotGenerator generator = new FeasibleSlotGenerator(problem, context.settings().getRepairMaxCandidates());

        List<MoveJournal> committed = new ArrayList<>();
        Set<String> manualReview = new TreeSet<>();
        int resolved = 0;
        int rejected = 0;
        int rolledBack = 0;
        int finished = 0;

        for (List<RepairScope> wave : waves) {
            context.token().throwIfCancelled();
            for (ScopeOutcome outcome : runWave(wave, state, generator, context)) {
                rejected += outcome.rejected();
                if (outcome.committed()) {
                    committed.add(outcome.journal());
                    resolved += outcome.resolved();
                } else {
                    rolledBack++;
                }
                manualReview.addAll(outcome.unresolved());
                finished++;
            }
            reporter.report(finished, scopes);
        }

        int after = state.conflictCount();
        if (after > before) {
            logger.error("!!! Repair pass raised conflicts from {} to {}; rolling back all {} committed scopes",
                    before, after, committed.size());
            for (int i = committed.size() - 1; i >= 0; i--) {
                state.rollback(committed.get(i));
            }
            for (int c : conflicting) {
                manualReview.add(problem.course(c).id());
            }
            after = state.conflictCount();
            resolved = 0;
            rolledBack = scopes;
        }
        logger.info("Repair: conflicts {} -> {}, {} resolved moves, {} rejected candidates, {}/{} scopes rolled back, "
                + "{} courses for manual review", before, after, resolved, rejected, rolledBack, scopes, manualReview.size());
        return new RepairReport(before, after, resolved, rejected, scopes, rolledBack, new ArrayList<>(manualReview));
    }

    private List<ScopeOutcome> runWave(List<RepairScope> wave, ScheduleState state, FeasibleSlotGenerator generator,
                                       RepairContext context) {
        List<ScopeOutcome> outcomes = new ArrayList<>(wave.size());
        if (executor == null || wave.size() == 1 || !context.settings().isParallelRepair()) {
            for (RepairScope scope : wave) {
                outcomes.add(repairScope(scope, state, generator, context));
            }
            return outcomes;
        }
        List<Future<ScopeOutcome>> futures = new ArrayList<>(wave.size());
        for (RepairScope scope : wave) {
            futures.add(executor.submit(() -> repairScope(scope, state, generator, context)));
        }
        for (Future<ScopeOutcome> future : futures) {
            try {
                outcomes.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new CancellationException("Interrupted while repairing conflicts");
            } catch (ExecutionException e) {
                if (e.getCause() instanceof CancellationException) {
                    throw (CancellationException) e.getCause();
                }
                throw new IllegalStateException("Repair scope failed", e.getCause());
            }
        }
        return outcomes;
    }

    private ScopeOutcome repairScope(RepairScope scope, ScheduleState state, FeasibleSlotGenerator generator,
                                     RepairContext context) {
        ValueTable table = context.valueTable();
        MoveJournal journal = new MoveJournal();
        List<Integer> sessions = new ArrayList<>();
        for (int c : scope.courses()) {
            for (int s = problem.firstSession(c); s < problem.endSession(c); s++) {
                sessions.add(s);
            }
        }
        int scopeBefore = scopeConflicts(state, sessions);
        int resolved = 0;
        int rejected = 0;

        for (int iteration = 0; iteration < context.settings().getRepairMaxIterations(); iteration++) {
            context.token().throwIfCancelled();
            if (context.expired()) {
                logger.warn("Repair time budget exhausted in scope {}", scope.id());
                break;
            }
            List<Integer> conflicted = new ArrayList<>();
            for (int s : sessions) {
                if (state.sessionConflicts(s) > 0) {
                    conflicted.add(s);
                }
            }
            if (conflicted.isEmpty()) {
                break;
            }
            conflicted.sort(Comparator.comparingInt((Integer s) -> -state.sessionConflicts(s)).thenComparingInt(s -> s));

            boolean progressed = false;
            for (int s : conflicted) {
                if (state.sessionConflicts(s) == 0) {
                    continue;
                }
                List<Candidate> candidates = generator.candidates(state, s, table);
                boolean moved = false;
                for (int i = 0; i < candidates.size() && !moved; i++) {
                    Candidate candidate = candidates.get(i);
                    MoveResult result = state.applyIndex(s, candidate.slot(), candidate.room(), journal);
                    if (!result.applied()) {
                        rejected++;
                        continue;
                    }
                    moved = true;
                    if (result.reducedConflicts()) {
                        resolved++;
                        progressed = true;
                        double bestNext = i + 1 < candidates.size() ? candidates.get(i + 1).value() : 0.0;
                        table.update(candidate.key(), -result.conflictDelta(), bestNext);
                    }
                }
                if (!moved && trySwap(state, s, sessions, journal)) {
                    resolved++;
                    progressed = true;
                }
            }
            if (!progressed) {
                break;
            }
        }

        int scopeAfter = scopeConflicts(state, sessions);
        List<String> unresolved = new ArrayList<>();
        boolean committed = scopeBefore == 0 || scopeAfter < scopeBefore;
        if (!committed) {
            if (!journal.isEmpty()) {
                state.rollback(journal);
            }
            resolved = 0;
            logger.warn("Scope {} did not reduce conflicts ({} -> {}); rolled back for manual review", scope.id(),
                    scopeBefore, scopeAfter);
        }
        for (int s : sessions) {
            if (state.sessionConflicts(s) > 0) {
                unresolved.add(problem.course(problem.courseOfSession(s)).id());
            }
        }
        return new ScopeOutcome(scope, journal, committed, resolved, rejected, unresolved);
    }

    private boolean trySwap(ScheduleState state, int s, List<Integer> scopeSessions, MoveJournal journal) {
        int attempts = 0;
        for (int other : scopeSessions) {
            if (other == s || state.slotIndex(other) == state.slotIndex(s)) {
                continue;
            }
            if (++attempts > MAX_SWAP_PARTNERS) {
                return false;
            }
            MoveResult result = state.trySwap(problem.session(s), problem.session(other), journal);
            if (result.applied()) {
                return result.reducedConflicts();
            }
        }
        return false;
    }

    private static int scopeConflicts(ScheduleState state, List<Integer> sessions) {
        int total = 0;
        for (int s : sessions) {
            total += state.sessionConflicts(s);
        }
        return total;
    }

    private int[] conflictingCourses(ScheduleState state, Set<String> restrictTo) {
        Set<Integer> courses = new TreeSet<>();
        for (int s = 0; s < problem.sessionCount(); s++) {
            int c = problem.courseOfSession(s);
            if (restrictTo != null && !restrictTo.contains(problem.course(c).id())) {
                continue;
            }
            if (state.sessionConflicts(s) > 0) {
                courses.add(c);
            }
        }
        return courses.stream().mapToInt(Integer::intValue).toArray();
    }
}
