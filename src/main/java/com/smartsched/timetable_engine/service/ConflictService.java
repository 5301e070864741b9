package com.smartsched.timetable_engine.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.dto.ConflictDetectionRequest;
import com.smartsched.timetable_engine.dto.ConflictResolutionRequest;
import com.smartsched.timetable_engine.dto.ConflictResolutionResponse;
import com.smartsched.timetable_engine.dto.ResolutionDetail;
import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.model.ConflictType;
import com.smartsched.timetable_engine.solver.core.CancellationToken;
import com.smartsched.timetable_engine.solver.core.ConflictDetector;
import com.smartsched.timetable_engine.solver.core.ScheduleState;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;
import com.smartsched.timetable_engine.solver.progress.WorkReporter;
import com.smartsched.timetable_engine.solver.repair.ConflictRepairer;
import com.smartsched.timetable_engine.solver.repair.RepairContext;
import com.smartsched.timetable_engine.solver.repair.RepairReport;
import com.smartsched.timetable_engine.solver.repair.ValueTable;

import lombok.RequiredArgsConstructor;

/**
 * Conflict detection and resolution on an existing assignment, outside of a generation run.
 */
@Service
@RequiredArgsConstructor
public class ConflictService {

    private static final Logger logger = LoggerFactory.getLogger(ConflictService.class);

    private final ValueTableService valueTableService;
    private final EngineSettings settings;

    public List<Conflict> detectConflicts(ConflictDetectionRequest request) {
        SchedulingProblem problem = CatalogMapper.toProblem(request.catalog());
        ScheduleState state = CatalogMapper.loadAssignment(problem, request.assignment());
        List<Conflict> conflicts = ConflictDetector.detect(state);
        logger.info("Detected {} conflicts over {} assignments", conflicts.size(), state.assignedCount());
        return conflicts;
    }

    public ConflictResolutionResponse resolve(ConflictResolutionRequest request) {
        SchedulingProblem problem = CatalogMapper.toProblem(request.catalog());
        ScheduleState state = CatalogMapper.loadAssignment(problem, request.assignment());
        List<Conflict> before = ConflictDetector.detect(state);

        List<Conflict> targeted;
        if (request.conflictId() == null) {
            targeted = before;
        } else {
            Conflict conflict = before.stream()
                    .filter(c -> c.id().equals(request.conflictId()))
                    .findFirst()
                    .orElseThrow(() -> new NoSuchElementException("Conflict not found: " + request.conflictId()));
            targeted = List.of(conflict);
        }

        if (!request.auto()) {
            List<ResolutionDetail> details = targeted.stream()
                    .map(c -> detail(c, ResolutionDetail.MANUAL_REVIEW))
                    .collect(Collectors.toList());
            return new ConflictResolutionResponse(0, involvedCourses(targeted), details, before.size(), before.size(),
                    CatalogMapper.toEntries(state.assignments()));
        }

        Set<String> scope = request.conflictId() == null ? null : new HashSet<>(targeted.get(0).courseIds());
        ValueTable table = valueTableService.load(request.organizationId(), request.semester());
        RepairReport report = new ConflictRepairer(problem, null).repair(state, scope,
                new RepairContext(table, settings, CancellationToken.none()), WorkReporter.NOOP);
        valueTableService.save(request.organizationId(), request.semester(), table);

        List<Conflict> after = ConflictDetector.detect(state);
        List<ResolutionDetail> details = new ArrayList<>(targeted.size());
        List<Conflict> unresolved = new ArrayList<>();
        int resolved = 0;
        for (Conflict conflict : targeted) {
            if (persists(conflict, after)) {
                unresolved.add(conflict);
                details.add(detail(conflict, ResolutionDetail.MANUAL_REVIEW));
            } else {
                resolved++;
                details.add(detail(conflict, ResolutionDetail.RESOLVED));
            }
        }
        Set<String> manualReview = new TreeSet<>(involvedCourses(unresolved));
        manualReview.addAll(report.manualReview());
        logger.info("Resolved {} of {} targeted conflicts ({} -> {} overall)", resolved, targeted.size(),
                before.size(), after.size());
        return new ConflictResolutionResponse(resolved, new ArrayList<>(manualReview), details, before.size(),
                after.size(), CatalogMapper.toEntries(state.assignments()));
    }

    /**
     * A faculty or room overlap persists while its (resource, slot) cell still clashes. A student
     * overlap persists while any two of its courses still share students at its slot, whatever
     * the current set of colliding courses is.
     */
    private static boolean persists(Conflict target, List<Conflict> after) {
        for (Conflict remaining : after) {
            if (remaining.type() != target.type() || !remaining.slotId().equals(target.slotId())) {
                continue;
            }
            if (target.type() != ConflictType.STUDENT) {
                if (remaining.resourceId().equals(target.resourceId())) {
                    return true;
                }
                continue;
            }
            long shared = remaining.courseIds().stream().filter(target.courseIds()::contains).count();
            if (shared >= Math.min(2, target.courseIds().size())) {
                return true;
            }
        }
        return false;
    }

    private static ResolutionDetail detail(Conflict conflict, String outcome) {
        return new ResolutionDetail(conflict.id(), conflict.type(), conflict.severity(), conflict.courseIds(), outcome);
    }

    private static List<String> involvedCourses(List<Conflict> conflicts) {
        Set<String> courses = new TreeSet<>();
        conflicts.forEach(c -> courses.addAll(c.courseIds()));
        return new ArrayList<>(courses);
    }
}
