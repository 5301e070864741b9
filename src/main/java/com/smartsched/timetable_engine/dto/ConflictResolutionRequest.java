package com.smartsched.timetable_engine.dto;

import java.util.List;

/**
 * Resolves one conflict ({@code conflictId}) or all of them (null id). With {@code auto} false
 * nothing is changed and the targeted conflicts are only reported for manual review.
 */
public record ConflictResolutionRequest(CatalogPayload catalog,
                                        List<AssignmentEntry> assignment,
                                        String conflictId,
                                        boolean auto,
                                        String organizationId,
                                        String semester) {
}
