package com.smartsched.timetable_engine.dto;

/**
 * Submits a full generation. Organization and semester, when present, select the learned value
 * table to transfer from and save back to. {@code variants} (1 to 5) asks for that many ranked
 * alternatives; absent means the configured default.
 */
public record GenerationRequest(String organizationId, String semester, CatalogPayload catalog, Integer variants) {
}
