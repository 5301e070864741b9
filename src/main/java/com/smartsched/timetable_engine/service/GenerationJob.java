package com.smartsched.timetable_engine.service;

import java.time.Instant;

import com.smartsched.timetable_engine.model.JobStatus;
import com.smartsched.timetable_engine.solver.core.CancellationToken;
import com.smartsched.timetable_engine.solver.pipeline.PipelineResult;
import com.smartsched.timetable_engine.solver.progress.JobProgress;

/**
 * Registry entry for one generation run. Terminal once its status leaves RUNNING.
 */
public class GenerationJob {

    private final String id;
    private final String organizationId;
    private final String semester;
    private final Instant createdAt = Instant.now();
    private final JobProgress progress = new JobProgress();
    private final CancellationToken token = new CancellationToken();

    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile String message = "Queued";
    private volatile PipelineResult result;
    private volatile Instant finishedAt;

    public GenerationJob(String id, String organizationId, String semester) {
        this.id = id;
        this.organizationId = organizationId;
        this.semester = semester;
    }

    synchronized boolean start() {
        if (status != JobStatus.QUEUED) {
            return false;
        }
        status = JobStatus.RUNNING;
        message = "Running";
        return true;
    }

    synchronized void complete(PipelineResult pipelineResult) {
        if (status.isTerminal()) {
            return;
        }
        result = pipelineResult;
        finish(JobStatus.COMPLETED, "Generated " + pipelineResult.assignment().size() + " assignments with "
                + pipelineResult.conflicts().size() + " remaining conflicts");
        progress.finish();
    }

    synchronized void fail(String reason) {
        if (!status.isTerminal()) {
            finish(JobStatus.FAILED, reason);
        }
    }

    synchronized void cancelled() {
        if (!status.isTerminal()) {
            finish(JobStatus.CANCELLED, "Generation cancelled");
        }
    }

    private void finish(JobStatus terminal, String reason) {
        status = terminal;
        message = reason;
        finishedAt = Instant.now();
    }

    // Getters
    public String getId() { return id; }
    public String getOrganizationId() { return organizationId; }
    public String getSemester() { return semester; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public JobStatus getStatus() { return status; }
    public String getMessage() { return message; }
    public PipelineResult getResult() { return result; }
    public JobProgress getProgress() { return progress; }
    public CancellationToken getToken() { return token; }
}
