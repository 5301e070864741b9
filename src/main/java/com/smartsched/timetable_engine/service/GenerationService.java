package com.smartsched.timetable_engine.service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.dto.CatalogPayload;
import com.smartsched.timetable_engine.dto.GenerationRequest;
import com.smartsched.timetable_engine.dto.GenerationResultResponse;
import com.smartsched.timetable_engine.dto.ProgressResponse;
import com.smartsched.timetable_engine.dto.SnapshotGenerationRequest;
import com.smartsched.timetable_engine.dto.VariantResponse;
import com.smartsched.timetable_engine.model.JobStatus;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;
import com.smartsched.timetable_engine.solver.pipeline.PipelineResult;
import com.smartsched.timetable_engine.solver.pipeline.TimetablePipeline;
import com.smartsched.timetable_engine.solver.progress.ProgressCoordinator;
import com.smartsched.timetable_engine.solver.progress.ProgressSnapshot;
import com.smartsched.timetable_engine.solver.refine.WeightProfile;
import com.smartsched.timetable_engine.solver.repair.ValueTable;

/**
 * Owns the generation job registry. Submission validates the input synchronously and queues the
 * pipeline on the job pool; the pipeline's outcome, including any exception, is folded into the
 * job's terminal status.
 */
@Service
public class GenerationService {

    private static final Logger logger = LoggerFactory.getLogger(GenerationService.class);

    private final TimetablePipeline pipeline;
    private final ProgressCoordinator progressCoordinator;
    private final ExecutorService jobExecutor;
    private final ValueTableService valueTableService;
    private final SnapshotService snapshotService;
    private final EngineSettings settings;
    private final Map<String, GenerationJob> jobs = new ConcurrentHashMap<>();

    public GenerationService(TimetablePipeline pipeline,
                             ProgressCoordinator progressCoordinator,
                             @Qualifier("generationJobExecutor") ExecutorService jobExecutor,
                             ValueTableService valueTableService,
                             SnapshotService snapshotService,
                             EngineSettings settings) {
        this.pipeline = pipeline;
        this.progressCoordinator = progressCoordinator;
        this.jobExecutor = jobExecutor;
        this.valueTableService = valueTableService;
        this.snapshotService = snapshotService;
        this.settings = settings;
    }

    public String submit(GenerationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Generation request body is required.");
        }
        return submit(request.catalog(), request.organizationId(), request.semester(), request.variants());
    }

    public String submitSnapshot(SnapshotGenerationRequest request) {
        CatalogPayload catalog = snapshotService.load(request.organizationId(), request.semester(),
                request.academicYear());
        return submit(catalog, request.organizationId(), request.semester(), request.variants());
    }

    private String submit(CatalogPayload catalog, String organizationId, String semester, Integer variants) {
        int variantCount = variants == null ? settings.getDefaultVariants() : variants;
        if (variantCount < 1 || variantCount > WeightProfile.values().length) {
            throw new IllegalArgumentException("variants must be between 1 and " + WeightProfile.values().length
                    + ", got " + variantCount);
        }
        SchedulingProblem problem = CatalogMapper.toProblem(catalog);
        String jobId = UUID.randomUUID().toString();
        GenerationJob job = new GenerationJob(jobId, organizationId, semester);
        jobs.put(jobId, job);
        evictFinishedJobs();

        progressCoordinator.track(job.getProgress());
        try {
            jobExecutor.submit(() -> run(job, problem, variantCount));
        } catch (RejectedExecutionException e) {
            logger.error("!!! Job pool rejected generation {}", jobId, e);
            job.fail("Generation could not be scheduled: " + e.getMessage());
            progressCoordinator.release(job.getProgress());
        }
        logger.info("Queued generation {} ({} courses, {} sessions, {} variants)", jobId, problem.courseCount(),
                problem.sessionCount(), variantCount);
        return jobId;
    }

    void run(GenerationJob job, SchedulingProblem problem, int variantCount) {
        if (!job.start()) {
            progressCoordinator.release(job.getProgress());
            return;
        }
        logger.info(">>> Generation {} started", job.getId());
        try {
            ValueTable table = valueTableService.load(job.getOrganizationId(), job.getSemester());
            PipelineResult result = pipeline.run(problem, table, variantCount, job.getProgress(), job.getToken());
            job.getToken().throwIfCancelled();
            valueTableService.save(job.getOrganizationId(), job.getSemester(), table);
            job.complete(result);
            logger.info(">>> Generation {} completed: {}", job.getId(), job.getMessage());
        } catch (CancellationException e) {
            job.cancelled();
            logger.info("Generation {} cancelled", job.getId());
        } catch (Exception | LinkageError e) {
            logger.error("!!! Generation {} failed", job.getId(), e);
            job.fail("Generation failed: " + e.getMessage());
        } finally {
            progressCoordinator.release(job.getProgress());
        }
    }

    public ProgressResponse getProgress(String jobId) {
        GenerationJob job = find(jobId);
        ProgressSnapshot snapshot = job.getProgress().snapshot();
        return new ProgressResponse(jobId, job.getStatus(), snapshot.stage(),
                Math.round(snapshot.percent() * 10.0) / 10.0, snapshot.etaSeconds(), job.getMessage());
    }

    public GenerationResultResponse getResult(String jobId) {
        GenerationJob job = find(jobId);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new IllegalStateException("Generation " + jobId + " is " + job.getStatus() + ": " + job.getMessage());
        }
        PipelineResult result = job.getResult();
        List<VariantResponse> variants = result.variants().stream()
                .map(v -> new VariantResponse(v.variantNumber(), v.rank(), v.profile().name(),
                        v.profile().getDisplayName(), v.weights(), v.conflicts(), v.capacityViolations(),
                        v.preferenceMisses(), v.cost(), CatalogMapper.toEntries(v.assignment())))
                .collect(Collectors.toList());
        return new GenerationResultResponse(jobId, CatalogMapper.toEntries(result.assignment()), result.conflicts(),
                result.statistics(), variants);
    }

    /** Cooperative: the job stops at its next checkpoint. No-op for finished jobs. */
    public void cancel(String jobId) {
        GenerationJob job = find(jobId);
        if (job.getStatus().isTerminal()) {
            return;
        }
        logger.info("Cancellation requested for generation {}", jobId);
        job.getToken().cancel();
        if (job.getStatus() == JobStatus.QUEUED) {
            job.cancelled();
        }
    }

    public int jobCount() {
        return jobs.size();
    }

    private GenerationJob find(String jobId) {
        GenerationJob job = jobs.get(jobId);
        if (job == null) {
            throw new NoSuchElementException("Generation job not found: " + jobId);
        }
        return job;
    }

    // Keeps at most the configured number of finished jobs, dropping the oldest first.
    private void evictFinishedJobs() {
        List<GenerationJob> finished = jobs.values().stream()
                .filter(j -> j.getStatus().isTerminal() && j.getFinishedAt() != null)
                .sorted(Comparator.comparing(GenerationJob::getFinishedAt))
                .collect(Collectors.toList());
        int excess = finished.size() - settings.getRetainedJobs();
        for (int i = 0; i < excess; i++) {
            jobs.remove(finished.get(i).getId());
        }
    }
}
