package com.smartsched.timetable_engine.solver.progress;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartsched.timetable_engine.config.EngineSettings;

/**
 * Runs the fixed-interval reporting loop for every active job. This loop is the only writer of
 * a job's displayed percentage.
 */
public class ProgressCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ProgressCoordinator.class);

    private final ScheduledExecutorService scheduler;
    private final EngineSettings settings;
    private final Map<JobProgress, ScheduledFuture<?>> loops = new ConcurrentHashMap<>();

    public ProgressCoordinator(ScheduledExecutorService scheduler, EngineSettings settings) {
        this.scheduler = scheduler;
        this.settings = settings;
    }

    public void track(JobProgress progress) {
        ScheduledFuture<?> loop = scheduler.scheduleAtFixedRate(() -> tick(progress), 0L,
                settings.getProgressIntervalMs(), TimeUnit.MILLISECONDS);
        loops.put(progress, loop);
    }

    /** Final tick and stop; after this the job shows 100% if it finished. */
    public void release(JobProgress progress) {
        ScheduledFuture<?> loop = loops.remove(progress);
        if (loop != null) {
            loop.cancel(false);
        }
        tick(progress);
    }

    public int activeLoops() {
        return loops.size();
    }

    void tick(JobProgress progress) {
        try {
            synchronized (progress) {
                progress.tick(settings.getCatchUpFactor(), settings.getMinStep(), settings.getCreepStep());
            }
        } catch (RuntimeException e) {
            // A failing tick must not cancel the periodic task.
            logger.warn("Progress tick failed: {}", e.getMessage());
        }
    }
}
