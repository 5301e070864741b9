package com.smartsched.timetable_engine.solver.core;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Job-level cooperative cancellation flag. Stages poll {@link #throwIfCancelled()} at their
 * checkpoints; long-running native searches register a hook to be stopped early.
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable hook : hooks) {
                try {
                    hook.run();
                } catch (RuntimeException e) {
                    logger.warn("Cancellation hook failed: {}", e.getMessage());
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Generation cancelled");
        }
    }

    /** Registers a hook; if already cancelled the hook runs immediately. */
    public void onCancel(Runnable hook) {
        hooks.add(hook);
        if (cancelled.get()) {
            hook.run();
        }
    }

    public void removeHook(Runnable hook) {
        hooks.remove(hook);
    }
}
