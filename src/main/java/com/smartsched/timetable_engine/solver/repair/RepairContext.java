package com.smartsched.timetable_engine.solver.repair;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.solver.core.CancellationToken;

/**
 * Search state owned by one repair invocation: the value table it learns into, its settings,
 * its cancellation token and its wall-clock deadline.
 */
public final class RepairContext {

    private final ValueTable valueTable;
    private final EngineSettings settings;
    private final CancellationToken token;
    private final long deadlineNanos;

    public RepairContext(ValueTable valueTable, EngineSettings settings, CancellationToken token) {
        this.valueTable = valueTable;
        this.settings = settings;
        this.token = token;
        this.deadlineNanos = System.nanoTime() + (long) (settings.getRepairTimeBudgetSeconds() * 1e9);
    }

    public static RepairContext cold(EngineSettings settings, CancellationToken token) {
        return new RepairContext(new ValueTable(settings.getAlphaNew(), settings.getAlphaTransferred(),
                settings.getGamma()), settings, token);
    }

    public ValueTable valueTable() {
        return valueTable;
    }

    public EngineSettings settings() {
        return settings;
    }

    public CancellationToken token() {
        return token;
    }

    public boolean expired() {
        return System.nanoTime() > deadlineNanos;
    }
}
