package com.smartsched.timetable_engine.solver.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.smartsched.timetable_engine.model.Placement;
import com.smartsched.timetable_engine.model.SessionKey;

/**
 * Undo log for a scope of schedule mutations. Entries are replayed newest first on rollback.
 */
public final class MoveJournal {

    public record Entry(SessionKey session, Placement previous, Placement applied) {}

    private final List<Entry> entries = new ArrayList<>();

    void record(SessionKey session, Placement previous, Placement applied) {
        entries.add(new Entry(session, previous, applied));
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
