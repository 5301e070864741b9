package com.smartsched.timetable_engine.solver.refine;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bounded fitness memo keyed by chromosome signature.
 * <p>
 * Three mechanisms keep it bounded: the LRU cap on insert, a reclamation pass every generation
 * that drops entries idle for longer than the eviction interval, and an eviction every
 * {@code evictionInterval} generations that keeps only the current population.
 */
public class FitnessCache {

    private record Entry(Fitness fitness, int lastUsed) {}

    private final int maxEntries;
    private final int evictionInterval;
    private final LinkedHashMap<Long, Entry> entries;
    private int generation;
    private long hits;
    private long misses;
    private int peakSize;

    public FitnessCache(int maxEntries, int evictionInterval) {
        if (maxEntries < 1 || evictionInterval < 1) {
            throw new IllegalArgumentException("Cache bound and eviction interval must be positive.");
        }
        this.maxEntries = maxEntries;
        this.evictionInterval = evictionInterval;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, Entry> eldest) {
                return size() > FitnessCache.this.maxEntries;
            }
        };
    }

    public synchronized Fitness get(long signature) {
        Entry entry = entries.get(signature);
        if (entry == null) {
            misses++;
            return null;
        }
        hits++;
        entries.put(signature, new Entry(entry.fitness(), generation));
        return entry.fitness();
    }

    public synchronized void put(long signature, Fitness fitness) {
        entries.put(signature, new Entry(fitness, generation));
        peakSize = Math.max(peakSize, entries.size());
    }

    /**
     * Called once per generation with the signatures of the surviving population.
     */
    public synchronized void endGeneration(Set<Long> population) {
        generation++;
        Iterator<Map.Entry<Long, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, Entry> e = it.next();
            if (generation - e.getValue().lastUsed() > evictionInterval && !population.contains(e.getKey())) {
                it.remove();
            }
        }
        if (generation % evictionInterval == 0) {
            entries.keySet().retainAll(population);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized int peakSize() {
        return peakSize;
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
