package com.smartsched.timetable_engine.solver.repair;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Learned state/action values used to rank repair candidates. Entries carried over from a
 * previous run learn with a lower rate than entries discovered in this one.
 */
public final class ValueTable {

    private final Map<String, Double> values = new ConcurrentHashMap<>();
    private final Set<String> transferred = ConcurrentHashMap.newKeySet();
    private final double alphaNew;
    private final double alphaTransferred;
    private final double gamma;

    public ValueTable(double alphaNew, double alphaTransferred, double gamma) {
        this.alphaNew = alphaNew;
        this.alphaTransferred = alphaTransferred;
        this.gamma = gamma;
    }

    public static ValueTable transferredFrom(Map<String, Double> previous, double alphaNew, double alphaTransferred,
                                             double gamma) {
        ValueTable table = new ValueTable(alphaNew, alphaTransferred, gamma);
        if (previous != null) {
            table.values.putAll(previous);
            table.transferred.addAll(previous.keySet());
        }
        return table;
    }

    /** Key safe for document stores: no '.' or '$'. */
    public static String key(String courseId, String slotId, String roomId) {
        return sanitize(courseId) + "|" + sanitize(slotId) + "|" + sanitize(roomId);
    }

    private static String sanitize(String part) {
        return part.replace('.', '_').replace('$', '_');
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public double value(String key) {
        return values.getOrDefault(key, 0.0);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public void update(String key, double reward, double bestNext) {
        double alpha = transferred.contains(key) ? alphaTransferred : alphaNew;
        values.compute(key, (k, old) -> {
            double current = old == null ? 0.0 : old;
            return current + alpha * (reward + gamma * bestNext - current);
        });
    }

    public int size() {
        return values.size();
    }

    public Map<String, Double> export() {
        return new HashMap<>(values);
    }
}
