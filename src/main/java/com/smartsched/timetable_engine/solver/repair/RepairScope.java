package com.smartsched.timetable_engine.solver.repair;

import java.util.Set;

/**
 * One super-cluster to repair: its course indices and the resources it touches.
 */
record RepairScope(int id, int[] courses, Set<Long> footprint) {

    boolean disjointFrom(RepairScope other) {
        Set<Long> smaller = footprint.size() <= other.footprint.size() ? footprint : other.footprint;
        Set<Long> larger = smaller == footprint ? other.footprint : footprint;
        for (Long resource : smaller) {
            if (larger.contains(resource)) {
                return false;
            }
        }
        return true;
    }
}
