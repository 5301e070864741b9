package com.smartsched.timetable_engine.solver.core;

/**
 * Frozen copy of a schedule's occupancy indices, safe to share between solver workers.
 */
public final class OccupancyView {

    private final int slotCount;
    private final int[] facultyLoad;
    private final int[] roomLoad;
    private final int[] studentLoad;

    OccupancyView(int slotCount, int[] facultyLoad, int[] roomLoad, int[] studentLoad) {
        this.slotCount = slotCount;
        this.facultyLoad = facultyLoad;
        this.roomLoad = roomLoad;
        this.studentLoad = studentLoad;
    }

    public static OccupancyView empty(SchedulingProblem problem) {
        int slots = problem.slotCount();
        return new OccupancyView(slots, new int[problem.facultyCount() * slots],
                new int[problem.roomCount() * slots], new int[problem.studentCount() * slots]);
    }

    public boolean facultyBusy(int f, int t) {
        return facultyLoad[f * slotCount + t] > 0;
    }

    public boolean roomBusy(int r, int t) {
        return roomLoad[r * slotCount + t] > 0;
    }

    public boolean studentBusy(int st, int t) {
        return studentLoad[st * slotCount + t] > 0;
    }
}
