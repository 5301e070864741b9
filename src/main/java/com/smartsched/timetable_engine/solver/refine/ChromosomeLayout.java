package com.smartsched.timetable_engine.solver.refine;

import java.util.ArrayList;
import java.util.List;

import com.smartsched.timetable_engine.model.Cluster;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Session indices grouped by cluster, in cluster order. Crossover exchanges whole runs of
 * clusters so a child inherits each cluster's internally consistent sub-schedule intact.
 */
public final class ChromosomeLayout {

    private final List<int[]> blocks;

    private ChromosomeLayout(List<int[]> blocks) {
        this.blocks = blocks;
    }

    public static ChromosomeLayout of(SchedulingProblem problem, List<Cluster> clusters) {
        List<int[]> blocks = new ArrayList<>(clusters.size());
        for (Cluster cluster : clusters) {
            List<Integer> sessions = new ArrayList<>();
            for (String courseId : cluster.courseIds()) {
                int c = problem.courseIndexOf(courseId);
                for (int s = problem.firstSession(c); s < problem.endSession(c); s++) {
                    sessions.add(s);
                }
            }
            blocks.add(sessions.stream().mapToInt(Integer::intValue).toArray());
        }
        return new ChromosomeLayout(blocks);
    }

    public int blockCount() {
        return blocks.size();
    }

    public int[] block(int i) {
        return blocks.get(i);
    }
}
