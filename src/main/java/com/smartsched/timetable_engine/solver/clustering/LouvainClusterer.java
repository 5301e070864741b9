package com.smartsched.timetable_engine.solver.clustering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartsched.timetable_engine.model.Cluster;
import com.smartsched.timetable_engine.solver.core.SchedulingProblem;

/**
 * Size-bounded Louvain community detection. A vertex may only join a community whose total
 * course count stays within {@code maxSize}; afterwards communities smaller than {@code minSize}
 * are packed together into batches up to {@code maxSize}.
 */
public class LouvainClusterer {

    private static final Logger logger = LoggerFactory.getLogger(LouvainClusterer.class);
    private static final int MAX_LOCAL_SWEEPS = 20;

    private final int maxSize;
    private final int minSize;
    private final int maxPasses;
    private final long seed;

    public LouvainClusterer(int maxSize, int minSize, int maxPasses, long seed) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cluster size bound must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.minSize = Math.min(Math.max(1, minSize), maxSize);
        this.maxPasses = Math.max(1, maxPasses);
        this.seed = seed;
    }

    public List<Cluster> cluster(SchedulingProblem problem) {
        return cluster(problem, CourseGraph.build(problem));
    }

    /** Partitions the graph's courses; every course lands in exactly one cluster. */
    public List<Cluster> cluster(SchedulingProblem problem, CourseGraph graph) {
        int n = graph.size();
        if (n == 0) {
            return List.of();
        }
        int[] membership = detectCommunities(graph);

        Map<Integer, List<Integer>> groups = new TreeMap<>();
        for (int v = 0; v < n; v++) {
            groups.computeIfAbsent(membership[v], k -> new ArrayList<>()).add(v);
        }

        List<List<Integer>> bounded = new ArrayList<>();
        List<Integer> small = new ArrayList<>();
        for (List<Integer> group : groups.values()) {
            if (group.size() > maxSize) {
                for (int from = 0; from < group.size(); from += maxSize) {
                    bounded.add(group.subList(from, Math.min(group.size(), from + maxSize)));
                }
            } else if (group.size() < minSize) {
                small.addAll(group);
            } else {
                bounded.add(group);
            }
        }
        for (int from = 0; from < small.size(); from += maxSize) {
            bounded.add(small.subList(from, Math.min(small.size(), from + maxSize)));
        }

        List<Cluster> clusters = new ArrayList<>(bounded.size());
        int[] courseIndices = graph.courseIndices();
        for (List<Integer> group : bounded) {
            List<String> ids = new ArrayList<>(group.size());
            group.forEach(v -> ids.add(problem.course(courseIndices[v]).id()));
            clusters.add(new Cluster(clusters.size(), ids));
        }

        if (clusters.size() == 1 && n > maxSize) {
            logger.warn("Clustering degenerated to a single cluster of {} courses", n);
        }
        logger.info("Clustered {} courses into {} clusters (bound {}, {} edges)", n, clusters.size(), maxSize,
                graph.edgeCount());
        return clusters;
    }

    private int[] detectCommunities(CourseGraph graph) {
        int n = graph.size();
        Random random = new Random(seed);

        // Level graph: vertex weights (course counts) and weighted adjacency.
        List<Map<Integer, Double>> adjacency = new ArrayList<>(n);
        for (int v = 0; v < n; v++) {
            adjacency.add(new HashMap<>(graph.neighbors(v)));
        }
        int[] vertexSize = new int[n];
        Arrays.fill(vertexSize, 1);
        int[] membership = new int[n];
        for (int v = 0; v < n; v++) {
            membership[v] = v;
        }

        for (int pass = 0; pass < maxPasses; pass++) {
            int levelSize = adjacency.size();
            int[] community = localMoving(adjacency, vertexSize, random);

            Map<Integer, Integer> renumber = new HashMap<>();
            for (int v = 0; v < levelSize; v++) {
                renumber.putIfAbsent(community[v], renumber.size());
            }
            int communities = renumber.size();
            for (int v = 0; v < n; v++) {
                membership[v] = renumber.get(community[membership[v]]);
            }
            if (communities == levelSize) {
                break;
            }

            List<Map<Integer, Double>> next = new ArrayList<>(communities);
            for (int c = 0; c < communities; c++) {
                next.add(new HashMap<>());
            }
            int[] nextSize = new int[communities];
            for (int v = 0; v < levelSize; v++) {
                int cv = renumber.get(community[v]);
                nextSize[cv] += vertexSize[v];
                for (Map.Entry<Integer, Double> edge : adjacency.get(v).entrySet()) {
                    int cu = renumber.get(community[edge.getKey()]);
                    next.get(cv).merge(cu, edge.getValue(), Double::sum);
                }
            }
            adjacency = next;
            vertexSize = nextSize;
        }
        return membership;
    }

    // One Louvain level: greedy modularity moves under the size bound until no vertex moves.
    private int[] localMoving(List<Map<Integer, Double>> adjacency, int[] vertexSize, Random random) {
        int n = adjacency.size();
        double[] degree = new double[n];
        double totalWeight = 0.0;
        for (int v = 0; v < n; v++) {
            for (double w : adjacency.get(v).values()) {
                degree[v] += w;
            }
            totalWeight += degree[v];
        }
        int[] community = new int[n];
        double[] communityDegree = new double[n];
        int[] communitySize = new int[n];
        for (int v = 0; v < n; v++) {
            community[v] = v;
            communityDegree[v] = degree[v];
            communitySize[v] = vertexSize[v];
        }
        if (totalWeight == 0.0) {
            return community;
        }

        List<Integer> order = new ArrayList<>(n);
        for (int v = 0; v < n; v++) {
            order.add(v);
        }
        boolean moved = true;
        for (int sweep = 0; sweep < MAX_LOCAL_SWEEPS && moved; sweep++) {
            moved = false;
            Collections.shuffle(order, random);
            for (int v : order) {
                int current = community[v];
                Map<Integer, Double> linkWeights = new HashMap<>();
                for (Map.Entry<Integer, Double> edge : adjacency.get(v).entrySet()) {
                    if (edge.getKey() != v) {
                        linkWeights.merge(community[edge.getKey()], edge.getValue(), Double::sum);
                    }
                }
                communityDegree[current] -= degree[v];
                communitySize[current] -= vertexSize[v];

                int best = current;
                double bestGain = linkWeights.getOrDefault(current, 0.0) - communityDegree[current] * degree[v] / totalWeight;
                for (Map.Entry<Integer, Double> link : linkWeights.entrySet()) {
                    int candidate = link.getKey();
                    if (communitySize[candidate] + vertexSize[v] > maxSize) {
                        continue;
                    }
                    double gain = link.getValue() - communityDegree[candidate] * degree[v] / totalWeight;
                    if (gain > bestGain + 1e-12) {
                        bestGain = gain;
                        best = candidate;
                    }
                }
                community[v] = best;
                communityDegree[best] += degree[v];
                communitySize[best] += vertexSize[v];
                if (best != current) {
                    moved = true;
                }
            }
        }
        return community;
    }
}
