package com.repo.flowgraph.metrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Complexity figures of one control-flow graph. Regions is reported as an alias of
 * Complexity.
 */
public record GraphMetrics(
        int nodes,
        int edges,
        int complexity,
        int predicates,
        int regions,
        boolean isEmpty) {

    public static final String NODES = "Nodes";
    public static final String EDGES = "Edges";
    public static final String COMPLEXITY = "Complexity";
    public static final String PREDICATES = "Predicates";
    public static final String REGIONS = "Regions";

    private static final GraphMetrics EMPTY = new GraphMetrics(0, 0, 0, 0, 0, true);

    public static GraphMetrics of(int nodes, int edges, int complexity, int predicates) {
        return new GraphMetrics(nodes, edges, complexity, predicates, complexity, false);
    }

    /**
     * Metrics of a missing or node-less graph.
     */
    public static GraphMetrics empty() {
        return EMPTY;
    }

    /**
     * Named values in display order; empty for {@link #empty()}.
     */
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        if (isEmpty) {
            return map;
        }
        map.put(NODES, nodes);
        map.put(EDGES, edges);
        map.put(COMPLEXITY, complexity);
        map.put(PREDICATES, predicates);
        map.put(REGIONS, regions);
        return map;
    }
}
