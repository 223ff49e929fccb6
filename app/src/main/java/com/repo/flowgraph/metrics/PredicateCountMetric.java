package com.repo.flowgraph.metrics;

import com.repo.flowgraph.graph.ControlFlowGraph;
import com.repo.flowgraph.graph.Edge;

import java.util.HashMap;
import java.util.Map;

/**
 * Number of nodes with more than one outgoing edge.
 */
public class PredicateCountMetric implements GraphMetric {

    @Override
    public String getName() {
        return GraphMetrics.PREDICATES;
    }

    @Override
    public int calculate(ControlFlowGraph graph) {
        Map<String, Integer> outDegree = new HashMap<>();
        for (Edge edge : graph.edges()) {
            outDegree.merge(edge.from(), 1, Integer::sum);
        }
        return (int) outDegree.values().stream().filter(d -> d > 1).count();
    }
}
