package com.repo.flowgraph.metrics;

import com.repo.flowgraph.graph.ControlFlowGraph;

/**
 * McCabe complexity of a single-entry, single-exit graph: E - N + 2.
 */
public class CyclomaticComplexityMetric implements GraphMetric {

    @Override
    public String getName() {
        return GraphMetrics.COMPLEXITY;
    }

    @Override
    public int calculate(ControlFlowGraph graph) {
        return graph.edgeCount() - graph.nodeCount() + 2;
    }
}
