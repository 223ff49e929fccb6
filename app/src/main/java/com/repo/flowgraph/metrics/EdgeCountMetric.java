package com.repo.flowgraph.metrics;

import com.repo.flowgraph.graph.ControlFlowGraph;

public class EdgeCountMetric implements GraphMetric {

    @Override
    public String getName() {
        return GraphMetrics.EDGES;
    }

    @Override
    public int calculate(ControlFlowGraph graph) {
        // parallel edges count individually
        return graph.edgeCount();
    }
}
