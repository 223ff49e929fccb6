package com.repo.flowgraph.metrics;

import com.repo.flowgraph.graph.ControlFlowGraph;

public class NodeCountMetric implements GraphMetric {

    @Override
    public String getName() {
        return GraphMetrics.NODES;
    }

    @Override
    public int calculate(ControlFlowGraph graph) {
        return graph.nodeCount();
    }
}
