package com.repo.flowgraph.metrics;

import com.repo.flowgraph.graph.ControlFlowGraph;

public interface GraphMetric {
    String getName();
    int calculate(ControlFlowGraph graph);
}
