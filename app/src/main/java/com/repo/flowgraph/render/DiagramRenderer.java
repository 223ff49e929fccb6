package com.repo.flowgraph.render;

import com.repo.flowgraph.graph.ControlFlowGraph;

/**
 * Turns a graph into diagram source text for an external layout engine.
 */
public interface DiagramRenderer {
    String id();

    String displayName();

    /**
     * File extension for the rendered text, including the leading dot.
     */
    String fileExtension();

    String render(ControlFlowGraph graph, RenderOptions options);
}
