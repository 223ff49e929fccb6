package com.repo.flowgraph.graph;

/**
 * Fill category of a node. Return statements reuse {@link #END} so they read as exits.
 */
public enum NodeFill {
    START,
    END,
    DECISION,
    STATEMENT,
    CONNECTOR
}
