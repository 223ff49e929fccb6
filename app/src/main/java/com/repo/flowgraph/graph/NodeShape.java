package com.repo.flowgraph.graph;

/**
 * Visual shape category of a node. Renderers map these to their own grammar.
 */
public enum NodeShape {
    RECTANGLE,
    OVAL,
    DIAMOND,
    POINT
}
