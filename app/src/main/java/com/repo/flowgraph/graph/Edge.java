package com.repo.flowgraph.graph;

import java.util.Objects;
import java.util.Optional;

/**
 * Directed edge between two node ids. Parallel edges between the same pair are legal.
 */
public record Edge(String from, String to, EdgeLabel label) {
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        label = Optional.ofNullable(label).orElse(EdgeLabel.NONE);
    }

    public Edge(String from, String to) {
        this(from, to, EdgeLabel.NONE);
    }
}
