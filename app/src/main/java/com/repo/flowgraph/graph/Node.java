package com.repo.flowgraph.graph;

import java.util.Objects;
import java.util.Optional;

/**
 * A single vertex of the control-flow graph. Created once by the builder, never mutated.
 */
public record Node(String id, String label, NodeShape shape, NodeFill fill) {
    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(fill, "fill");
        label = Optional.ofNullable(label).orElse("");
    }

    public boolean isDecision() {
        return shape == NodeShape.DIAMOND;
    }
}
