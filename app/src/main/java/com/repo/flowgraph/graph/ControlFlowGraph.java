package com.repo.flowgraph.graph;

import com.repo.flowgraph.core.SyntaxMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finished, read-only control-flow graph. Nodes and edges keep creation order.
 */
public record ControlFlowGraph(
        String entryId,
        String exitId,
        SyntaxMode mode,
        List<Node> nodes,
        List<Edge> edges,
        List<ParseWarning> warnings) {

    public ControlFlowGraph {
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(exitId, "exitId");
        Objects.requireNonNull(mode, "mode");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<Node> findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public int outDegree(String id) {
        return (int) edges.stream().filter(e -> e.from().equals(id)).count();
    }

    public int inDegree(String id) {
        return (int) edges.stream().filter(e -> e.to().equals(id)).count();
    }

    /**
     * Outgoing edges of a node, in creation order.
     */
    public List<Edge> outgoing(String id) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges) {
            if (e.from().equals(id)) {
                out.add(e);
            }
        }
        return out;
    }

    public List<Node> nodesWithLabel(String label) {
        return nodes.stream().filter(n -> n.label().equals(label)).toList();
    }
}
