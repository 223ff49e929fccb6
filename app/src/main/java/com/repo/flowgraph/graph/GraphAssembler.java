package com.repo.flowgraph.graph;

import com.repo.flowgraph.core.SyntaxMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only accumulator for nodes and edges. Ids come from a monotonic counter
 * and are never reused; {@link #build} freezes the result.
 */
class GraphAssembler {

    private final LabelFormatter labelFormatter;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private int nodeCounter = 0;

    GraphAssembler(LabelFormatter labelFormatter) {
        this.labelFormatter = labelFormatter;
    }

    Node newNode(String rawLabel, NodeShape shape, NodeFill fill) {
        nodeCounter++;
        String id = "N" + nodeCounter;
        Node node = new Node(id, labelFormatter.format(rawLabel), shape, fill);
        nodes.put(id, node);
        return node;
    }

    void connect(Node from, Node to) {
        connect(from, to, EdgeLabel.NONE);
    }

    void connect(Node from, Node to, EdgeLabel label) {
        if (from == null || to == null) {
            return;
        }
        edges.add(new Edge(from.id(), to.id(), label));
    }

    ControlFlowGraph build(Node entry, Node exit, SyntaxMode mode, List<ParseWarning> warnings) {
        return new ControlFlowGraph(entry.id(), exit.id(), mode,
                new ArrayList<>(nodes.values()), edges, warnings);
    }
}
