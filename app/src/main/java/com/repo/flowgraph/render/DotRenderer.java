package com.repo.flowgraph.render;

import com.repo.flowgraph.graph.ControlFlowGraph;
import com.repo.flowgraph.graph.Edge;
import com.repo.flowgraph.graph.Node;
import com.repo.flowgraph.graph.NodeShape;

/**
 * Graphviz DOT output. Nodes are filled with the colour of their fill category and
 * edges carry their "False"/"Loop" labels.
 */
public class DotRenderer implements DiagramRenderer {

    @Override
    public String id() {
        return "dot";
    }

    @Override
    public String displayName() {
        return "Graphviz DOT";
    }

    @Override
    public String fileExtension() {
        return ".dot";
    }

    @Override
    public String render(ControlFlowGraph graph, RenderOptions options) {
        RenderOptions renderOptions = options == null ? RenderOptions.topDown() : options;
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"cfg\" {\n");
        dot.append("  rankdir=").append(renderOptions.direction()).append(";\n");
        dot.append("  node [style=filled];\n");

        for (Node node : graph.nodes()) {
            dot.append("  ").append(node.id())
                    .append(" [label=\"").append(escape(node.label())).append("\"")
                    .append(", shape=").append(shapeOf(node.shape()))
                    .append(", fillcolor=\"").append(renderOptions.colorOf(node.fill())).append("\"")
                    .append("];\n");
        }

        for (Edge edge : graph.edges()) {
            dot.append("  ").append(edge.from()).append(" -> ").append(edge.to());
            if (edge.label().isPresent()) {
                dot.append(" [label=\"").append(edge.label().text()).append("\"]");
            }
            dot.append(";\n");
        }

        dot.append("}\n");
        return dot.toString();
    }

    private String shapeOf(NodeShape shape) {
        return switch (shape) {
            case RECTANGLE -> "box";
            case OVAL -> "oval";
            case DIAMOND -> "diamond";
            case POINT -> "point";
        };
    }

    private String escape(String label) {
        return label.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }
}
