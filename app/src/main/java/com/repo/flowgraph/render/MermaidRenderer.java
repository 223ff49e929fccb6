package com.repo.flowgraph.render;

import com.repo.flowgraph.graph.ControlFlowGraph;
import com.repo.flowgraph.graph.Edge;
import com.repo.flowgraph.graph.Node;
import com.repo.flowgraph.graph.NodeFill;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mermaid flowchart output, used by the HTML report.
 */
public class MermaidRenderer implements DiagramRenderer {

    @Override
    public String id() {
        return "mermaid";
    }

    @Override
    public String displayName() {
        return "Mermaid Flowchart";
    }

    @Override
    public String fileExtension() {
        return ".mmd";
    }

    @Override
    public String render(ControlFlowGraph graph, RenderOptions options) {
        RenderOptions renderOptions = options == null ? RenderOptions.topDown() : options;
        StringBuilder builder = new StringBuilder();
        builder.append("flowchart ").append(renderOptions.direction()).append("\n");

        Map<NodeFill, List<String>> byFill = new EnumMap<>(NodeFill.class);
        for (Node node : graph.nodes()) {
            builder.append("  ").append(node.id()).append(nodeShape(node)).append("\n");
            byFill.computeIfAbsent(node.fill(), k -> new ArrayList<>()).add(node.id());
        }
        builder.append("\n");

        for (Edge edge : graph.edges()) {
            builder.append("  ").append(edge.from()).append(formatEdge(edge)).append(edge.to()).append("\n");
        }
        builder.append("\n");

        for (Map.Entry<NodeFill, List<String>> entry : byFill.entrySet()) {
            String className = className(entry.getKey());
            builder.append("  classDef ").append(className)
                    .append(" fill:").append(renderOptions.colorOf(entry.getKey())).append(";\n");
            builder.append("  class ").append(String.join(",", entry.getValue()))
                    .append(" ").append(className).append(";\n");
        }
        return builder.toString();
    }

    private String nodeShape(Node node) {
        String label = escape(node.label());
        return switch (node.shape()) {
            case OVAL -> "([\"%s\"])".formatted(label);
            case DIAMOND -> "{\"%s\"}".formatted(label);
            case POINT -> "((\" \"))";
            case RECTANGLE -> "[\"%s\"]".formatted(label);
        };
    }

    private String formatEdge(Edge edge) {
        if (!edge.label().isPresent()) {
            return " --> ";
        }
        return " -- \"" + edge.label().text() + "\" --> ";
    }

    // "end" is a Mermaid keyword, so class names get a prefix
    private String className(NodeFill fill) {
        String name = fill.name().toLowerCase(Locale.ROOT);
        return "fill" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private String escape(String label) {
        // entity codes first, so the inserted <br/> survives
        return label.replace("\"", "#quot;")
                .replace("<", "#lt;")
                .replace(">", "#gt;")
                .replace("\n", "<br/>");
    }
}
