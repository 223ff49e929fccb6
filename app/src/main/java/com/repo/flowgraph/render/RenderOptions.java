package com.repo.flowgraph.render;

import com.repo.flowgraph.graph.NodeFill;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Layout direction and fill colours shared by all renderers.
 */
public record RenderOptions(String direction, Map<NodeFill, String> colors) {

    public static final Set<String> DIRECTIONS = Set.of("TB", "LR", "BT", "RL");

    public RenderOptions {
        direction = direction == null ? "TB" : direction.toUpperCase();
        if (!DIRECTIONS.contains(direction)) {
            throw new IllegalArgumentException("Unknown direction: " + direction);
        }
        Map<NodeFill, String> merged = new EnumMap<>(defaultColors());
        if (colors != null) {
            merged.putAll(colors);
        }
        colors = Map.copyOf(merged);
    }

    public static RenderOptions topDown() {
        return new RenderOptions("TB", null);
    }

    public String colorOf(NodeFill fill) {
        return colors.get(fill);
    }

    public static Map<NodeFill, String> defaultColors() {
        Map<NodeFill, String> colors = new EnumMap<>(NodeFill.class);
        colors.put(NodeFill.START, "#C8E6C9");
        colors.put(NodeFill.END, "#FFCDD2");
        colors.put(NodeFill.DECISION, "#FFE0B2");
        colors.put(NodeFill.STATEMENT, "#FFFFFF");
        colors.put(NodeFill.CONNECTOR, "#000000");
        return colors;
    }
}
