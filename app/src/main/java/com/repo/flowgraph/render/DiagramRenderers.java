package com.repo.flowgraph.render;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Lookup of the built-in renderers by id.
 */
public final class DiagramRenderers {

    private static final List<DiagramRenderer> RENDERERS = List.of(new DotRenderer(), new MermaidRenderer());

    private DiagramRenderers() {
    }

    public static DiagramRenderer forId(String id) {
        String wanted = id == null ? "" : id.toLowerCase(Locale.ROOT);
        return RENDERERS.stream()
                .filter(r -> r.id().equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown diagram format '" + id + "', expected one of " + ids()));
    }

    public static String ids() {
        return RENDERERS.stream().map(DiagramRenderer::id).collect(Collectors.joining(", "));
    }
}
