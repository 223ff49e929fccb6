package com.repo.flowgraph.normalize;

import com.repo.flowgraph.core.SyntaxMode;

import java.util.List;
import java.util.Objects;

/**
 * Trimmed, non-empty statement lines plus the syntax mode they were read in.
 */
public record NormalizedSource(SyntaxMode mode, List<String> lines) {
    public NormalizedSource {
        Objects.requireNonNull(mode, "mode");
        lines = List.copyOf(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
