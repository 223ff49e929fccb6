package com.repo.flowgraph.graph;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward-only position over the normalized lines. {@link #peek()} looks at the
 * current line without consuming it; nothing ever moves the position backwards.
 */
public final class LineCursor {

    private final List<String> lines;
    private int position = 0;

    public LineCursor(List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    public boolean hasNext() {
        return position < lines.size();
    }

    public String peek() {
        if (!hasNext()) {
            throw new NoSuchElementException("no line at index " + position);
        }
        return lines.get(position);
    }

    /**
     * Consumes the current line and returns it.
     */
    public String advance() {
        String line = peek();
        position++;
        return line;
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return lines.size() - position;
    }
}
