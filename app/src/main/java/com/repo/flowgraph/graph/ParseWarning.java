package com.repo.flowgraph.graph;

import java.util.Objects;

/**
 * Recoverable condition noticed while parsing. The graph is still produced.
 *
 * @param statementIndex zero-based index into the normalized statement lines, not a source line number
 */
public record ParseWarning(Kind kind, int statementIndex, String message) {

    public enum Kind {
        /** Input ended while a consumed '{' line had no matching '}'. */
        MALFORMED_INPUT_END,

        /** The top-level block ended before all lines were read. */
        TRAILING_INPUT_IGNORED
    }

    public ParseWarning {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }

    @Override
    public String toString() {
        return kind + " at statement " + (statementIndex + 1) + ": " + message;
    }
}
