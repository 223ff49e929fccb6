package com.repo.flowgraph.graph;

import com.repo.flowgraph.core.SyntaxMode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/**
 * All mutable state of one parse: the line cursor, the graph being assembled,
 * the brace lines still waiting for their match and the warnings collected so far. A fresh context is created
 * for every {@link CfgBuilder#parse} call and handed explicitly to each recursive
 * block parse.
 */
public final class ParseContext {

    private final LineCursor cursor;
    private final GraphAssembler assembler;
    private final SyntaxMode mode;
    private final String statementSeparator;
    private final List<ParseWarning> warnings = new ArrayList<>();
    // statement indexes of consumed '{' lines not yet matched by a '}', innermost first
    private final Deque<Integer> openBraces = new ArrayDeque<>();

    ParseContext(List<String> lines, SyntaxMode mode, LabelFormatter labelFormatter, String statementSeparator) {
        this.cursor = new LineCursor(lines);
        this.assembler = new GraphAssembler(labelFormatter);
        this.mode = mode;
        this.statementSeparator = statementSeparator;
    }

    public LineCursor cursor() {
        return cursor;
    }

    public List<ParseWarning> warnings() {
        return List.copyOf(warnings);
    }

    GraphAssembler assembler() {
        return assembler;
    }

    String statementSeparator() {
        return statementSeparator;
    }

    boolean isBraceMode() {
        return mode == SyntaxMode.BRACE;
    }

    void openBrace() {
        openBraces.push(cursor.position());
    }

    /** A '}' with no open '{' left is a stray brace and is not counted. */
    void closeBrace() {
        openBraces.poll();
    }

    /** Statement index of the outermost '{' that was never closed, if any. */
    OptionalInt outermostUnclosedBrace() {
        return openBraces.isEmpty() ? OptionalInt.empty() : OptionalInt.of(openBraces.peekLast());
    }

    void warn(ParseWarning.Kind kind, String message) {
        warn(kind, cursor.position(), message);
    }

    void warn(ParseWarning.Kind kind, int statementIndex, String message) {
        warnings.add(new ParseWarning(kind, statementIndex, message));
    }
}
