package com.repo.flowgraph.graph;

import com.repo.flowgraph.core.SyntaxMode;
import com.repo.flowgraph.normalize.NormalizedSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a control-flow graph from normalized statement lines.
 *
 * <p>The parser is a recursive descent over lines rather than tokens. Each call to
 * {@link #parseBlock} threads a single predecessor node through a run of lines and
 * returns the node that should receive the next edge. Consecutive plain statements
 * are coalesced into one basic block.
 *
 * <p>Block ends:
 * <ul>
 * <li>a line starting with {@code elif} or {@code else} ends the block <em>without</em>
 * being consumed, so the enclosing conditional chain can pick it up;</li>
 * <li>a bare closing brace line in brace mode is consumed and ends the block;</li>
 * <li>a {@code return} line is consumed and ends the block immediately;</li>
 * <li>end of input.</li>
 * </ul>
 *
 * <p>A builder may be reused sequentially; every {@link #parse} call starts from a
 * fresh {@link ParseContext}. It is not safe to share one builder between threads.
 */
public class CfgBuilder {

    static final String START_LABEL = "START";
    static final String END_LABEL = "END";
    static final String EXIT_LOOP_LABEL = "Exit Loop";
    static final String ELSE_LABEL = "Else";
    static final String MERGE_LABEL = "Merge";

    private final LabelFormatter labelFormatter;
    private final String statementSeparator;

    public CfgBuilder() {
        this(LabelFormatter.defaults(), "\n");
    }

    public CfgBuilder(LabelFormatter labelFormatter, String statementSeparator) {
        this.labelFormatter = Objects.requireNonNull(labelFormatter, "labelFormatter");
        this.statementSeparator = Objects.requireNonNull(statementSeparator, "statementSeparator");
    }

    public ControlFlowGraph parse(NormalizedSource source) {
        return parse(source.lines(), source.mode());
    }

    public ControlFlowGraph parse(List<String> lines, SyntaxMode mode) {
        ParseContext context = new ParseContext(lines, mode, labelFormatter, statementSeparator);
        GraphAssembler graph = context.assembler();

        Node start = graph.newNode(START_LABEL, NodeShape.OVAL, NodeFill.START);
        Node last = parseBlock(context, start);

        if (context.cursor().hasNext()) {
            int unread = context.cursor().remaining();
            context.warn(ParseWarning.Kind.TRAILING_INPUT_IGNORED,
                    unread + " line(s) after '" + context.cursor().peek() + "' are not part of the graph");
        } else {
            context.outermostUnclosedBrace().ifPresent(index -> context.warn(
                    ParseWarning.Kind.MALFORMED_INPUT_END, index,
                    "end of input reached while the '{' opened here was still unclosed"));
        }

        Node end = graph.newNode(END_LABEL, NodeShape.OVAL, NodeFill.END);
        graph.connect(last, end);

        return graph.build(start, end, mode, context.warnings());
    }

    /**
     * Parses lines until the current block ends and returns its exit node.
     *
     * @param context state of the running parse; its cursor is advanced past every consumed line
     * @param entry   node the first statement of the block is connected from
     * @return the node the next construct should be connected from
     */
    Node parseBlock(ParseContext context, Node entry) {
        LineCursor cursor = context.cursor();
        GraphAssembler graph = context.assembler();
        StatementBuffer buffer = new StatementBuffer();
        Node current = entry;

        while (cursor.hasNext()) {
            String line = cursor.peek();

            if (startsBranchContinuation(line)) {
                return flush(context, buffer, current);
            }

            if (context.isBraceMode() && line.equals("}")) {
                current = flush(context, buffer, current);
                context.closeBrace();
                cursor.advance();
                return current;
            }

            if (context.isBraceMode() && line.equals("{")) {
                context.openBrace();
                cursor.advance();
                continue;
            }

            if (line.startsWith("for") || line.startsWith("while")) {
                current = flush(context, buffer, current);
                current = parseLoop(context, current);
            } else if (line.startsWith("if")) {
                current = flush(context, buffer, current);
                current = parseConditional(context, current);
            } else if (line.startsWith("return")) {
                current = flush(context, buffer, current);
                Node ret = graph.newNode(line, NodeShape.RECTANGLE, NodeFill.END);
                graph.connect(current, ret);
                cursor.advance();
                return ret;
            } else {
                buffer.add(line);
                cursor.advance();
            }
        }

        return flush(context, buffer, current);
    }

    private Node parseLoop(ParseContext context, Node predecessor) {
        GraphAssembler graph = context.assembler();

        Node header = graph.newNode(context.cursor().peek(), NodeShape.DIAMOND, NodeFill.DECISION);
        graph.connect(predecessor, header);
        context.cursor().advance();

        Node bodyExit = parseBlock(context, header);
        // added even when the body ended in a return
        graph.connect(bodyExit, header, EdgeLabel.LOOP);

        Node exit = graph.newNode(EXIT_LOOP_LABEL, NodeShape.POINT, NodeFill.CONNECTOR);
        graph.connect(header, exit, EdgeLabel.FALSE);
        return exit;
    }

    private Node parseConditional(ParseContext context, Node predecessor) {
        LineCursor cursor = context.cursor();
        GraphAssembler graph = context.assembler();
        List<Node> branchExits = new ArrayList<>();

        Node condition = graph.newNode(cursor.peek(), NodeShape.DIAMOND, NodeFill.DECISION);
        graph.connect(predecessor, condition);
        cursor.advance();
        branchExits.add(parseBlock(context, condition));

        Node lastDecision = condition;
        boolean closedByElse = false;

        while (cursor.hasNext()) {
            String next = cursor.peek();
            if (next.startsWith("elif") || next.startsWith("else if")) {
                cursor.advance();
                Node elif = graph.newNode(next, NodeShape.DIAMOND, NodeFill.DECISION);
                graph.connect(lastDecision, elif, EdgeLabel.FALSE);
                branchExits.add(parseBlock(context, elif));
                lastDecision = elif;
            } else if (next.startsWith("else")) {
                cursor.advance();
                Node elseStart = graph.newNode(ELSE_LABEL, NodeShape.POINT, NodeFill.CONNECTOR);
                graph.connect(lastDecision, elseStart, EdgeLabel.FALSE);
                branchExits.add(parseBlock(context, elseStart));
                closedByElse = true;
                break;
            } else {
                break;
            }
        }

        Node merge = graph.newNode(MERGE_LABEL, NodeShape.POINT, NodeFill.CONNECTOR);
        // a branch that ended in a return still feeds the merge
        for (Node exit : branchExits) {
            graph.connect(exit, merge);
        }
        if (!closedByElse) {
            graph.connect(lastDecision, merge, EdgeLabel.FALSE);
        }
        return merge;
    }

    private Node flush(ParseContext context, StatementBuffer buffer, Node current) {
        if (buffer.isEmpty()) {
            return current;
        }
        GraphAssembler graph = context.assembler();
        Node block = graph.newNode(buffer.drain(context.statementSeparator()), NodeShape.RECTANGLE, NodeFill.STATEMENT);
        graph.connect(current, block);
        return block;
    }

    private static boolean startsBranchContinuation(String line) {
        return line.startsWith("elif") || line.startsWith("else");
    }
}
