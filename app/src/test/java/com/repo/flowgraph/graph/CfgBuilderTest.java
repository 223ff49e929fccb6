package com.repo.flowgraph.graph;

import com.repo.flowgraph.core.SyntaxMode;
import com.repo.flowgraph.normalize.SourceNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CfgBuilderTest {

    private final SourceNormalizer normalizer = new SourceNormalizer();
    private final CfgBuilder builder = new CfgBuilder();

    private ControlFlowGraph build(String text) {
        return builder.parse(normalizer.normalize(text));
    }

    private Node single(ControlFlowGraph graph, String label) {
        List<Node> matches = graph.nodesWithLabel(label);
        assertEquals(1, matches.size(), "Expected exactly one node labelled '" + label + "'");
        return matches.get(0);
    }

    private boolean hasEdge(ControlFlowGraph graph, Node from, Node to, EdgeLabel label) {
        return graph.edges().contains(new Edge(from.id(), to.id(), label));
    }

    @Test
    void testSequentialStatementsCoalesceIntoOneBlock() {
        ControlFlowGraph graph = build("a\nb\nc");

        assertEquals(3, graph.nodeCount());
        assertEquals(2, graph.edgeCount());
        Node block = single(graph, "a\nb\nc");
        assertEquals(NodeShape.RECTANGLE, block.shape());
        assertEquals(NodeFill.STATEMENT, block.fill());

        Node start = graph.findNode(graph.entryId()).orElseThrow();
        Node end = graph.findNode(graph.exitId()).orElseThrow();
        assertEquals("START", start.label());
        assertEquals(NodeShape.OVAL, start.shape());
        assertEquals(NodeFill.START, start.fill());
        assertEquals("END", end.label());
        assertEquals(NodeFill.END, end.fill());
        assertTrue(hasEdge(graph, start, block, EdgeLabel.NONE));
        assertTrue(hasEdge(graph, block, end, EdgeLabel.NONE));
    }

    @Test
    void testEmptyInputConnectsStartToEnd() {
        ControlFlowGraph graph = build("");

        assertEquals(2, graph.nodeCount());
        assertEquals(List.of(new Edge(graph.entryId(), graph.exitId())), graph.edges());
        assertTrue(graph.warnings().isEmpty());
    }

    @Test
    void testIfElseInIndentationMode() {
        ControlFlowGraph graph = build("""
                if x > 0:
                    a
                else:
                    b
                """);

        Node decision = single(graph, "if x > 0:");
        Node a = single(graph, "a");
        Node elseNode = single(graph, "Else");
        Node b = single(graph, "b");
        Node merge = single(graph, "Merge");

        assertEquals(NodeShape.DIAMOND, decision.shape());
        assertEquals(NodeShape.POINT, elseNode.shape());
        assertEquals(NodeFill.CONNECTOR, merge.fill());

        assertTrue(hasEdge(graph, decision, a, EdgeLabel.NONE), "True branch is unlabelled");
        assertTrue(hasEdge(graph, decision, elseNode, EdgeLabel.FALSE));
        assertTrue(hasEdge(graph, elseNode, b, EdgeLabel.NONE));
        assertTrue(hasEdge(graph, a, merge, EdgeLabel.NONE));
        assertTrue(hasEdge(graph, b, merge, EdgeLabel.NONE));
        assertFalse(hasEdge(graph, decision, merge, EdgeLabel.FALSE), "Else closes the chain");
        assertEquals(graph.exitId(), graph.outgoing(merge.id()).get(0).to());

        assertEquals(7, graph.nodeCount());
        assertEquals(7, graph.edgeCount());
    }

    @Test
    void testElifChainLinksDecisionsByFalseEdges() {
        ControlFlowGraph graph = build("""
                x = 10
                if x > 100:
                    print("Huge")
                elif x > 50:
                    print("Big")
                elif x > 10:
                    print("Medium")
                else:
                    print("Small")
                """);

        Node ifNode = single(graph, "if x > 100:");
        Node elif1 = single(graph, "elif x > 50:");
        Node elif2 = single(graph, "elif x > 10:");
        Node elseNode = single(graph, "Else");
        Node merge = single(graph, "Merge");

        assertEquals(3, graph.nodes().stream().filter(Node::isDecision).count());
        assertTrue(hasEdge(graph, ifNode, elif1, EdgeLabel.FALSE));
        assertTrue(hasEdge(graph, elif1, elif2, EdgeLabel.FALSE));
        assertTrue(hasEdge(graph, elif2, elseNode, EdgeLabel.FALSE));

        for (String branch : List.of("print('Huge')", "print('Big')", "print('Medium')", "print('Small')")) {
            assertTrue(hasEdge(graph, single(graph, branch), merge, EdgeLabel.NONE), branch + " feeds the merge");
        }
        assertEquals(4, graph.inDegree(merge.id()));
        assertEquals(1, graph.nodesWithLabel("Merge").size());
    }

    @Test
    void testIfWithoutElseLeavesFalseEdgeToMerge() {
        ControlFlowGraph graph = build("""
                if a:
                    x
                elif b:
                    y
                """);

        Node elif = single(graph, "elif b:");
        Node merge = single(graph, "Merge");
        assertTrue(hasEdge(graph, elif, merge, EdgeLabel.FALSE), "Last open decision falls through to the merge");
        assertFalse(hasEdge(graph, single(graph, "if a:"), merge, EdgeLabel.FALSE));
        assertEquals(3, graph.inDegree(merge.id()));
    }

    @Test
    void testEmptyTrueBranchProducesParallelEdges() {
        ControlFlowGraph graph = build("if x:");

        Node decision = single(graph, "if x:");
        Node merge = single(graph, "Merge");
        List<Edge> out = graph.outgoing(decision.id());

        assertEquals(List.of(new Edge(decision.id(), merge.id(), EdgeLabel.NONE),
                new Edge(decision.id(), merge.id(), EdgeLabel.FALSE)), out);
    }

    @Test
    void testWhileLoopHasBackEdgeAndExit() {
        ControlFlowGraph graph = build("""
                while x:
                    a
                """);

        Node header = single(graph, "while x:");
        Node body = single(graph, "a");
        Node exit = single(graph, "Exit Loop");

        assertEquals(NodeShape.DIAMOND, header.shape());
        assertEquals(NodeShape.POINT, exit.shape());
        assertTrue(hasEdge(graph, header, body, EdgeLabel.NONE));
        assertTrue(hasEdge(graph, body, header, EdgeLabel.LOOP));
        assertTrue(hasEdge(graph, header, exit, EdgeLabel.FALSE));
        assertEquals(graph.exitId(), graph.outgoing(exit.id()).get(0).to());
    }

    @Test
    void testLoopExitIsPredecessorOfFollowingStatements() {
        ControlFlowGraph graph = build("while (x) { a; } b;");

        Node exit = single(graph, "Exit Loop");
        Node after = single(graph, "b;");
        assertTrue(hasEdge(graph, exit, after, EdgeLabel.NONE));
        assertEquals(6, graph.nodeCount());
    }

    @Test
    void testLoopBackEdgeAddedAfterEarlyReturn() {
        ControlFlowGraph graph = build("""
                for item in items:
                    return item
                """);

        Node header = single(graph, "for item in items:");
        Node ret = single(graph, "return item");
        assertTrue(hasEdge(graph, ret, header, EdgeLabel.LOOP));
        assertEquals(NodeFill.END, ret.fill(), "Return statements use the highlighted fill");
    }

    @Test
    void testEmptyLoopBodyLoopsOnHeader() {
        ControlFlowGraph graph = build("while True:");

        Node header = single(graph, "while True:");
        assertTrue(hasEdge(graph, header, header, EdgeLabel.LOOP));
    }

    @Test
    void testReturnInsideBranchStillFeedsMerge() {
        ControlFlowGraph graph = build("""
                if x:
                    return 1
                else:
                    b
                """);

        Node ret = single(graph, "return 1");
        Node merge = single(graph, "Merge");
        assertTrue(hasEdge(graph, ret, merge, EdgeLabel.NONE));
        assertEquals(NodeShape.RECTANGLE, ret.shape());
    }

    @Test
    void testReturnEndsBlockAndLaterLinesAreReported() {
        ControlFlowGraph graph = build("""
                a
                return a
                b
                """);

        assertTrue(graph.nodesWithLabel("b").isEmpty(), "Lines after a top-level return are not graphed");
        assertEquals(1, graph.warnings().size());
        ParseWarning warning = graph.warnings().get(0);
        assertEquals(ParseWarning.Kind.TRAILING_INPUT_IGNORED, warning.kind());
        assertEquals(2, warning.statementIndex());
        assertTrue(warning.toString().startsWith("TRAILING_INPUT_IGNORED at statement 3: "), warning.toString());
    }

    @Test
    void testBraceModeElseIfChain() {
        ControlFlowGraph graph = build("""
                int x = 10;
                if (x > 5) {
                    y = 1;
                } else if (x > 2) {
                    y = 2;
                } else {
                    y = 3;
                }
                z = y;
                """);

        assertEquals(SyntaxMode.BRACE, graph.mode());
        Node ifNode = single(graph, "if (x > 5)");
        Node elif = single(graph, "elif (x > 2)");
        Node merge = single(graph, "Merge");
        Node after = single(graph, "z = y;");

        assertTrue(hasEdge(graph, ifNode, elif, EdgeLabel.FALSE));
        assertTrue(hasEdge(graph, merge, after, EdgeLabel.NONE));
        assertEquals(11, graph.nodeCount());
        assertEquals(12, graph.edgeCount());
        assertTrue(graph.warnings().isEmpty());
    }

    @Test
    void testBraceModeReturnInBranchStopsAtClosingBrace() {
        ControlFlowGraph graph = build("if (a) { return 1; } b;");

        Node ret = single(graph, "return 1;");
        Node merge = single(graph, "Merge");
        assertTrue(hasEdge(graph, ret, merge, EdgeLabel.NONE));
        assertTrue(graph.nodesWithLabel("b;").isEmpty(),
                "The branch's closing brace ends the enclosing block");
        assertEquals(ParseWarning.Kind.TRAILING_INPUT_IGNORED, graph.warnings().get(0).kind());
        assertEquals(5, graph.nodeCount());
    }

    @Test
    void testMissingClosingBraceIsWarnedNotFailed() {
        ControlFlowGraph graph = build("if (a) { b; } while (c) { d;");

        Node header = single(graph, "while (c)");
        Node body = single(graph, "d;");
        assertTrue(hasEdge(graph, body, header, EdgeLabel.LOOP));
        assertEquals(1, graph.warnings().size());
        ParseWarning warning = graph.warnings().get(0);
        assertEquals(ParseWarning.Kind.MALFORMED_INPUT_END, warning.kind());
        assertEquals(5, warning.statementIndex(), "Points at the '{' opened after 'while (c)'");
    }

    @Test
    void testNestedUnclosedBracesWarnOnce() {
        ControlFlowGraph graph = build("while (a) { if (b) { c;");

        assertEquals(1, graph.warnings().size());
        ParseWarning warning = graph.warnings().get(0);
        assertEquals(ParseWarning.Kind.MALFORMED_INPUT_END, warning.kind());
        assertEquals(1, warning.statementIndex(), "Points at the outermost unclosed '{'");
    }

    @Test
    void testUnbracedElseAfterBracedIfIsNotMalformed() {
        ControlFlowGraph graph = build("if (a) { x; } else y;");

        Node elseStart = single(graph, "Else");
        Node y = single(graph, "y;");
        Node merge = single(graph, "Merge");
        assertTrue(hasEdge(graph, elseStart, y, EdgeLabel.NONE));
        assertTrue(hasEdge(graph, y, merge, EdgeLabel.NONE));
        assertTrue(graph.warnings().isEmpty(), graph.warnings().toString());
    }

    @Test
    void testUnbracedLoopBodyAtEndOfInputIsNotMalformed() {
        ControlFlowGraph graph = build("if (a) { b; } while (c) d;");

        Node header = single(graph, "while (c) d;");
        assertEquals(NodeShape.DIAMOND, header.shape());
        assertTrue(graph.warnings().isEmpty(), graph.warnings().toString());
    }

    @Test
    void testElseIfIsAnElifInIndentationMode() {
        ControlFlowGraph graph = build("""
                if a:
                    x
                else if b:
                    y
                """);

        assertTrue(single(graph, "else if b:").isDecision());
        assertTrue(graph.nodesWithLabel("Else").isEmpty());
    }

    @Test
    void testKeywordsAreCaseSensitivePrefixes() {
        ControlFlowGraph graph = build("If x\nWhile y");

        assertEquals(3, graph.nodeCount(), "Capitalised keywords are plain statements");
        single(graph, "If x\nWhile y");
    }

    @Test
    void testLongLabelsAreShortened() {
        String longLine = "result = compute_something_long(alpha, beta, gamma)";
        ControlFlowGraph graph = build(longLine);

        Node block = graph.nodes().get(1);
        assertEquals("result = compute_som...a, beta, gamma)", block.label());
    }

    @Test
    void testReusedBuilderStartsFresh() {
        ControlFlowGraph first = build("while x:\n  a");
        ControlFlowGraph second = build("while x:\n  a");

        assertEquals(first, second);
        assertEquals("N1", second.entryId());
    }

    @Test
    void testIdsAreUniqueAndSequential() {
        ControlFlowGraph graph = build("if a:\n x\nelse:\n y");

        for (int i = 0; i < graph.nodeCount(); i++) {
            assertEquals("N" + (i + 1), graph.nodes().get(i).id());
        }
    }

    @Test
    void testCustomSeparatorJoinsStatements() {
        CfgBuilder custom = new CfgBuilder(LabelFormatter.defaults(), "; ");
        ControlFlowGraph graph = custom.parse(List.of("a", "b"), SyntaxMode.INDENTATION);

        assertEquals(1, graph.nodesWithLabel("a; b").size());
    }
}
