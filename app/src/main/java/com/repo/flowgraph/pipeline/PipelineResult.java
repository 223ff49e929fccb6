package com.repo.flowgraph.pipeline;

import com.repo.flowgraph.graph.ControlFlowGraph;
import com.repo.flowgraph.graph.ParseWarning;
import com.repo.flowgraph.metrics.GraphMetrics;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running one input through the pipeline: either a graph with metrics
 * and rendered diagram text, or a readable failure message.
 */
public record PipelineResult(
        /** Name shown for the input, e.g. a file name or "stdin" */
        String sourceName,

        /** Raw input text as given */
        String sourceText,

        /** Graph, null when the run failed */
        ControlFlowGraph graph,

        /** Metrics, {@link GraphMetrics#empty()} when the run failed */
        GraphMetrics metrics,

        /** Rendered diagram text, empty when the run failed */
        String diagram,

        /** Failure message, null on success */
        String error) {

    public PipelineResult {
        Objects.requireNonNull(sourceName, "sourceName");
        sourceText = sourceText == null ? "" : sourceText;
        metrics = metrics == null ? GraphMetrics.empty() : metrics;
        diagram = diagram == null ? "" : diagram;
    }

    public static PipelineResult success(String sourceName, String sourceText, ControlFlowGraph graph,
            GraphMetrics metrics, String diagram) {
        return new PipelineResult(sourceName, sourceText, graph, metrics, diagram, null);
    }

    public static PipelineResult failure(String sourceName, String sourceText, String error) {
        return new PipelineResult(sourceName, sourceText, null, GraphMetrics.empty(), "", error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<ControlFlowGraph> graphIfPresent() {
        return Optional.ofNullable(graph);
    }

    public List<ParseWarning> warnings() {
        return graph == null ? List.of() : graph.warnings();
    }
}
