package com.repo.flowgraph.pipeline;

import com.repo.flowgraph.core.FlowgraphConfig;
import com.repo.flowgraph.graph.CfgBuilder;
import com.repo.flowgraph.graph.ControlFlowGraph;
import com.repo.flowgraph.metrics.GraphMetrics;
import com.repo.flowgraph.metrics.MetricsCalculator;
import com.repo.flowgraph.normalize.NormalizedSource;
import com.repo.flowgraph.normalize.SourceNormalizer;
import com.repo.flowgraph.render.DiagramRenderer;
import com.repo.flowgraph.render.DiagramRenderers;
import com.repo.flowgraph.render.RenderOptions;

/**
 * Runs text through normalize, build, measure and render.
 *
 * <p>This is the boundary around the core: every failure raised by any stage is
 * caught here and returned as a failed {@link PipelineResult} instead of propagating.
 * One builder is reused across runs, so a pipeline must not be shared between threads.
 */
public class FlowgraphPipeline {

    private final SourceNormalizer normalizer;
    private final CfgBuilder builder;
    private final MetricsCalculator metricsCalculator;
    private final DiagramRenderer renderer;
    private final RenderOptions renderOptions;

    public FlowgraphPipeline(FlowgraphConfig config) {
        this(new SourceNormalizer(), config.newBuilder(), new MetricsCalculator(),
                DiagramRenderers.forId(config.getRenderFormat()), config.renderOptions());
    }

    public FlowgraphPipeline(SourceNormalizer normalizer, CfgBuilder builder, MetricsCalculator metricsCalculator,
            DiagramRenderer renderer, RenderOptions renderOptions) {
        this.normalizer = normalizer;
        this.builder = builder;
        this.metricsCalculator = metricsCalculator;
        this.renderer = renderer;
        this.renderOptions = renderOptions;
    }

    public PipelineResult run(String sourceName, String text) {
        try {
            NormalizedSource source = normalizer.normalize(text);
            ControlFlowGraph graph = builder.parse(source);
            GraphMetrics metrics = metricsCalculator.calculate(graph);
            String diagram = renderer.render(graph, renderOptions);
            return PipelineResult.success(sourceName, text, graph, metrics, diagram);
        } catch (RuntimeException e) {
            return PipelineResult.failure(sourceName, text, "Error: " + describe(e));
        }
    }

    public DiagramRenderer renderer() {
        return renderer;
    }

    private String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
