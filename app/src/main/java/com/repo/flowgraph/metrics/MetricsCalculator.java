package com.repo.flowgraph.metrics;

import com.repo.flowgraph.graph.ControlFlowGraph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives {@link GraphMetrics} from a finished graph. Stateless.
 */
public class MetricsCalculator {

    private final List<GraphMetric> calculators = List.of(
            new NodeCountMetric(),
            new EdgeCountMetric(),
            new PredicateCountMetric(),
            new CyclomaticComplexityMetric());

    public GraphMetrics calculate(ControlFlowGraph graph) {
        if (graph == null || graph.isEmpty()) {
            return GraphMetrics.empty();
        }

        Map<String, Integer> values = new HashMap<>();
        for (GraphMetric calculator : calculators) {
            values.put(calculator.getName(), calculator.calculate(graph));
        }

        return GraphMetrics.of(
                values.get(GraphMetrics.NODES),
                values.get(GraphMetrics.EDGES),
                values.get(GraphMetrics.COMPLEXITY),
                values.get(GraphMetrics.PREDICATES));
    }
}
