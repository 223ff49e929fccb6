package com.repo.flowgraph.report;

import com.repo.flowgraph.metrics.GraphMetrics;
import com.repo.flowgraph.pipeline.PipelineResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class CsvReporter {

    static final String HEADER = "Source,Mode,Nodes,Edges,Complexity,Predicates,Regions,Warnings,Status";

    public void generate(List<PipelineResult> results, Path outputPath) {
        try {
            Files.writeString(outputPath, toCsv(results));
            System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
        } catch (IOException e) {
            System.err.println("Could not write CSV report " + outputPath + ": " + e.getMessage());
        }
    }

    String toCsv(List<PipelineResult> results) {
        StringBuilder csv = new StringBuilder();
        csv.append(HEADER).append("\n");

        for (PipelineResult r : results) {
            GraphMetrics m = r.metrics();
            String mode = r.graphIfPresent().map(g -> g.mode().name()).orElse("");
            csv.append(String.format("%s,%s,%d,%d,%d,%d,%d,%d,%s\n",
                    escape(r.sourceName()),
                    mode,
                    m.nodes(),
                    m.edges(),
                    m.complexity(),
                    m.predicates(),
                    m.regions(),
                    r.warnings().size(),
                    r.isSuccess() ? "OK" : escape(r.error())));
        }
        return csv.toString();
    }

    private String escape(String s) {
        if (s == null)
            return "";
        // Quote fields containing separators, doubling embedded quotes
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
