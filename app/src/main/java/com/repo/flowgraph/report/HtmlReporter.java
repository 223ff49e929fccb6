package com.repo.flowgraph.report;

import com.repo.flowgraph.graph.ParseWarning;
import com.repo.flowgraph.metrics.GraphMetrics;
import com.repo.flowgraph.pipeline.PipelineResult;
import com.repo.flowgraph.render.MermaidRenderer;
import com.repo.flowgraph.render.RenderOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Static HTML page showing, for every input, the raw text, the Mermaid diagram and
 * the metrics side by side. Failed inputs show their error message instead.
 */
public class HtmlReporter {

    private final MermaidRenderer mermaidRenderer = new MermaidRenderer();
    private final RenderOptions renderOptions;

    public HtmlReporter() {
        this(RenderOptions.topDown());
    }

    public HtmlReporter(RenderOptions renderOptions) {
        this.renderOptions = renderOptions;
    }

    public void generate(List<PipelineResult> results, Path outputPath) {
        try {
            Files.writeString(outputPath, toHtml(results));
            System.out.println("Report generated at: " + outputPath.toAbsolutePath());
        } catch (IOException e) {
            System.err.println("Could not write HTML report " + outputPath + ": " + e.getMessage());
        }
    }

    String toHtml(List<PipelineResult> results) {
        StringBuilder sections = new StringBuilder();
        for (PipelineResult result : results) {
            sections.append(section(result));
        }
        return TEMPLATE.replace("{{SECTIONS}}", sections.toString());
    }

    private String section(PipelineResult r) {
        StringBuilder sb = new StringBuilder();
        sb.append("<section class=\"input\">\n");
        sb.append("  <h2>").append(escapeHtml(r.sourceName())).append("</h2>\n");
        sb.append("  <div class=\"columns\">\n");
        sb.append("    <pre class=\"source\">").append(escapeHtml(r.sourceText())).append("</pre>\n");

        if (r.isSuccess()) {
            String diagram = mermaidRenderer.render(r.graph(), renderOptions);
            sb.append("    <pre class=\"mermaid\">\n").append(escapeHtml(diagram)).append("    </pre>\n");
            sb.append("    <div class=\"metrics\">\n").append(metricsTable(r.metrics()));
            if (!r.warnings().isEmpty()) {
                sb.append("      <ul class=\"warnings\">\n");
                for (ParseWarning w : r.warnings()) {
                    sb.append("        <li>").append(escapeHtml(w.toString())).append("</li>\n");
                }
                sb.append("      </ul>\n");
            }
            sb.append("    </div>\n");
        } else {
            sb.append("    <div class=\"error\">").append(escapeHtml(r.error())).append("</div>\n");
        }

        sb.append("  </div>\n");
        sb.append("</section>\n");
        return sb.toString();
    }

    private String metricsTable(GraphMetrics metrics) {
        StringBuilder sb = new StringBuilder("      <table>\n");
        for (Map.Entry<String, Integer> e : metrics.asMap().entrySet()) {
            sb.append("        <tr><th>").append(e.getKey()).append("</th><td>")
                    .append(e.getValue()).append("</td></tr>\n");
        }
        sb.append("      </table>\n");
        return sb.toString();
    }

    static String escapeHtml(String s) {
        if (s == null)
            return "";
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
            <meta charset="UTF-8">
            <title>Code Flowgraph Report</title>
            <script type="module">
              import mermaid from 'https://cdn.jsdelivr.net/npm/mermaid@10/dist/mermaid.esm.min.mjs';
              mermaid.initialize({ startOnLoad: true });
            </script>
            <style>
              body { font-family: sans-serif; margin: 2rem; background: #fafafa; }
              .columns { display: grid; grid-template-columns: 1fr 2fr 1fr; gap: 1rem; align-items: start; }
              pre.source { background: #fff; border: 1px solid #ddd; padding: 1rem; overflow: auto; }
              .metrics table { border-collapse: collapse; }
              .metrics th, .metrics td { border: 1px solid #ddd; padding: 0.3rem 0.8rem; text-align: left; }
              .warnings { color: #8a6d3b; }
              .error { color: #b71c1c; font-weight: bold; }
            </style>
            </head>
            <body>
            <h1>Control-Flow Graphs</h1>
            {{SECTIONS}}
            </body>
            </html>
            """;
}
