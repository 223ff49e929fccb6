package com.repo.flowgraph;

import com.repo.flowgraph.core.FlowgraphConfig;
import com.repo.flowgraph.graph.ParseWarning;
import com.repo.flowgraph.metrics.GraphMetrics;
import com.repo.flowgraph.pipeline.FlowgraphPipeline;
import com.repo.flowgraph.pipeline.PipelineResult;
import com.repo.flowgraph.render.DiagramRenderers;
import com.repo.flowgraph.report.CsvReporter;
import com.repo.flowgraph.report.HtmlReporter;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Code Flowgraph - draws control-flow graphs of simple source text and measures them.
 *
 * Usage: java -jar code-flowgraph.jar [--input <file>]... [--format dot|mermaid]
 * [--output <dir>] [--config <yaml>]
 */
public class App {

    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;

    public App(PrintStream out, PrintStream err, InputStream in) {
        this.out = out;
        this.err = err;
        this.in = in;
    }

    public static void main(String[] args) {
        int status = new App(System.out, System.err, System.in).execute(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    record CliArgs(
            List<String> inputs, // file paths, "-" for stdin
            String format,
            Path outputDir,
            Path configFile) {
    }

    /**
     * Runs the CLI and returns the process exit status. Only usage errors are non-zero;
     * a failing input is reported and the remaining inputs are still processed.
     */
    public int execute(String[] args) {
        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            return 1;
        }

        FlowgraphConfig config = cliArgs.configFile() != null
                ? FlowgraphConfig.loadFile(cliArgs.configFile())
                : FlowgraphConfig.load(Path.of("."));
        if (cliArgs.format() != null) {
            config.withRenderFormat(cliArgs.format());
        }

        FlowgraphPipeline pipeline;
        try {
            pipeline = new FlowgraphPipeline(config);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.println("=== Code Flowgraph ===");
        out.println("\n>>> PHASE 1: BUILDING GRAPHS <<<");
        List<PipelineResult> results = new ArrayList<>();
        for (String input : cliArgs.inputs()) {
            results.add(runOne(pipeline, input));
        }

        out.println("\n>>> PHASE 2: METRICS <<<");
        printTable(results);

        if (cliArgs.outputDir() != null) {
            out.println("\n>>> PHASE 3: WRITING DIAGRAMS AND REPORTS <<<");
            writeOutputs(results, pipeline, config, cliArgs.outputDir());
        } else {
            for (PipelineResult r : results) {
                if (r.isSuccess()) {
                    out.println("\n--- " + r.sourceName() + " (" + pipeline.renderer().displayName() + ") ---");
                    out.print(r.diagram());
                }
            }
        }

        printSummary(results);
        return 0;
    }

    static CliArgs parseArgs(String[] args) {
        List<String> inputs = new ArrayList<>();
        String format = null;
        Path outputDir = null;
        Path configFile = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input", "-i" -> {
                    if (i + 1 >= args.length)
                        return null;
                    inputs.add(args[++i]);
                }
                case "--format", "-f" -> {
                    if (i + 1 >= args.length)
                        return null;
                    format = args[++i];
                }
                case "--output", "-o" -> {
                    if (i + 1 >= args.length)
                        return null;
                    outputDir = Path.of(args[++i]);
                }
                case "--config", "-c" -> {
                    if (i + 1 >= args.length)
                        return null;
                    configFile = Path.of(args[++i]);
                }
                default -> {
                    // --help and anything unknown
                    return null;
                }
            }
        }

        if (inputs.isEmpty()) {
            inputs.add("-");
        }
        return new CliArgs(List.copyOf(inputs), format, outputDir, configFile);
    }

    private void printUsage() {
        err.println("""
                Usage: java -jar code-flowgraph.jar [--input <file>]... [--format <fmt>] [--output <dir>] [--config <yaml>]

                Arguments:
                  --input <file>     Source file to graph, repeatable; '-' or none reads stdin
                  --format <fmt>     Diagram format: %s (default from config, else dot)
                  --output <dir>     Write one diagram per input plus HTML and CSV reports here
                  --config <yaml>    Configuration file (default: ./flowgraph.yaml if present)
                """.formatted(DiagramRenderers.ids()));
    }

    private PipelineResult runOne(FlowgraphPipeline pipeline, String input) {
        String name = input.equals("-") ? "stdin" : input;
        String text;
        try {
            text = input.equals("-")
                    ? new String(in.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(Path.of(input));
        } catch (IOException | InvalidPathException e) {
            err.println("Error: could not read " + name + ": " + e.getMessage());
            return PipelineResult.failure(name, "", "Error: could not read input: " + e.getMessage());
        }

        PipelineResult result = pipeline.run(name, text);
        if (result.isSuccess()) {
            out.printf("  [OK]   %s (%s mode)%n", name, result.graph().mode());
            for (ParseWarning warning : result.warnings()) {
                err.println("  Warning: " + name + ": " + warning);
            }
        } else {
            err.println("  [FAIL] " + name + ": " + result.error());
        }
        return result;
    }

    private void printTable(List<PipelineResult> results) {
        out.println("\n| %-40s | %-5s | %-5s | %-10s | %-10s | %-7s |".formatted(
                "Source", "Nodes", "Edges", "Complexity", "Predicates", "Regions"));
        out.println("|" + "-".repeat(42) + "|" + "-".repeat(7) + "|" + "-".repeat(7) + "|" + "-".repeat(12)
                + "|" + "-".repeat(12) + "|" + "-".repeat(9) + "|");

        for (PipelineResult r : results) {
            GraphMetrics m = r.metrics();
            if (!r.isSuccess()) {
                out.println("| %-40s | %-56s |".formatted(truncate(r.sourceName(), 40), truncate(r.error(), 56)));
                continue;
            }
            out.println("| %-40s | %-5d | %-5d | %-10d | %-10d | %-7d |".formatted(
                    truncate(r.sourceName(), 40), m.nodes(), m.edges(), m.complexity(), m.predicates(),
                    m.regions()));
        }
    }

    private void writeOutputs(List<PipelineResult> results, FlowgraphPipeline pipeline, FlowgraphConfig config,
            Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            err.println("Error: could not create output directory " + outputDir + ": " + e.getMessage());
            return;
        }

        Set<String> usedNames = new HashSet<>();
        for (PipelineResult r : results) {
            if (!r.isSuccess()) {
                continue;
            }
            String fileName = uniqueName(diagramFileName(r.sourceName()), usedNames);
            Path target = outputDir.resolve(fileName + pipeline.renderer().fileExtension());
            try {
                Files.writeString(target, r.diagram());
                out.println("Diagram written to: " + target.toAbsolutePath());
            } catch (IOException e) {
                err.println("Error: could not write " + target + ": " + e.getMessage());
            }
        }

        new HtmlReporter(config.renderOptions()).generate(results, outputDir.resolve(config.getHtmlReportName()));
        new CsvReporter().generate(results, outputDir.resolve(config.getCsvReportName()));
    }

    static String diagramFileName(String sourceName) {
        String s = Path.of(sourceName).getFileName().toString();
        int dotIdx = s.lastIndexOf('.');
        if (dotIdx > 0) {
            s = s.substring(0, dotIdx);
        }
        return s.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    /** Returns {@code base}, or {@code base_2}, {@code base_3}, ... when an earlier input took it. */
    static String uniqueName(String base, Set<String> usedNames) {
        String candidate = base;
        for (int n = 2; !usedNames.add(candidate); n++) {
            candidate = base + "_" + n;
        }
        return candidate;
    }

    private void printSummary(List<PipelineResult> results) {
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        long warned = results.stream().filter(r -> !r.warnings().isEmpty()).count();
        out.println("\n=== SUMMARY ===");
        out.printf("Inputs: %d | Failed: %d | With warnings: %d%n", results.size(), failed, warned);

        results.stream()
                .filter(PipelineResult::isSuccess)
                .max((a, b) -> Integer.compare(a.metrics().complexity(), b.metrics().complexity()))
                .ifPresent(r -> out.printf("Most complex: %s (Complexity: %d)%n",
                        r.sourceName(), r.metrics().complexity()));
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }
}
