package com.repo.flowgraph.core;

import com.repo.flowgraph.graph.CfgBuilder;
import com.repo.flowgraph.graph.LabelFormatter;
import com.repo.flowgraph.graph.NodeFill;
import com.repo.flowgraph.render.RenderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for Code Flowgraph.
 * Loaded from flowgraph.yaml in the working directory or uses sensible defaults.
 */
public class FlowgraphConfig {

    public static final String FILE_NAME = "flowgraph.yaml";

    // Labels
    private int labelMaxLength = LabelFormatter.DEFAULT_MAX_LENGTH;
    private int labelPrefixLength = LabelFormatter.DEFAULT_PREFIX_LENGTH;
    private int labelSuffixLength = LabelFormatter.DEFAULT_SUFFIX_LENGTH;
    private String statementSeparator = "\n";

    // Rendering
    private String renderFormat = "dot";
    private String renderDirection = "TB";
    private final Map<NodeFill, String> colors = new EnumMap<>(RenderOptions.defaultColors());

    // Reports
    private String htmlReportName = "flowgraph-report.html";
    private String csvReportName = "flowgraph-report.csv";

    /**
     * Load configuration from flowgraph.yaml in the given directory or return defaults.
     */
    public static FlowgraphConfig load(Path directory) {
        return loadFile(directory.resolve(FILE_NAME));
    }

    /**
     * Load configuration from an explicit YAML file or return defaults when it is missing.
     */
    public static FlowgraphConfig loadFile(Path configFile) {
        FlowgraphConfig config = new FlowgraphConfig();

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
            }
        }
        return config;
    }

    public static FlowgraphConfig defaults() {
        return new FlowgraphConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.get("labels") instanceof Map) {
            Map<String, Object> labels = (Map<String, Object>) data.get("labels");
            labelMaxLength = getInt(labels, "max_length", labelMaxLength);
            labelPrefixLength = getInt(labels, "prefix_length", labelPrefixLength);
            labelSuffixLength = getInt(labels, "suffix_length", labelSuffixLength);
            statementSeparator = getString(labels, "statement_separator", statementSeparator);
        }

        if (data.get("render") instanceof Map) {
            Map<String, Object> render = (Map<String, Object>) data.get("render");
            renderFormat = getString(render, "format", renderFormat).toLowerCase(Locale.ROOT);
            renderDirection = getString(render, "direction", renderDirection).toUpperCase(Locale.ROOT);
        }

        if (data.get("colors") instanceof Map) {
            Map<String, Object> colorData = (Map<String, Object>) data.get("colors");
            for (NodeFill fill : NodeFill.values()) {
                String key = fill.name().toLowerCase(Locale.ROOT);
                colors.put(fill, getString(colorData, key, colors.get(fill)));
            }
        }

        if (data.get("report") instanceof Map) {
            Map<String, Object> report = (Map<String, Object>) data.get("report");
            htmlReportName = getString(report, "html", htmlReportName);
            csvReportName = getString(report, "csv", csvReportName);
        }
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        if (val != null)
            return val.toString();
        return defaultVal;
    }

    // === Derived collaborators ===

    public LabelFormatter labelFormatter() {
        return new LabelFormatter(labelMaxLength, labelPrefixLength, labelSuffixLength);
    }

    public CfgBuilder newBuilder() {
        return new CfgBuilder(labelFormatter(), statementSeparator);
    }

    public RenderOptions renderOptions() {
        return new RenderOptions(renderDirection, colors);
    }

    // === Getters ===

    public int getLabelMaxLength() {
        return labelMaxLength;
    }

    public int getLabelPrefixLength() {
        return labelPrefixLength;
    }

    public int getLabelSuffixLength() {
        return labelSuffixLength;
    }

    public String getStatementSeparator() {
        return statementSeparator;
    }

    public String getRenderFormat() {
        return renderFormat;
    }

    public String getRenderDirection() {
        return renderDirection;
    }

    public String getColor(NodeFill fill) {
        return colors.get(fill);
    }

    public String getHtmlReportName() {
        return htmlReportName;
    }

    public String getCsvReportName() {
        return csvReportName;
    }

    public FlowgraphConfig withRenderFormat(String format) {
        this.renderFormat = format.toLowerCase(Locale.ROOT);
        return this;
    }
}
