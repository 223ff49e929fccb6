package com.repo.flowgraph.graph;

/**
 * Cleans raw source text into a display label: trimmed, double quotes swapped for
 * single quotes, and long text shortened to prefix + "..." + suffix.
 */
public class LabelFormatter {

    public static final int DEFAULT_MAX_LENGTH = 40;
    public static final int DEFAULT_PREFIX_LENGTH = 20;
    public static final int DEFAULT_SUFFIX_LENGTH = 15;
    private static final String ELLIPSIS = "...";

    private final int maxLength;
    private final int prefixLength;
    private final int suffixLength;

    public LabelFormatter(int maxLength, int prefixLength, int suffixLength) {
        if (prefixLength < 0 || suffixLength < 0 || prefixLength + suffixLength > maxLength) {
            throw new IllegalArgumentException(
                    "prefix (" + prefixLength + ") + suffix (" + suffixLength + ") must fit in max length " + maxLength);
        }
        this.maxLength = maxLength;
        this.prefixLength = prefixLength;
        this.suffixLength = suffixLength;
    }

    public static LabelFormatter defaults() {
        return new LabelFormatter(DEFAULT_MAX_LENGTH, DEFAULT_PREFIX_LENGTH, DEFAULT_SUFFIX_LENGTH);
    }

    public String format(String raw) {
        if (raw == null) {
            return "";
        }
        String clean = raw.strip().replace('"', '\'');
        if (clean.length() <= maxLength) {
            return clean;
        }
        return clean.substring(0, prefixLength) + ELLIPSIS + clean.substring(clean.length() - suffixLength);
    }
}
