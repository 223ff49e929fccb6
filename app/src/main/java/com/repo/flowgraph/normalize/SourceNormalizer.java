package com.repo.flowgraph.normalize;

import com.repo.flowgraph.core.SyntaxMode;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns raw source text into one statement per line.
 *
 * <p>Text containing both '{' and '}' is read in {@link SyntaxMode#BRACE} mode: line
 * comments are stripped, braces get lines of their own, every ';' ends a line, and
 * {@code else if} is rewritten to {@code elif} so the graph builder only has to know
 * one chained-conditional keyword. Anything else is read in
 * {@link SyntaxMode#INDENTATION} mode, where only '#' comments are stripped.
 *
 * <p>Comment stripping is purely textual: a "//" or "#" inside a string literal also
 * starts a comment. Indentation is discarded.
 */
public class SourceNormalizer {

    private static final Pattern SLASH_COMMENT = Pattern.compile("//.*");
    private static final Pattern HASH_COMMENT = Pattern.compile("#.*");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    public NormalizedSource normalize(String text) {
        Objects.requireNonNull(text, "text");

        SyntaxMode mode = detectMode(text);
        String prepared = mode == SyntaxMode.BRACE ? prepareBraceText(text) : prepareIndentedText(text);

        List<String> lines = Arrays.stream(LINE_BREAK.split(prepared, -1))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
        return new NormalizedSource(mode, lines);
    }

    public SyntaxMode detectMode(String text) {
        return text.indexOf('{') >= 0 && text.indexOf('}') >= 0 ? SyntaxMode.BRACE : SyntaxMode.INDENTATION;
    }

    private String prepareBraceText(String text) {
        String s = SLASH_COMMENT.matcher(text).replaceAll("");
        s = s.replace("{", "\n{\n")
                .replace("}", "\n}\n")
                .replace(";", ";\n");
        return s.replace("else if", "elif");
    }

    private String prepareIndentedText(String text) {
        return HASH_COMMENT.matcher(text).replaceAll("");
    }
}
