package com.repo.flowgraph.graph;

public enum EdgeLabel {
    NONE(""),
    FALSE("False"),
    LOOP("Loop");

    private final String text;

    EdgeLabel(String text) {
        this.text = text;
    }

    /**
     * Display text of the label, empty for {@link #NONE}.
     */
    public String text() {
        return text;
    }

    public boolean isPresent() {
        return this != NONE;
    }
}
