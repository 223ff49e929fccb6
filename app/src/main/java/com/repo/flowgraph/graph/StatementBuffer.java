package com.repo.flowgraph.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Consecutive non-control lines waiting to become one statement node.
 */
final class StatementBuffer {

    private final List<String> pending = new ArrayList<>();

    void add(String line) {
        pending.add(line);
    }

    boolean isEmpty() {
        return pending.isEmpty();
    }

    /**
     * Joins and clears the pending lines.
     */
    String drain(String separator) {
        String joined = String.join(separator, pending);
        pending.clear();
        return joined;
    }
}
