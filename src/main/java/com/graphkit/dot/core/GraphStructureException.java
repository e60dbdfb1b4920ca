package com.graphkit.dot.core;

import java.util.List;

import lombok.Getter;

/**
 * Thrown when the cluster/subgraph nesting cannot be emitted, i.e. when a group
 * is reached again while it is still open.
 */
@Getter
public class GraphStructureException extends RuntimeException {
    private final List<String> path;

    public GraphStructureException(List<String> path) {
        super("Cycle in group nesting: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }
}
