package com.graphkit.dot;

import com.graphkit.dot.model.Graph;

/**
 * Entry points for building DOT graphs.
 *
 * <pre>{@code
 * DotGraph g = DotGraphs.directed("deps");
 * g.graph().addNode("A", Map.of("shape", "box"));
 * g.graph().addEdge("A", "B");
 * String dot = g.parse();
 * }</pre>
 */
public final class DotGraphs {

    private DotGraphs() {
        // Prevent instantiation of utility class
    }

    /** A strict directed graph. */
    public static DotGraph directed(String name) {
        return wrap(Graph.builder().name(name).directed(true).build());
    }

    /** A strict undirected graph. */
    public static DotGraph undirected(String name) {
        return wrap(Graph.builder().name(name).directed(false).build());
    }

    public static DotGraph wrap(Graph graph) {
        return new DotGraph(graph);
    }
}
