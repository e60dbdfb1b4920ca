package com.graphkit.dot.render;

import java.util.Locale;

/**
 * Graphviz layout engines the renderer can run.
 */
public enum RenderCommand {
    /** Hierarchical layout, the default for directed graphs. */
    DOT,
    /** Spring-model layout, the default for undirected graphs. */
    NEATO;

    public static RenderCommand defaultFor(boolean directed) {
        return directed ? DOT : NEATO;
    }

    /**
     * Maps a command name to an engine. Unknown or null names fall back to
     * {@link #defaultFor(boolean)}.
     */
    public static RenderCommand resolve(String name, boolean directed) {
        if (name == null)
            return defaultFor(directed);
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "dot" -> DOT;
            case "neato" -> NEATO;
            default -> defaultFor(directed);
        };
    }
}
