package com.graphkit.dot.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered node pair identifying an edge slot.
 */
public record Edge(String from, String to) {

    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static Edge of(String from, String to) {
        return new Edge(from, to);
    }

    /**
     * Reads a single-entry {@code from -> to} mapping, the shape edges take in
     * untyped input such as legacy persisted graphs.
     *
     * @return the edge, or empty if the mapping is null, does not hold exactly one
     *         entry, or holds a null endpoint.
     */
    public static Optional<Edge> of(Map<?, ?> mapping) {
        if (mapping == null || mapping.size() != 1)
            return Optional.empty();
        Map.Entry<?, ?> e = mapping.entrySet().iterator().next();
        if (e.getKey() == null || e.getValue() == null)
            return Optional.empty();
        return Optional.of(new Edge(e.getKey().toString(), e.getValue().toString()));
    }
}
