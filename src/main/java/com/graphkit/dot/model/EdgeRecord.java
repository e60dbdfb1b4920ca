package com.graphkit.dot.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One edge between an ordered pair of nodes.
 *
 * <p>
 * Ports are optional; {@code null} means the edge attaches to the node itself.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EdgeRecord {
    private String portFrom;
    private String portTo;
    private Map<String, Object> attributes;

    /**
     * Folds a later record for the same pair into this one. Attributes are merged
     * key-wise with the later values winning, ports are replaced only when the
     * later record carries them.
     */
    void mergeFrom(EdgeRecord later) {
        if (later.portFrom != null)
            portFrom = later.portFrom;
        if (later.portTo != null)
            portTo = later.portTo;
        if (later.attributes != null) {
            if (attributes == null)
                attributes = new LinkedHashMap<>();
            attributes.putAll(later.attributes);
        }
    }

    EdgeRecord copy() {
        return new EdgeRecord(portFrom, portTo, attributes == null ? null : new LinkedHashMap<>(attributes));
    }
}
