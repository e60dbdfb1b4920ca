package com.graphkit.dot.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * POJO representation of the complete internal state of a {@link Graph}.
 *
 * <p>
 * This is the unit of persistence: {@link Graph#snapshot()} produces one and
 * {@link Graph#restore(GraphState)} consumes one. Field initializers hold the
 * defaults applied to blobs that omit a field.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "name", "directed", "strict", "attributes", "nodes", "edgesFrom", "clusters", "subgraphs" })
public final class GraphState {
    private String name = Graph.DEFAULT_NAME;
    private boolean directed = true;
    private boolean strict = true;
    private Map<String, Object> attributes = new LinkedHashMap<>();
    private Map<String, Map<String, Map<String, Object>>> nodes = new LinkedHashMap<>();
    private Map<String, Map<String, Map<Integer, EdgeRecord>>> edgesFrom = new LinkedHashMap<>();
    private Map<String, GroupInfo> clusters = new LinkedHashMap<>();
    private Map<String, GroupInfo> subgraphs = new LinkedHashMap<>();
}
