package com.graphkit.dot.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Title, attributes and parent of a cluster or subgraph. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GroupInfo {
    private String title = "";
    private Map<String, Object> attributes = new LinkedHashMap<>();
    private String embedIn = Graph.DEFAULT_GROUP;

    GroupInfo copy() {
        return new GroupInfo(title, attributes == null ? null : new LinkedHashMap<>(attributes), embedIn);
    }
}
