package com.graphkit.dot.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graphkit.dot.model.Edge;
import com.graphkit.dot.model.Graph;
import com.graphkit.dot.model.GraphState;

import lombok.extern.log4j.Log4j2;

/**
 * Saves and loads the internal state of a {@link Graph} as JSON.
 *
 * <p>
 * This persists the model, not the rendered DOT text. Loading also accepts the
 * older layout in which edges were kept as a flat {@code edges} sequence of
 * single-entry {@code {from: to}} mappings with a parallel {@code edgeAttributes}
 * sequence. Those edges are replayed through {@link Graph#addEdge(Edge, Map)} so
 * they follow the strict/non-strict rules of the loaded graph, and the legacy
 * fields are dropped.
 */
@Log4j2
public final class GraphStore {
    private static final String LEGACY_EDGES = "edges";
    private static final String LEGACY_EDGE_ATTRIBUTES = "edgeAttributes";
    private static final TypeReference<Map<String, Object>> ATTRIBUTE_MAP = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public GraphStore() {
        this(new ObjectMapper());
    }

    public GraphStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Writes the graph state to {@code file}, or to a new temporary file when
     * {@code file} is null.
     *
     * @return the file written.
     */
    public Path save(Graph graph, Path file) throws IOException {
        Path target = file != null ? file : Files.createTempFile("graph", ".json");
        Files.writeString(target, toJson(graph), StandardCharsets.UTF_8);
        log.info("Graph {} saved to {}", graph.getName(), target);
        return target;
    }

    public String toJson(Graph graph) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(graph.snapshot());
    }

    /**
     * Replaces the state of {@code target} with the graph stored in {@code file}.
     *
     * @return false, leaving {@code target} untouched, if the file does not hold a
     *         JSON object.
     * @throws IOException if the file cannot be read.
     */
    public boolean load(Path file, Graph target) throws IOException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8), target);
    }

    /**
     * String form of {@link #load(Path, Graph)}. Malformed JSON is treated like any
     * other non-object input.
     */
    public boolean fromJson(String json, Graph target) {
        Optional<ObjectNode> root = readObject(json);
        if (root.isEmpty())
            return false;

        ObjectNode obj = root.get();
        JsonNode legacyEdges = obj.remove(LEGACY_EDGES);
        JsonNode legacyAttributes = obj.remove(LEGACY_EDGE_ATTRIBUTES);

        GraphState state;
        try {
            state = mapper.treeToValue(obj, GraphState.class);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring graph blob that does not match the graph layout: {}", e.getOriginalMessage());
            return false;
        }
        target.restore(state);

        if (legacyEdges != null)
            replayLegacyEdges(target, legacyEdges, legacyAttributes);
        return true;
    }

    private Optional<ObjectNode> readObject(String json) {
        if (json == null || json.isBlank()) {
            log.debug("Ignoring empty graph blob");
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparseable graph blob: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.debug("Ignoring graph blob whose root is not an object");
            return Optional.empty();
        }
        return Optional.of((ObjectNode) node);
    }

    private void replayLegacyEdges(Graph target, JsonNode edges, JsonNode attributes) {
        int replayed = 0;
        if (edges.isArray()) {
            for (int i = 0; i < edges.size(); i++)
                replayed += replay(target, String.valueOf(i), edges.get(i), legacyAttributes(attributes, i));
        } else if (edges.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = edges.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                replayed += replay(target, e.getKey(), e.getValue(), legacyAttributes(attributes, e.getKey()));
            }
        }
        log.debug("Replayed {} legacy edges into graph {}", replayed, target.getName());
    }

    private int replay(Graph target, String id, JsonNode mapping, JsonNode attributes) {
        Optional<Edge> edge = mapping != null && mapping.isObject()
                ? Edge.of(mapper.convertValue(mapping, ATTRIBUTE_MAP))
                : Optional.empty();
        if (edge.isEmpty()) {
            log.debug("Skipping legacy edge {}: not a single from/to mapping", id);
            return 0;
        }
        Map<String, Object> attrs = attributes != null && attributes.isObject()
                ? mapper.convertValue(attributes, ATTRIBUTE_MAP)
                : Collections.emptyMap();
        target.addEdge(edge.get(), attrs);
        return 1;
    }

    private static JsonNode legacyAttributes(JsonNode attributes, int index) {
        if (attributes == null)
            return null;
        return attributes.isArray() ? attributes.get(index) : attributes.get(String.valueOf(index));
    }

    private static JsonNode legacyAttributes(JsonNode attributes, String key) {
        if (attributes == null)
            return null;
        if (attributes.isObject())
            return attributes.get(key);
        if (attributes.isArray()) {
            try {
                return attributes.get(Integer.parseInt(key));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
