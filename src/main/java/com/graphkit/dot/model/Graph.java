package com.graphkit.dot.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Mutable in-memory model of a DOT graph.
 *
 * <p>
 * Holds nodes grouped by the cluster or subgraph they belong to, edges keyed by
 * their ordered node pair, the cluster and subgraph registries, and the
 * graph-level attributes. Every collection is insertion ordered, and that order
 * is the order in which the serializer emits things.
 *
 * <h3>Edge multiplicity</h3>
 * Each {@code (from, to)} pair owns a map of edge id to {@link EdgeRecord}. In a
 * non-strict graph every {@link #addEdge(Edge, Map, Map)} call appends a record
 * under a fresh id. In a strict graph the pair has a single slot, id 0, and later
 * calls are merged into it.
 *
 * <h3>Nesting</h3>
 * Clusters and subgraphs point at their parent through
 * {@link GroupInfo#getEmbedIn()}; {@value #DEFAULT_GROUP} is the root.
 *
 * <p>
 * Not thread-safe. Removing a node never touches edges that reference it.
 */
@Log4j2
public final class Graph {
    /** Id of the implicit root group. */
    public static final String DEFAULT_GROUP = "default";
    public static final String DEFAULT_NAME = "G";

    private boolean directed;
    private boolean strict;
    private String name;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<String, Map<String, Map<String, Object>>> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, Map<Integer, EdgeRecord>>> edgesFrom = new LinkedHashMap<>();
    private final Map<String, GroupInfo> clusters = new LinkedHashMap<>();
    private final Map<String, GroupInfo> subgraphs = new LinkedHashMap<>();

    /** A strict, directed graph named {@value #DEFAULT_NAME}. */
    public Graph() {
        this(true, Collections.emptyMap(), DEFAULT_NAME, true);
    }

    public Graph(boolean directed, Map<String, ?> attributes, String name, boolean strict) {
        this.directed = directed;
        this.strict = strict;
        this.name = Objects.requireNonNull(name, "name");
        setAttributes(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Graph-level settings ──────────────────────────────────────

    public void setDirected(boolean directed) {
        this.directed = directed;
    }

    public boolean isDirected() {
        return directed;
    }

    public boolean isStrict() {
        return strict;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /** Replaces the graph attributes. A null map leaves them unchanged. */
    public void setAttributes(Map<String, ?> attributes) {
        if (attributes == null) {
            log.debug("Ignoring null attribute map for graph {}", name);
            return;
        }
        this.attributes.clear();
        this.attributes.putAll(attributes);
    }

    /** Merges into the graph attributes, incoming keys win. A null map is ignored. */
    public void addAttributes(Map<String, ?> attributes) {
        if (attributes == null) {
            log.debug("Ignoring null attribute map for graph {}", name);
            return;
        }
        this.attributes.putAll(attributes);
    }

    // ── Nodes ────────────────────────────────────────────────────

    public void addNode(String name) {
        addNode(name, null, DEFAULT_GROUP);
    }

    public void addNode(String name, Map<String, ?> attributes) {
        addNode(name, attributes, DEFAULT_GROUP);
    }

    /**
     * Inserts the node into {@code group}, replacing its attributes if it is
     * already there.
     */
    public void addNode(String name, Map<String, ?> attributes, String group) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(group, "group");
        Map<String, Object> attrs = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
        nodes.computeIfAbsent(group, k -> new LinkedHashMap<>()).put(name, attrs);
    }

    public void removeNode(String name) {
        removeNode(name, DEFAULT_GROUP);
    }

    /** Removes the node from {@code group}. Edges naming it are kept. */
    public void removeNode(String name, String group) {
        Map<String, Map<String, Object>> bucket = nodes.get(group);
        if (bucket != null)
            bucket.remove(name);
    }

    // ── Edges ────────────────────────────────────────────────────

    public int addEdge(String from, String to) {
        return addEdge(Edge.of(from, to), null, null);
    }

    public int addEdge(Edge edge) {
        return addEdge(edge, null, null);
    }

    public int addEdge(Edge edge, Map<String, ?> attributes) {
        return addEdge(edge, attributes, null);
    }

    /**
     * Adds an edge.
     *
     * @param edge       the ordered node pair.
     * @param attributes edge attributes, may be null.
     * @param ports      node name to port, consulted for both endpoints, may be
     *                   null.
     * @return the edge id, usable with {@link #removeEdge(Edge, int)}. Always 0 in
     *         a strict graph.
     */
    public int addEdge(Edge edge, Map<String, ?> attributes, Map<String, String> ports) {
        Objects.requireNonNull(edge, "edge");
        EdgeRecord record = new EdgeRecord();
        if (ports != null) {
            if (ports.containsKey(edge.from()))
                record.setPortFrom(ports.get(edge.from()));
            if (ports.containsKey(edge.to()))
                record.setPortTo(ports.get(edge.to()));
        }
        record.setAttributes(attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes));

        Map<Integer, EdgeRecord> slots = edgesFrom
                .computeIfAbsent(edge.from(), k -> new LinkedHashMap<>())
                .computeIfAbsent(edge.to(), k -> new LinkedHashMap<>());

        if (strict) {
            EdgeRecord existing = slots.get(0);
            if (existing == null)
                slots.put(0, record);
            else
                existing.mergeFrom(record);
            return 0;
        }

        int id = nextEdgeId(slots);
        slots.put(id, record);
        return id;
    }

    // One past the highest live id; removals never renumber surviving records
    private static int nextEdgeId(Map<Integer, EdgeRecord> slots) {
        int max = -1;
        for (int id : slots.keySet())
            max = Math.max(max, id);
        return max + 1;
    }

    /** Removes every edge between the ordered pair. */
    public void removeEdge(Edge edge) {
        Map<String, Map<Integer, EdgeRecord>> targets = edgesFrom.get(edge.from());
        if (targets != null)
            targets.remove(edge.to());
    }

    /**
     * Removes the single edge with the given id. The pair is dropped once its last
     * edge is gone.
     */
    public void removeEdge(Edge edge, int id) {
        Map<String, Map<Integer, EdgeRecord>> targets = edgesFrom.get(edge.from());
        if (targets == null)
            return;
        Map<Integer, EdgeRecord> slots = targets.get(edge.to());
        if (slots == null || slots.remove(id) == null)
            return;
        if (slots.isEmpty())
            targets.remove(edge.to());
    }

    // ── Clusters and subgraphs ──────────────────────────────────

    public void addCluster(String id, String title) {
        addCluster(id, title, null, DEFAULT_GROUP);
    }

    public void addCluster(String id, String title, Map<String, ?> attributes) {
        addCluster(id, title, attributes, DEFAULT_GROUP);
    }

    /**
     * Adds or replaces a cluster nested in {@code group}.
     *
     * @throws IllegalArgumentException if {@code id} is already a subgraph.
     */
    public void addCluster(String id, String title, Map<String, ?> attributes, String group) {
        addGroup(GroupKind.CLUSTER, id, title, attributes, group);
    }

    public void addSubgraph(String id, String title) {
        addSubgraph(id, title, null, DEFAULT_GROUP);
    }

    public void addSubgraph(String id, String title, Map<String, ?> attributes) {
        addSubgraph(id, title, attributes, DEFAULT_GROUP);
    }

    /**
     * Adds or replaces a subgraph nested in {@code group}.
     *
     * @throws IllegalArgumentException if {@code id} is already a cluster.
     */
    public void addSubgraph(String id, String title, Map<String, ?> attributes, String group) {
        addGroup(GroupKind.SUBGRAPH, id, title, attributes, group);
    }

    private void addGroup(GroupKind kind, String id, String title, Map<String, ?> attributes, String group) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(group, "group");
        Map<String, GroupInfo> registry = kind == GroupKind.CLUSTER ? clusters : subgraphs;
        Map<String, GroupInfo> other = kind == GroupKind.CLUSTER ? subgraphs : clusters;
        if (other.containsKey(id))
            throw new IllegalArgumentException("Group id '" + id + "' is already registered as a "
                    + (kind == GroupKind.CLUSTER ? "subgraph" : "cluster"));

        Map<String, Object> attrs = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
        registry.put(id, new GroupInfo(title == null ? "" : title, attrs, group));
        nodes.computeIfAbsent(id, k -> new LinkedHashMap<>());
    }

    // ── Read access ──────────────────────────────────────────────

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /** Node buckets keyed by group id. */
    public Map<String, Map<String, Map<String, Object>>> nodes() {
        Map<String, Map<String, Map<String, Object>>> view = new LinkedHashMap<>();
        nodes.forEach((group, bucket) -> {
            Map<String, Map<String, Object>> b = new LinkedHashMap<>();
            bucket.forEach((node, attrs) -> b.put(node, readOnly(attrs)));
            view.put(group, Collections.unmodifiableMap(b));
        });
        return Collections.unmodifiableMap(view);
    }

    /** Edges keyed by source, then target, then edge id. */
    public Map<String, Map<String, Map<Integer, EdgeRecord>>> edgesFrom() {
        Map<String, Map<String, Map<Integer, EdgeRecord>>> view = new LinkedHashMap<>();
        edgesFrom.forEach((from, targets) -> {
            Map<String, Map<Integer, EdgeRecord>> t = new LinkedHashMap<>();
            targets.forEach((to, slots) -> t.put(to, readOnlySlots(slots)));
            view.put(from, Collections.unmodifiableMap(t));
        });
        return Collections.unmodifiableMap(view);
    }

    /** Records between the ordered pair keyed by edge id; empty if there are none. */
    public Map<Integer, EdgeRecord> edges(String from, String to) {
        Map<String, Map<Integer, EdgeRecord>> targets = edgesFrom.get(from);
        if (targets == null || !targets.containsKey(to))
            return Collections.emptyMap();
        return readOnlySlots(targets.get(to));
    }

    public Map<String, GroupInfo> clusters() {
        return readOnlyGroups(clusters);
    }

    public Map<String, GroupInfo> subgraphs() {
        return readOnlyGroups(subgraphs);
    }

    // The read accessors hand out detached copies; changes go through the mutators only.

    private static Map<String, Object> readOnly(Map<String, Object> attrs) {
        return attrs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    private static Map<Integer, EdgeRecord> readOnlySlots(Map<Integer, EdgeRecord> slots) {
        Map<Integer, EdgeRecord> s = new LinkedHashMap<>();
        slots.forEach((id, rec) -> s.put(id,
                new EdgeRecord(rec.getPortFrom(), rec.getPortTo(), readOnly(rec.getAttributes()))));
        return Collections.unmodifiableMap(s);
    }

    private static Map<String, GroupInfo> readOnlyGroups(Map<String, GroupInfo> registry) {
        Map<String, GroupInfo> view = new LinkedHashMap<>();
        registry.forEach((id, info) -> view.put(id,
                new GroupInfo(info.getTitle(), readOnly(info.getAttributes()), info.getEmbedIn())));
        return Collections.unmodifiableMap(view);
    }

    // ── State transfer ───────────────────────────────────────────

    /** Deep copy of the current state. */
    public GraphState snapshot() {
        GraphState state = new GraphState();
        state.setName(name);
        state.setDirected(directed);
        state.setStrict(strict);
        state.setAttributes(new LinkedHashMap<>(attributes));

        Map<String, Map<String, Map<String, Object>>> nodeCopy = new LinkedHashMap<>();
        nodes.forEach((group, bucket) -> {
            Map<String, Map<String, Object>> b = new LinkedHashMap<>();
            bucket.forEach((node, attrs) -> b.put(node, new LinkedHashMap<>(attrs)));
            nodeCopy.put(group, b);
        });
        state.setNodes(nodeCopy);

        Map<String, Map<String, Map<Integer, EdgeRecord>>> edgeCopy = new LinkedHashMap<>();
        edgesFrom.forEach((from, targets) -> {
            Map<String, Map<Integer, EdgeRecord>> t = new LinkedHashMap<>();
            targets.forEach((to, slots) -> {
                Map<Integer, EdgeRecord> s = new LinkedHashMap<>();
                slots.forEach((id, rec) -> s.put(id, rec.copy()));
                t.put(to, s);
            });
            edgeCopy.put(from, t);
        });
        state.setEdgesFrom(edgeCopy);

        state.setClusters(copyGroups(clusters));
        state.setSubgraphs(copyGroups(subgraphs));
        return state;
    }

    /**
     * Replaces the whole internal state. Null collections in {@code state} are
     * read as empty and a null name as {@value #DEFAULT_NAME}.
     */
    public void restore(GraphState state) {
        Objects.requireNonNull(state, "state");
        GraphState copy = copyOf(state);
        name = copy.getName();
        directed = copy.isDirected();
        strict = copy.isStrict();
        attributes.clear();
        attributes.putAll(copy.getAttributes());
        nodes.clear();
        nodes.putAll(copy.getNodes());
        edgesFrom.clear();
        edgesFrom.putAll(copy.getEdgesFrom());
        clusters.clear();
        clusters.putAll(copy.getClusters());
        subgraphs.clear();
        subgraphs.putAll(copy.getSubgraphs());
        log.debug("Restored graph {} ({} node groups, {} edge sources, {} clusters, {} subgraphs)",
                name, nodes.size(), edgesFrom.size(), clusters.size(), subgraphs.size());
    }

    // Detaches restored state from the caller's instance and normalizes nulls
    private static GraphState copyOf(GraphState source) {
        Graph scratch = new Graph();
        scratch.name = source.getName() == null ? DEFAULT_NAME : source.getName();
        scratch.directed = source.isDirected();
        scratch.strict = source.isStrict();
        if (source.getAttributes() != null)
            scratch.attributes.putAll(source.getAttributes());
        if (source.getNodes() != null)
            source.getNodes().forEach((group, bucket) -> {
                Map<String, Map<String, Object>> b = scratch.nodes.computeIfAbsent(group, k -> new LinkedHashMap<>());
                if (bucket != null)
                    bucket.forEach((node, attrs) -> b.put(node,
                            attrs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attrs)));
            });
        if (source.getEdgesFrom() != null)
            source.getEdgesFrom().forEach((from, targets) -> {
                if (targets == null)
                    return;
                Map<String, Map<Integer, EdgeRecord>> t = scratch.edgesFrom.computeIfAbsent(from,
                        k -> new LinkedHashMap<>());
                targets.forEach((to, slots) -> {
                    if (slots == null)
                        return;
                    Map<Integer, EdgeRecord> s = t.computeIfAbsent(to, k -> new LinkedHashMap<>());
                    slots.forEach((id, rec) -> s.put(id, rec == null ? new EdgeRecord() : rec.copy()));
                });
            });
        copyGroupsInto(source.getClusters(), scratch.clusters);
        copyGroupsInto(source.getSubgraphs(), scratch.subgraphs);
        return scratch.snapshot();
    }

    private static void copyGroupsInto(Map<String, GroupInfo> source, Map<String, GroupInfo> target) {
        if (source == null)
            return;
        source.forEach((id, info) -> {
            if (info == null) {
                target.put(id, new GroupInfo());
                return;
            }
            GroupInfo g = info.copy();
            if (g.getTitle() == null)
                g.setTitle("");
            if (g.getAttributes() == null)
                g.setAttributes(new LinkedHashMap<>());
            if (g.getEmbedIn() == null)
                g.setEmbedIn(DEFAULT_GROUP);
            target.put(id, g);
        });
    }

    private static Map<String, GroupInfo> copyGroups(Map<String, GroupInfo> groups) {
        Map<String, GroupInfo> copy = new LinkedHashMap<>();
        groups.forEach((id, info) -> copy.put(id, info.copy()));
        return copy;
    }

    /**
     * Fluent construction of a {@link Graph}.
     *
     * <pre>{@code
     * Graph g = Graph.builder().name("deps").directed(true).strict(false).build();
     * }</pre>
     */
    public static final class Builder {
        private boolean directed = true;
        private boolean strict = true;
        private String name = DEFAULT_NAME;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder directed(boolean directed) {
            this.directed = directed;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            if (attributes != null)
                this.attributes.putAll(attributes);
            return this;
        }

        public Graph build() {
            return new Graph(directed, attributes, name, strict);
        }
    }
}
