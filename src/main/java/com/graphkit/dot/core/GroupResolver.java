package com.graphkit.dot.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.graphkit.dot.model.Graph;
import com.graphkit.dot.model.GroupInfo;
import com.graphkit.dot.model.GroupKind;

/**
 * Derives the nesting tree of clusters and subgraphs from the flat
 * {@code embedIn} parent pointers stored on each group.
 *
 * <p>
 * Where an id is registered as both a cluster and a subgraph (only possible for
 * state restored from an external blob) the cluster entry wins.
 */
public final class GroupResolver {
    private final Graph graph;

    public GroupResolver(Graph graph) {
        this.graph = graph;
    }

    /** Cluster ids followed by subgraph ids, without duplicates. */
    public Set<String> groups() {
        Set<String> ids = new LinkedHashSet<>(graph.clusters().keySet());
        ids.addAll(graph.subgraphs().keySet());
        return ids;
    }

    /**
     * Groups nested directly in the root, plus the root id itself if something
     * registered it as a group.
     */
    public Set<String> topGroups() {
        Map<String, GroupInfo> clusters = graph.clusters();
        Map<String, GroupInfo> subgraphs = graph.subgraphs();
        Set<String> top = new LinkedHashSet<>();
        for (String id : groups()) {
            if (Graph.DEFAULT_GROUP.equals(id) || isEmbeddedIn(clusters.get(id), Graph.DEFAULT_GROUP)
                    || isEmbeddedIn(subgraphs.get(id), Graph.DEFAULT_GROUP))
                top.add(id);
        }
        return top;
    }

    /** Direct children of {@code parent}, clusters first. */
    public List<String> childrenOf(String parent) {
        List<String> children = new ArrayList<>();
        collectChildren(graph.clusters(), parent, children);
        collectChildren(graph.subgraphs(), parent, children);
        return children;
    }

    public Optional<GroupKind> kindOf(String id) {
        if (graph.clusters().containsKey(id))
            return Optional.of(GroupKind.CLUSTER);
        if (graph.subgraphs().containsKey(id))
            return Optional.of(GroupKind.SUBGRAPH);
        return Optional.empty();
    }

    /** The registry entry for {@code id}, cluster first. */
    public Optional<GroupInfo> infoOf(String id) {
        GroupInfo info = graph.clusters().get(id);
        if (info == null)
            info = graph.subgraphs().get(id);
        return Optional.ofNullable(info);
    }

    /**
     * Groups that cannot be reached from the root through {@code embedIn}, either
     * because their parent does not exist or because they sit on a cycle.
     */
    public Set<String> unreachable() {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(topGroups());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (seen.add(id))
                queue.addAll(childrenOf(id));
        }
        Set<String> missing = new LinkedHashSet<>(groups());
        missing.removeAll(seen);
        return missing;
    }

    private static boolean isEmbeddedIn(GroupInfo info, String parent) {
        return info != null && parent.equals(info.getEmbedIn());
    }

    private static void collectChildren(Map<String, GroupInfo> registry, String parent, List<String> out) {
        for (Map.Entry<String, GroupInfo> e : registry.entrySet()) {
            if (parent.equals(e.getValue().getEmbedIn()))
                out.add(e.getKey());
        }
    }
}
