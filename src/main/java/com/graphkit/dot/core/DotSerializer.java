package com.graphkit.dot.core;

import static com.graphkit.dot.core.IdentifierEscaper.escape;
import static com.graphkit.dot.core.IdentifierEscaper.escapeArray;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.graphkit.dot.model.EdgeRecord;
import com.graphkit.dot.model.Graph;
import com.graphkit.dot.model.GroupInfo;
import com.graphkit.dot.model.GroupKind;

/**
 * Emits a {@link Graph} as DOT text.
 *
 * <p>
 * Output order:
 * <ol>
 * <li>Header: {@code [strict ](graph|digraph) <name> {}</li>
 * <li>Graph attributes, one {@code key=value;} line each.</li>
 * <li>Nodes of every bucket that is not a cluster or subgraph.</li>
 * <li>Cluster/subgraph blocks, recursively, children one level deeper.</li>
 * <li>Edges, by source, target and edge id.</li>
 * </ol>
 * Every collection is walked in insertion order, so the same graph state always
 * produces byte-identical text. Indentation is four spaces per level.
 */
public final class DotSerializer {
    private static final Logger log = LogManager.getLogger(DotSerializer.class);

    static final String INDENT = "    ";
    private static final String CLUSTER_PREFIX = "cluster";

    public String serialize(Graph graph) {
        GroupResolver resolver = new GroupResolver(graph);
        StringBuilder sb = new StringBuilder(1024);

        if (graph.isStrict())
            sb.append("strict ");
        sb.append(graph.isDirected() ? "digraph " : "graph ");
        sb.append(escape(graph.getName())).append(" {\n");

        for (Map.Entry<String, String> e : escapeArray(graph.attributes()).entrySet())
            sb.append(INDENT).append(e.getKey()).append('=').append(e.getValue()).append(";\n");

        Set<String> groups = resolver.groups();
        for (Map.Entry<String, Map<String, Map<String, Object>>> bucket : graph.nodes().entrySet()) {
            if (!groups.contains(bucket.getKey()))
                appendNodes(sb, bucket.getValue(), 1);
        }

        for (String top : resolver.topGroups())
            appendGroup(sb, graph, resolver, top, 1, new ArrayList<>());

        appendEdges(sb, graph);

        Set<String> orphans = resolver.unreachable();
        if (!orphans.isEmpty())
            log.warn("Groups not reachable from '{}' were not emitted: {}", Graph.DEFAULT_GROUP, orphans);

        return sb.append("}\n").toString();
    }

    private static void appendNodes(StringBuilder sb, Map<String, Map<String, Object>> nodes, int depth) {
        if (nodes == null)
            return;
        String indent = indent(depth);
        for (Map.Entry<String, Map<String, Object>> node : nodes.entrySet()) {
            sb.append(indent).append(escape(node.getKey()));
            appendAttributeList(sb, attributeList(escapeArray(node.getValue())));
            sb.append(";\n");
        }
    }

    private static void appendGroup(StringBuilder sb, Graph graph, GroupResolver resolver, String group, int depth,
            List<String> open) {
        if (open.contains(group)) {
            List<String> cycle = new ArrayList<>(open.subList(open.indexOf(group), open.size()));
            cycle.add(group);
            throw new GraphStructureException(cycle);
        }
        open.add(group);

        boolean wrapped = !Graph.DEFAULT_GROUP.equals(group);
        int inner = depth;
        if (wrapped) {
            inner = depth + 1;
            boolean cluster = resolver.kindOf(group).orElse(null) == GroupKind.CLUSTER;
            sb.append(indent(depth)).append("subgraph ")
                    .append(escape(cluster ? clusterName(group) : group)).append(" {\n");

            GroupInfo info = resolver.infoOf(group).orElse(null);
            if (info != null) {
                List<String> attrs = attributeList(escapeArray(info.getAttributes()));
                if (info.getTitle() != null && !info.getTitle().isEmpty())
                    attrs.add("label=" + escape(info.getTitle(), true));
                if (!attrs.isEmpty())
                    sb.append(indent(inner)).append("graph [ ").append(String.join(",", attrs)).append(" ];\n");
            }
        }

        appendNodes(sb, graph.nodes().get(group), inner);

        for (String child : resolver.childrenOf(group))
            appendGroup(sb, graph, resolver, child, inner, open);

        if (wrapped)
            sb.append(indent(depth)).append("}\n");
        open.remove(open.size() - 1);
    }

    private static void appendEdges(StringBuilder sb, Graph graph) {
        String separator = graph.isDirected() ? " -> " : " -- ";
        for (var targets : graph.edgesFrom().entrySet()) {
            String from = escape(targets.getKey());
            for (var slots : targets.getValue().entrySet()) {
                String to = escape(slots.getKey());
                for (EdgeRecord record : slots.getValue().values()) {
                    sb.append(INDENT).append(from);
                    if (record.getPortFrom() != null)
                        sb.append(':').append(escape(record.getPortFrom()));
                    sb.append(separator).append(to);
                    if (record.getPortTo() != null)
                        sb.append(':').append(escape(record.getPortTo()));
                    appendAttributeList(sb, edgeAttributeList(record.getAttributes()));
                    sb.append(";\n");
                }
            }
        }
    }

    // lhead/ltail name a cluster, so they get the same prefix as the emitted block
    private static List<String> edgeAttributeList(Map<String, Object> attributes) {
        List<String> list = new ArrayList<>();
        if (attributes == null)
            return list;
        for (Map.Entry<String, Object> e : attributes.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (("lhead".equals(key) || "ltail".equals(key)) && value != null)
                value = clusterName(value.toString());
            list.add(IdentifierEscaper.escapeKey(key) + '=' + IdentifierEscaper.escapeValue(key, value));
        }
        return list;
    }

    private static List<String> attributeList(Map<String, String> escaped) {
        List<String> list = new ArrayList<>(escaped.size());
        escaped.forEach((k, v) -> list.add(k + '=' + v));
        return list;
    }

    private static void appendAttributeList(StringBuilder sb, List<String> attributes) {
        if (!attributes.isEmpty())
            sb.append(" [ ").append(String.join(",", attributes)).append(" ]");
    }

    /** Adds the {@code cluster_} prefix the renderer needs, unless already present. */
    static String clusterName(String id) {
        return id.regionMatches(true, 0, CLUSTER_PREFIX, 0, CLUSTER_PREFIX.length()) ? id : CLUSTER_PREFIX + '_' + id;
    }

    private static String indent(int depth) {
        return INDENT.repeat(depth);
    }
}
