package com.graphkit.dot.model;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class GraphTest {

    private static final Edge AB = Edge.of("A", "B");

    private static Graph nonStrict() {
        return Graph.builder().strict(false).build();
    }

    @Test
    public void testDefaults() {
        Graph g = new Graph();
        assertTrue(g.isDirected());
        assertTrue(g.isStrict());
        assertEquals("G", g.getName());
        assertTrue(g.attributes().isEmpty());
        assertTrue(g.nodes().isEmpty());
    }

    @Test
    public void testStrictCollapsesEdgesAndMergesAttributes() {
        Graph g = new Graph();
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("color", "red");
        first.put("style", "bold");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("color", "blue");
        second.put("label", "x");

        assertEquals(0, g.addEdge(AB, first));
        assertEquals(0, g.addEdge(AB, second));

        Map<Integer, EdgeRecord> records = g.edges("A", "B");
        assertEquals(1, records.size());
        Map<String, Object> merged = records.get(0).getAttributes();
        assertEquals("blue", merged.get("color"));
        assertEquals("bold", merged.get("style"));
        assertEquals("x", merged.get("label"));
        assertEquals(Arrays.asList("color", "style", "label"), List.copyOf(merged.keySet()));
    }

    @Test
    public void testStrictMergeKeepsPortsUnlessReplaced() {
        Graph g = new Graph();
        g.addEdge(AB, null, Map.of("A", "east"));
        g.addEdge(AB, null, Map.of("B", "west"));

        EdgeRecord rec = g.edges("A", "B").get(0);
        assertEquals("east", rec.getPortFrom());
        assertEquals("west", rec.getPortTo());

        g.addEdge(AB, null, Map.of("A", "north"));
        assertEquals("north", g.edges("A", "B").get(0).getPortFrom());
    }

    @Test
    public void testNonStrictAccumulatesInCallOrder() {
        Graph g = nonStrict();
        for (int i = 0; i < 4; i++)
            assertEquals(i, g.addEdge(AB, Map.of("n", i)));

        Map<Integer, EdgeRecord> records = g.edges("A", "B");
        assertEquals(Arrays.asList(0, 1, 2, 3), List.copyOf(records.keySet()));
        assertEquals(2, records.get(2).getAttributes().get("n"));
    }

    @Test
    public void testRemoveEdgeByIdKeepsOtherIds() {
        Graph g = nonStrict();
        g.addEdge(AB);
        g.addEdge(AB);
        g.addEdge(AB);

        g.removeEdge(AB, 1);
        assertEquals(Arrays.asList(0, 2), List.copyOf(g.edges("A", "B").keySet()));
        assertEquals(3, g.addEdge(AB));

        g.removeEdge(AB, 0);
        g.removeEdge(AB, 2);
        g.removeEdge(AB, 3);
        assertTrue(g.edges("A", "B").isEmpty());
        assertFalse(g.edgesFrom().get("A").containsKey("B"));
    }

    @Test
    public void testRemoveEdgeUnknownIdIsNoOp() {
        Graph g = nonStrict();
        g.addEdge(AB);
        g.removeEdge(AB, 7);
        g.removeEdge(Edge.of("X", "Y"), 0);
        assertEquals(1, g.edges("A", "B").size());
    }

    @Test
    public void testRemoveEdgeWithoutIdDropsWholePair() {
        Graph g = nonStrict();
        g.addEdge(AB);
        g.addEdge(AB);
        g.addEdge(Edge.of("A", "C"));

        g.removeEdge(AB);
        assertTrue(g.edges("A", "B").isEmpty());
        assertEquals(1, g.edges("A", "C").size());
    }

    @Test
    public void testPortsApplyToBothEndsOfSelfLoop() {
        Graph g = new Graph();
        g.addEdge(Edge.of("A", "A"), null, Map.of("A", "p"));
        EdgeRecord rec = g.edges("A", "A").get(0);
        assertEquals("p", rec.getPortFrom());
        assertEquals("p", rec.getPortTo());
    }

    @Test
    public void testRemoveNodeLeavesEdges() {
        Graph g = new Graph();
        g.addNode("A");
        g.addNode("B");
        g.addEdge("A", "B");

        g.removeNode("A");
        assertFalse(g.nodes().get(Graph.DEFAULT_GROUP).containsKey("A"));
        assertEquals(1, g.edges("A", "B").size());
    }

    @Test
    public void testAddNodeOverwritesAttributes() {
        Graph g = new Graph();
        g.addNode("A", Map.of("shape", "box"));
        g.addNode("A", Map.of("color", "red"));
        assertEquals(Map.of("color", "red"), g.nodes().get(Graph.DEFAULT_GROUP).get("A"));
    }

    @Test
    public void testAddClusterCreatesNodeBucket() {
        Graph g = new Graph();
        g.addCluster("c1", "Title");
        assertTrue(g.nodes().containsKey("c1"));
        assertTrue(g.nodes().get("c1").isEmpty());

        GroupInfo info = g.clusters().get("c1");
        assertEquals("Title", info.getTitle());
        assertEquals(Graph.DEFAULT_GROUP, info.getEmbedIn());
    }

    @Test
    public void testAddClusterKeepsExistingNodes() {
        Graph g = new Graph();
        g.addNode("n", null, "c1");
        g.addCluster("c1", "");
        assertTrue(g.nodes().get("c1").containsKey("n"));
    }

    @Test
    public void testGroupUpsertReplacesInfo() {
        Graph g = new Graph();
        g.addSubgraph("s", "one", Map.of("rank", "same"));
        g.addSubgraph("s", "two", null, "other");
        GroupInfo info = g.subgraphs().get("s");
        assertEquals("two", info.getTitle());
        assertEquals("other", info.getEmbedIn());
        assertTrue(info.getAttributes().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testClusterIdCannotBeSubgraph() {
        Graph g = new Graph();
        g.addSubgraph("shared", "");
        g.addCluster("shared", "");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSubgraphIdCannotBeCluster() {
        Graph g = new Graph();
        g.addCluster("shared", "");
        g.addSubgraph("shared", "");
    }

    @Test
    public void testNullAttributeMapsAreIgnored() {
        Graph g = Graph.builder().attribute("rankdir", "LR").build();
        g.setAttributes(null);
        g.addAttributes(null);
        assertEquals(Map.of("rankdir", "LR"), g.attributes());
    }

    @Test
    public void testAddAttributesMerges() {
        Graph g = Graph.builder().attribute("rankdir", "LR").attribute("size", "4,4").build();
        g.addAttributes(Map.of("rankdir", "TB", "bgcolor", "white"));
        assertEquals("TB", g.attributes().get("rankdir"));
        assertEquals("4,4", g.attributes().get("size"));
        assertEquals("white", g.attributes().get("bgcolor"));

        g.setAttributes(Map.of("splines", "ortho"));
        assertEquals(Map.of("splines", "ortho"), g.attributes());
    }

    @Test
    public void testSetDirected() {
        Graph g = new Graph();
        g.setDirected(false);
        assertFalse(g.isDirected());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testViewsAreReadOnly() {
        new Graph().nodes().put("x", new LinkedHashMap<>());
    }

    @Test
    public void testNestedViewsAreReadOnly() {
        Graph g = new Graph();
        g.addNode("A", Map.of("shape", "box"));
        g.addEdge(AB, Map.of("label", "x"));
        g.addCluster("c", "C");

        assertReadOnly(() -> g.nodes().get(Graph.DEFAULT_GROUP).put("INJECTED", new LinkedHashMap<>()));
        assertReadOnly(() -> g.nodes().get(Graph.DEFAULT_GROUP).get("A").put("shape", "circle"));
        assertReadOnly(() -> g.edgesFrom().get("A").remove("B"));
        assertReadOnly(() -> g.edgesFrom().get("A").get("B").clear());
        assertReadOnly(() -> g.edges("A", "B").get(0).getAttributes().put("color", "red"));
        assertReadOnly(() -> g.clusters().get("c").getAttributes().put("color", "red"));
    }

    @Test
    public void testViewRecordsAreDetached() {
        Graph g = new Graph();
        g.addEdge(AB, Map.of("label", "x"));
        g.addCluster("c", "C");

        g.edges("A", "B").get(0).setPortFrom("p");
        g.edges("A", "B").get(0).setAttributes(new LinkedHashMap<>(Map.of("color", "red")));
        g.clusters().get("c").setEmbedIn("c");
        g.clusters().get("c").setTitle("changed");

        EdgeRecord rec = g.edges("A", "B").get(0);
        assertNull(rec.getPortFrom());
        assertEquals(Map.of("label", "x"), rec.getAttributes());
        GroupInfo info = g.clusters().get("c");
        assertEquals(Graph.DEFAULT_GROUP, info.getEmbedIn());
        assertEquals("C", info.getTitle());
    }

    private static void assertReadOnly(Runnable mutation) {
        try {
            mutation.run();
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException expected) {
            // read-only
        }
    }

    @Test
    public void testSnapshotIsDetached() {
        Graph g = nonStrict();
        g.addNode("A", Map.of("shape", "box"));
        g.addEdge(AB, Map.of("color", "red"));
        g.addCluster("c", "C");

        GraphState state = g.snapshot();
        g.addNode("A", Map.of("shape", "circle"));
        g.addEdge(AB);
        g.addCluster("c", "changed");

        assertEquals("box", state.getNodes().get(Graph.DEFAULT_GROUP).get("A").get("shape"));
        assertEquals(1, state.getEdgesFrom().get("A").get("B").size());
        assertEquals("C", state.getClusters().get("c").getTitle());
        assertFalse(state.isStrict());
    }

    @Test
    public void testRestoreReplacesEverything() {
        Graph source = Graph.builder().name("src").directed(false).strict(false).attribute("k", "v").build();
        source.addNode("n", null, "s");
        source.addSubgraph("s", "Sub");
        source.addEdge("n", "m");
        source.addEdge("n", "m");

        Graph target = new Graph();
        target.addNode("old");
        target.restore(source.snapshot());

        assertEquals("src", target.getName());
        assertFalse(target.isDirected());
        assertFalse(target.isStrict());
        assertEquals(Map.of("k", "v"), target.attributes());
        assertFalse(target.nodes().containsKey(Graph.DEFAULT_GROUP));
        assertEquals(2, target.edges("n", "m").size());
        assertEquals(2, target.addEdge("n", "m"));
    }

    @Test
    public void testRestoreToleratesMissingFields() {
        GraphState state = new GraphState();
        state.setName(null);
        state.setNodes(null);
        state.setClusters(null);
        GroupInfo partial = new GroupInfo(null, null, null);
        state.getSubgraphs().put("s", partial);

        Graph g = new Graph();
        g.restore(state);
        assertEquals("G", g.getName());
        assertTrue(g.nodes().isEmpty());
        GroupInfo info = g.subgraphs().get("s");
        assertEquals("", info.getTitle());
        assertEquals(Graph.DEFAULT_GROUP, info.getEmbedIn());
        assertTrue(info.getAttributes().isEmpty());
    }
}
