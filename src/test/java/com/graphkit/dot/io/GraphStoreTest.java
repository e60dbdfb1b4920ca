package com.graphkit.dot.io;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.graphkit.dot.core.DotSerializer;
import com.graphkit.dot.model.Edge;
import com.graphkit.dot.model.EdgeRecord;
import com.graphkit.dot.model.Graph;

public class GraphStoreTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final GraphStore store = new GraphStore();
    private final DotSerializer serializer = new DotSerializer();

    @Test
    public void testLegacyEdgesAreReplayed() throws IOException {
        Graph g = new Graph();
        assertTrue(store.fromJson("{\"edges\":[{\"X\":\"Y\"}],\"edgeAttributes\":[{\"color\":\"red\"}]}", g));

        Map<Integer, EdgeRecord> records = g.edges("X", "Y");
        assertEquals(1, records.size());
        assertEquals(Map.of("color", "red"), records.get(0).getAttributes());

        String json = store.toJson(g);
        assertFalse(json.contains("\"edges\""));
        assertFalse(json.contains("edgeAttributes"));
    }

    @Test
    public void testLegacyEdgesFollowStrictness() {
        String legacy = "{\"strict\":%s,\"edges\":[{\"X\":\"Y\"},{\"X\":\"Y\"},{\"bad\":1,\"worse\":2}],"
                + "\"edgeAttributes\":{\"0\":{\"color\":\"red\"},\"1\":{\"style\":\"dashed\"}}}";

        Graph strict = new Graph();
        assertTrue(store.fromJson(String.format(legacy, "true"), strict));
        assertEquals(1, strict.edges("X", "Y").size());
        assertEquals(Map.of("color", "red", "style", "dashed"), strict.edges("X", "Y").get(0).getAttributes());

        Graph multi = new Graph();
        assertTrue(store.fromJson(String.format(legacy, "false"), multi));
        assertEquals(List.of(0, 1), List.copyOf(multi.edges("X", "Y").keySet()));
        assertEquals(Map.of("style", "dashed"), multi.edges("X", "Y").get(1).getAttributes());
        assertEquals(1, multi.edgesFrom().size());
    }

    @Test
    public void testLegacyEdgesKeyedByIndex() {
        Graph g = Graph.builder().strict(false).build();
        assertTrue(store.fromJson("{\"strict\":false,\"edges\":{\"3\":{\"A\":\"B\"}},"
                + "\"edgeAttributes\":{\"3\":{\"weight\":2}}}", g));
        assertEquals(Map.of("weight", 2), g.edges("A", "B").get(0).getAttributes());
    }

    @Test
    public void testMissingFieldsTakeDefaults() {
        Graph g = Graph.builder().name("before").directed(false).strict(false).attribute("k", "v").build();
        g.addNode("stale");
        assertTrue(store.fromJson("{}", g));

        assertEquals("G", g.getName());
        assertTrue(g.isDirected());
        assertTrue(g.isStrict());
        assertTrue(g.attributes().isEmpty());
        assertTrue(g.nodes().isEmpty());
    }

    @Test
    public void testNonObjectInputIsIgnored() {
        Graph g = Graph.builder().name("kept").build();
        g.addNode("n");
        for (String json : new String[] { "[1,2]", "\"text\"", "42", "null", "", "   ", "not json {" })
            assertFalse(json, store.fromJson(json, g));

        assertEquals("kept", g.getName());
        assertTrue(g.nodes().get(Graph.DEFAULT_GROUP).containsKey("n"));
    }

    @Test
    public void testSaveAndLoadRoundTrip() throws IOException {
        Graph g = Graph.builder().name("round").strict(false).attribute("rankdir", "LR").build();
        g.addCluster("c", "Cluster \"C\"", Map.of("style", "filled"));
        g.addSubgraph("s", "", Map.of("rank", "same"), "c");
        g.addNode("a", Map.of("shape", "box", "fixedsize", true), "c");
        g.addNode("b", Map.of("width", 1.5), "s");
        g.addNode("loose");
        g.addEdge(Edge.of("a", "b"), Map.of("lhead", "s"), Map.of("a", "out"));
        g.addEdge(Edge.of("a", "b"));
        g.addEdge(Edge.of("a", "b"));
        g.removeEdge(Edge.of("a", "b"), 1);

        Path file = store.save(g, tmp.getRoot().toPath().resolve("graph.json"));
        assertTrue(Files.exists(file));

        Graph loaded = new Graph();
        assertTrue(store.load(file, loaded));
        assertEquals(serializer.serialize(g), serializer.serialize(loaded));
        assertEquals(List.of(0, 2), List.copyOf(loaded.edges("a", "b").keySet()));
        assertEquals("out", loaded.edges("a", "b").get(0).getPortFrom());
        assertEquals(3, loaded.addEdge(Edge.of("a", "b")));
    }

    @Test
    public void testSaveToTemporaryFile() throws IOException {
        Path file = store.save(new Graph(), null);
        try {
            assertTrue(Files.size(file) > 0);
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test(expected = IOException.class)
    public void testLoadMissingFileFails() throws IOException {
        store.load(tmp.getRoot().toPath().resolve("absent.json"), new Graph());
    }
}
