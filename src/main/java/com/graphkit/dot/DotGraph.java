package com.graphkit.dot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.graphkit.dot.api.GraphRenderer;
import com.graphkit.dot.core.DotSerializer;
import com.graphkit.dot.io.GraphStore;
import com.graphkit.dot.model.Graph;
import com.graphkit.dot.render.ProcessGraphRenderer;
import com.graphkit.dot.render.RenderCommand;

/**
 * A {@link Graph} bundled with the collaborators that consume it.
 * <p>
 * This class handles:
 * <ul>
 * <li>Serializing the model to DOT text ({@link #parse()})</li>
 * <li>Writing that text to a file ({@link #saveParsedGraph(Path)})</li>
 * <li>Running a {@link GraphRenderer} on it ({@link #renderDotFile},
 * {@link #fetch})</li>
 * <li>Persisting the model itself ({@link #save(Path)}, {@link #load(Path)})</li>
 * </ul>
 * Mutate the graph through {@link #graph()}.
 */
public class DotGraph {
    private static final Logger log = LogManager.getLogger(DotGraph.class);

    private final Graph graph;
    private final DotSerializer serializer;
    private final GraphRenderer renderer;
    private final GraphStore store;

    public DotGraph(Graph graph) {
        this(graph, ProcessGraphRenderer.builder().build());
    }

    public DotGraph(Graph graph, GraphRenderer renderer) {
        this(graph, new DotSerializer(), renderer, new GraphStore());
    }

    public DotGraph(Graph graph, DotSerializer serializer, GraphRenderer renderer, GraphStore store) {
        this.graph = graph;
        this.serializer = serializer;
        this.renderer = renderer;
        this.store = store;
    }

    public Graph graph() {
        return graph;
    }

    /** The graph as DOT text. */
    public String parse() {
        return serializer.serialize(graph);
    }

    /**
     * Writes the DOT text to {@code file}, or to a new temporary file when
     * {@code file} is null.
     *
     * @return the file written.
     * @throws IllegalStateException if serialization produced no text.
     */
    public Path saveParsedGraph(Path file) throws IOException {
        String dot = parse();
        if (dot.isEmpty())
            throw new IllegalStateException("Could not save graph " + graph.getName() + ": nothing to write");
        Path target = file != null ? file : Files.createTempFile("graph", ".dot");
        Files.writeString(target, dot, StandardCharsets.UTF_8);
        log.info("DOT source for graph {} written to {}", graph.getName(), target);
        return target;
    }

    /**
     * Renders an existing DOT file.
     *
     * @param command {@code "dot"} or {@code "neato"}; anything else, including
     *                null, picks the engine matching the graph's directedness.
     */
    public boolean renderDotFile(Path dotFile, Path outputFile, String format, String command) {
        return renderer.render(dotFile, outputFile, format, RenderCommand.resolve(command, graph.isDirected()));
    }

    /**
     * Renders the graph and returns the artifact's bytes. Both temporary files are
     * removed afterwards.
     *
     * @return empty if rendering failed and the renderer reports failures as
     *         {@code false}.
     */
    public Optional<byte[]> fetch(String format, String command) throws IOException {
        Path dotFile = saveParsedGraph(null);
        Path outputFile = dotFile.resolveSibling(dotFile.getFileName() + "." + format);
        try {
            if (!renderDotFile(dotFile, outputFile, format, command))
                return Optional.empty();
            return Optional.of(Files.readAllBytes(outputFile));
        } finally {
            Files.deleteIfExists(dotFile);
            Files.deleteIfExists(outputFile);
        }
    }

    /** Persists the model, see {@link GraphStore#save(Graph, Path)}. */
    public Path save(Path file) throws IOException {
        return store.save(graph, file);
    }

    /** Replaces the model with a persisted one, see {@link GraphStore#load(Path, Graph)}. */
    public boolean load(Path file) throws IOException {
        return store.load(file, graph);
    }
}
