package com.graphkit.dot.api;

import java.nio.file.Path;

import com.graphkit.dot.render.RenderCommand;

/**
 * Turns a DOT file into a rendered artifact.
 *
 * <p>
 * Implementations only report whether the artifact was produced; they never look
 * at its content.
 */
public interface GraphRenderer {

    /**
     * Renders {@code dotFile} into {@code outputFile}.
     *
     * @param dotFile    existing DOT source.
     * @param outputFile where the artifact is written.
     * @param format     output format name understood by the layout engine, e.g.
     *                   {@code svg} or {@code png}.
     * @param command    the layout engine to run.
     * @return true if a fresh artifact was produced.
     * @throws IllegalArgumentException if {@code dotFile} does not exist.
     */
    boolean render(Path dotFile, Path outputFile, String format, RenderCommand command);
}
