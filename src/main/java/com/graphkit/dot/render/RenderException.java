package com.graphkit.dot.render;

import java.util.List;
import java.util.Locale;

import lombok.Getter;

/**
 * Detailed render failure, raised instead of a {@code false} result when the
 * renderer runs with verbose errors.
 */
@Getter
public class RenderException extends RuntimeException {
    private final RenderCommand command;
    private final int exitCode;
    private final List<String> output;

    public RenderException(RenderCommand command, int exitCode, List<String> output) {
        this(command, exitCode, output, null);
    }

    public RenderException(RenderCommand command, int exitCode, List<String> output, Throwable cause) {
        super(command.name().toLowerCase(Locale.ROOT) + " command failed (exit " + exitCode + "): " + String.join("\n", output),
                cause);
        this.command = command;
        this.exitCode = exitCode;
        this.output = List.copyOf(output);
    }
}
