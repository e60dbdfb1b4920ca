package com.graphkit.dot.render;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.graphkit.dot.api.GraphRenderer;

import lombok.extern.log4j.Log4j2;

/**
 * Renders DOT files by running the Graphviz executables.
 *
 * <p>
 * The command line is {@code <binPath><engine> -T<format> -o<output> <dotFile>}
 * with stderr folded into stdout. A render counts as successful when the process
 * exits with 0 and the output file's modification time moved forward. The
 * timestamps are compared at whatever resolution the filesystem records: on
 * filesystems with one or two second granularity, re-rendering over an existing
 * output file within the same tick is reported as a failure. Failures
 * are returned as {@code false}, or raised as {@link RenderException} carrying
 * the captured process output when {@code verboseErrors} is set. Nothing is
 * retried.
 *
 * <pre>{@code
 * GraphRenderer renderer = ProcessGraphRenderer.builder()
 *         .binPath("/usr/local/bin/")
 *         .verboseErrors(true)
 *         .build();
 * }</pre>
 */
@Log4j2
public final class ProcessGraphRenderer implements GraphRenderer {
    private final String binPath;
    private final String dotCommand;
    private final String neatoCommand;
    private final boolean verboseErrors;

    private ProcessGraphRenderer(Builder b) {
        this.binPath = b.binPath;
        this.dotCommand = b.dotCommand;
        this.neatoCommand = b.neatoCommand;
        this.verboseErrors = b.verboseErrors;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isVerboseErrors() {
        return verboseErrors;
    }

    @Override
    public boolean render(Path dotFile, Path outputFile, String format, RenderCommand command) {
        Objects.requireNonNull(command, "command");
        if (!Files.exists(dotFile))
            throw new IllegalArgumentException("Could not find dot file: " + dotFile);

        long before = lastModified(outputFile);
        List<String> commandLine = List.of(executable(command), "-T" + format, "-o" + outputFile,
                dotFile.toString());

        List<String> output = new ArrayList<>();
        int exitCode = -1;
        Exception failure = null;
        try {
            Process process = new ProcessBuilder(commandLine).redirectErrorStream(true).start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null)
                    output.add(line);
            }
            exitCode = process.waitFor();
        } catch (IOException e) {
            failure = e;
            output.add(String.valueOf(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
            output.add("Interrupted while waiting for " + commandLine.get(0));
        }

        if (failure == null && exitCode == 0 && lastModified(outputFile) > before) {
            log.debug("Rendered {} to {} with {}", dotFile, outputFile, command);
            return true;
        }

        log.warn("{} failed to render {} (exit {}): {}", commandLine.get(0), dotFile, exitCode, output);
        if (!verboseErrors)
            return false;
        throw new RenderException(command, exitCode, output, failure);
    }

    String executable(RenderCommand command) {
        return binPath + (command == RenderCommand.DOT ? dotCommand : neatoCommand);
    }

    private static long lastModified(Path file) {
        if (!Files.exists(file))
            return 0L;
        try {
            return Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read modification time of " + file, e);
        }
    }

    /** Configuration for {@link ProcessGraphRenderer}. */
    public static final class Builder {
        private String binPath = "";
        private String dotCommand = "dot";
        private String neatoCommand = "neato";
        private boolean verboseErrors;

        private Builder() {
        }

        /** Prefix prepended to the executable names, e.g. {@code /opt/graphviz/bin/}. */
        public Builder binPath(String binPath) {
            this.binPath = Objects.requireNonNull(binPath, "binPath");
            return this;
        }

        public Builder dotCommand(String dotCommand) {
            this.dotCommand = Objects.requireNonNull(dotCommand, "dotCommand");
            return this;
        }

        public Builder neatoCommand(String neatoCommand) {
            this.neatoCommand = Objects.requireNonNull(neatoCommand, "neatoCommand");
            return this;
        }

        /** Raise {@link RenderException} on failure instead of returning false. */
        public Builder verboseErrors(boolean verboseErrors) {
            this.verboseErrors = verboseErrors;
            return this;
        }

        public ProcessGraphRenderer build() {
            return new ProcessGraphRenderer(this);
        }
    }
}
