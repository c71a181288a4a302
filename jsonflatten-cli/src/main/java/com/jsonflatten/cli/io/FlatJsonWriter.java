package com.jsonflatten.cli.io;

import com.google.gson.JsonElement;
import com.jsonflatten.core.JsonTextCodec;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes a flat map as JSON text, to a file or to a stream.
 * Keys are sorted so identical input produces identical output.
 * Output always ends with a single {@code \n}, whatever the platform.
 */
public class FlatJsonWriter {

    public static class WriteException extends RuntimeException {
        public WriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final boolean pretty;

    public FlatJsonWriter(boolean pretty) {
        this.pretty = pretty;
    }

    public String render(Map<String, JsonElement> flat) {
        return pretty ? JsonTextCodec.encodePretty(flat) : JsonTextCodec.encode(flat);
    }

    /**
     * Writes {@code flat} to {@code outputFile}, creating parent directories if absent.
     */
    public void write(Map<String, JsonElement> flat, Path outputFile) {
        Path parent = outputFile.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new WriteException("Could not create output directory: " + parent, e);
        }

        try {
            Files.writeString(outputFile, render(flat) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WriteException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
    }

    public void write(Map<String, JsonElement> flat, PrintStream out) {
        out.print(render(flat) + "\n");
        out.flush();
    }
}
