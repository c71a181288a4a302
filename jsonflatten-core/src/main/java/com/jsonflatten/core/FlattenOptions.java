package com.jsonflatten.core;

import java.util.Objects;

/**
 * Settings for one flatten call.
 *
 * @param prefix            prepended once to every produced key (null means "")
 * @param style             decoration of nested key segments
 * @param depth             nesting levels to collapse into keys: 0 keeps the input whole,
 *                          negative is unlimited
 * @param preserveSequences keep arrays as values instead of indexing into them
 */
public record FlattenOptions(
    String prefix,
    SeparatorStyle style,
    int depth,
    boolean preserveSequences
) {

    /** Depth value meaning "no limit". */
    public static final int UNLIMITED = -1;

    public FlattenOptions {
        prefix = prefix != null ? prefix : "";
        Objects.requireNonNull(style, "style");
    }

    public static FlattenOptions defaults() {
        return new FlattenOptions("", SeparatorStyle.DOT, UNLIMITED, false);
    }

    public FlattenOptions withPrefix(String prefix) {
        return new FlattenOptions(prefix, style, depth, preserveSequences);
    }

    public FlattenOptions withStyle(SeparatorStyle style) {
        return new FlattenOptions(prefix, style, depth, preserveSequences);
    }

    public FlattenOptions withDepth(int depth) {
        return new FlattenOptions(prefix, style, depth, preserveSequences);
    }

    public FlattenOptions withPreserveSequences(boolean preserveSequences) {
        return new FlattenOptions(prefix, style, depth, preserveSequences);
    }
}
