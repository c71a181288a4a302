package com.jsonflatten.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Decoration applied to each nested key segment:
 *   parent + before + middle + segment + after
 *
 * The top-level segment is never decorated.
 */
public record SeparatorStyle(String before, String middle, String after) {

    /** {@code a.b.c} */
    public static final SeparatorStyle DOT = new SeparatorStyle("", ".", "");
    /** {@code a/b/c} */
    public static final SeparatorStyle PATH = new SeparatorStyle("", "/", "");
    /** {@code a[b][c]} */
    public static final SeparatorStyle RAILS = new SeparatorStyle("[", "", "]");
    /** {@code a_b_c} */
    public static final SeparatorStyle UNDERSCORE = new SeparatorStyle("", "_", "");

    public SeparatorStyle {
        before = before != null ? before : "";
        middle = middle != null ? middle : "";
        after  = after  != null ? after  : "";
    }

    /** Style with only a middle separator, e.g. {@code "--"} gives {@code a--b}. */
    public static SeparatorStyle middle(String middle) {
        return new SeparatorStyle("", middle, "");
    }

    /** Style that wraps each nested segment, e.g. {@code "(" ")"} gives {@code a(b)(c)}. */
    public static SeparatorStyle wrapping(String before, String after) {
        return new SeparatorStyle(before, "", after);
    }

    /**
     * Resolves one of the predefined styles by name (dot, path, rails, underscore).
     *
     * @throws IllegalArgumentException if the name is not a predefined style
     */
    public static SeparatorStyle named(String name) {
        Objects.requireNonNull(name, "style name");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "dot"        -> DOT;
            case "path"       -> PATH;
            case "rails"      -> RAILS;
            case "underscore" -> UNDERSCORE;
            default -> throw new IllegalArgumentException("Unknown separator style: " + name
                    + " (expected dot, path, rails or underscore)");
        };
    }
}
