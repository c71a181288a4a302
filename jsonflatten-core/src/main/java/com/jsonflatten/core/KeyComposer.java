package com.jsonflatten.core;

/**
 * Builds the flattened key for one level of nesting.
 */
public final class KeyComposer {

    private KeyComposer() {}

    /**
     * Appends {@code subKey} to {@code prefix}.
     *
     * At the top level the sub-key is appended as-is, so a caller-supplied prefix
     * reads as a plain leading token ({@code "flag-" + "a"}). Below the top level
     * the sub-key is decorated with the style's before/middle/after strings.
     */
    public static String compose(boolean topLevel, String prefix, String subKey, SeparatorStyle style) {
        if (topLevel) {
            return prefix + subKey;
        }
        return prefix + style.before() + style.middle() + subKey + style.after();
    }
}
