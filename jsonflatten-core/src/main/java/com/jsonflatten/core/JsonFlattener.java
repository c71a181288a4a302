package com.jsonflatten.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flattens nested JSON objects into single-level maps whose keys encode the path
 * to each value.
 *
 * <pre>
 *   {"a": {"b": "c"}, "z": ["one", "two"]}
 *     flatten, DOT            -> {"a.b": "c", "z.0": "one", "z.1": "two"}
 *     preserving sequences    -> {"a.b": "c", "z": ["one", "two"]}
 * </pre>
 *
 * Depth counts the nesting levels collapsed into keys. With depth 0 the input is returned
 * whole under the prefix; with a negative depth every level is collapsed.
 *
 * All methods are stateless and safe to call from several threads.
 */
public final class JsonFlattener {

    private static final Gson TREE_MAPPER = new GsonBuilder()
            .serializeNulls()
            .create();

    private JsonFlattener() {}

    // -----------------------------------------------------------------------
    // Tree in, tree out
    // -----------------------------------------------------------------------

    public static Map<String, JsonElement> flatten(JsonObject nested, String prefix, SeparatorStyle style, int depth) {
        return flatten(nested, new FlattenOptions(prefix, style, depth, false));
    }

    public static Map<String, JsonElement> flattenPreservingSequences(
            JsonObject nested, String prefix, SeparatorStyle style, int depth) {
        return flatten(nested, new FlattenOptions(prefix, style, depth, true));
    }

    public static Map<String, JsonElement> flatten(JsonObject nested, FlattenOptions options) {
        Objects.requireNonNull(nested, "nested");
        return flattenInternal(nested, options);
    }

    /**
     * Flattens a plain Java structure of maps, lists, arrays, strings, numbers, booleans and nulls.
     * Other objects are converted field by field, the way Gson serializes them.
     */
    public static Map<String, JsonElement> flattenMap(Map<String, ?> nested, FlattenOptions options) {
        Objects.requireNonNull(nested, "nested");
        return flattenInternal(TREE_MAPPER.toJsonTree(nested), options);
    }

    // -----------------------------------------------------------------------
    // Text in, text out
    // -----------------------------------------------------------------------

    /**
     * Flattens JSON text and returns the flat map as compact JSON text with sorted keys.
     *
     * @throws JsonTextCodec.NotValidJsonInputException if the text does not start with '{'
     * @throws com.google.gson.JsonSyntaxException if the text is malformed
     */
    public static String flattenString(String nested, String prefix, SeparatorStyle style, int depth) {
        return flattenString(nested, new FlattenOptions(prefix, style, depth, false));
    }

    public static String flattenStringPreservingSequences(
            String nested, String prefix, SeparatorStyle style, int depth) {
        return flattenString(nested, new FlattenOptions(prefix, style, depth, true));
    }

    public static String flattenString(String nested, FlattenOptions options) {
        JsonObject tree = JsonTextCodec.decodeMapping(nested);
        return JsonTextCodec.encode(flattenInternal(tree, options));
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static Map<String, JsonElement> flattenInternal(JsonElement nested, FlattenOptions options) {
        // Entering the root object consumes one level, so a positive depth gets one extra
        int depth = options.depth() > 0 ? options.depth() + 1 : options.depth();

        Map<String, JsonElement> flat = new LinkedHashMap<>();
        Flattener.flattenInto(true, flat, nested, options.prefix(), options.style(), depth,
                options.preserveSequences());
        return flat;
    }
}
