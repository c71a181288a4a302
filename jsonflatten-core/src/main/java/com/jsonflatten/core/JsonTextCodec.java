package com.jsonflatten.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.Strictness;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Converts between JSON text and the tree model used by {@link Flattener}.
 *
 * Decoding only accepts text whose first non-whitespace character is an opening brace.
 * Encoding keeps JSON nulls, orders object keys by their UTF-8 bytes and escapes only
 * {@code <}, {@code >} and {@code &}, so identical input always gives identical text.
 */
public final class JsonTextCodec {

    private static final Pattern JSON_OBJECT_START = Pattern.compile("^\\s*\\{");

    /** UTF-8 byte order, which is Unicode code point order. */
    static final Comparator<String> KEY_ORDER = JsonTextCodec::compareCodePoints;

    private static final Gson DECODER = new GsonBuilder()
            .setStrictness(Strictness.STRICT)
            .create();

    private static final Gson ENCODER = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private static final Gson PRETTY_ENCODER = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private JsonTextCodec() {}

    /**
     * Parses {@code text} as a JSON object.
     *
     * @throws NotValidJsonInputException if the text is null, empty, or does not start with '{'
     * @throws com.google.gson.JsonSyntaxException if the text is not well-formed JSON
     */
    public static JsonObject decodeMapping(String text) {
        if (text == null || !JSON_OBJECT_START.matcher(text).find()) {
            throw new NotValidJsonInputException();
        }
        return DECODER.fromJson(text, JsonObject.class);
    }

    /** Compact JSON text for a flat map. */
    public static String encode(Map<String, JsonElement> flat) {
        return escapeHtml(ENCODER.toJson(sortedObject(flat)));
    }

    /** Indented JSON text for a flat map. */
    public static String encodePretty(Map<String, JsonElement> flat) {
        return escapeHtml(PRETTY_ENCODER.toJson(sortedObject(flat)));
    }

    // '<', '>' and '&' are not JSON syntax, so any occurrence is inside a string or name
    private static String escapeHtml(String json) {
        return json.replace("<", "\\u003c")
                .replace(">", "\\u003e")
                .replace("&", "\\u0026");
    }

    /**
     * Copies {@code members} into a new object with keys sorted at every level,
     * including sub-trees kept verbatim by a depth limit. Uses an explicit stack.
     */
    private static JsonObject sortedObject(Map<String, JsonElement> members) {
        JsonObject root = new JsonObject();
        Deque<CopyStep> pending = new ArrayDeque<>();
        pushMembers(pending, root, members);

        while (!pending.isEmpty()) {
            CopyStep step = pending.pop();
            JsonElement source = step.source() != null ? step.source() : JsonNull.INSTANCE;
            JsonElement copy;
            if (source.isJsonObject()) {
                JsonObject object = new JsonObject();
                pushMembers(pending, object, source.getAsJsonObject().asMap());
                copy = object;
            } else if (source.isJsonArray()) {
                JsonArray elements = source.getAsJsonArray();
                JsonArray array = new JsonArray(elements.size());
                for (int i = elements.size() - 1; i >= 0; i--) {
                    pending.push(new CopyStep(array, null, elements.get(i)));
                }
                copy = array;
            } else {
                copy = source;
            }

            if (step.parent().isJsonObject()) {
                step.parent().getAsJsonObject().add(step.key(), copy);
            } else {
                step.parent().getAsJsonArray().add(copy);
            }
        }
        return root;
    }

    // Pushed last-key-first so members are popped, and added, in sorted order
    private static void pushMembers(Deque<CopyStep> pending, JsonObject parent, Map<String, JsonElement> members) {
        TreeMap<String, JsonElement> sorted = new TreeMap<>(KEY_ORDER);
        sorted.putAll(members);
        sorted.descendingMap().forEach((key, value) -> pending.push(new CopyStep(parent, key, value)));
    }

    private static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    private record CopyStep(JsonElement parent, String key, JsonElement source) {}

    /** Raised when input text cannot be a JSON object. */
    public static class NotValidJsonInputException extends FlattenException {
        public static final String MESSAGE = "not a valid input, must be a mapping";

        public NotValidJsonInputException() { super(MESSAGE); }
    }
}
