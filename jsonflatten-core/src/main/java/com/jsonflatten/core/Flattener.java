package com.jsonflatten.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Depth-first walk over a JSON tree that writes one entry per leaf into a flat map.
 *
 * Rules:
 * - Objects: each member becomes a key segment
 * - Arrays: each element becomes a key segment named by its 0-based index,
 *   unless arrays are preserved, in which case the whole array is one value
 * - Scalars (primitives and JSON null): written under the composed key
 * - Depth: each object/array level consumes one unit of {@code remainingDepth};
 *   at zero the current node is written verbatim. A negative depth never reaches zero.
 *
 * Pending nodes are kept on an explicit stack, so nesting depth is bounded by heap, not
 * by the thread stack. Entries are written in document order.
 */
public final class Flattener {

    private Flattener() {}

    /**
     * Flattens {@code node} into {@code out}.
     *
     * @param topLevel          true for the outermost call, whose keys are not decorated
     * @param out               accumulator, mutated in place
     * @param node              the object or array to decompose
     * @param prefix            key of {@code node} in the flat map
     * @param style             separator style for nested key segments
     * @param remainingDepth    levels left to decompose; 0 stops, negative is unlimited
     * @param preserveSequences keep arrays as values instead of indexing into them
     * @throws NotValidInputException if {@code node} is a scalar and depth is not exhausted
     */
    public static void flattenInto(
            boolean topLevel,
            Map<String, JsonElement> out,
            JsonElement node,
            String prefix,
            SeparatorStyle style,
            int remainingDepth,
            boolean preserveSequences) {

        if (remainingDepth != 0 && (node == null || !(node.isJsonObject() || node.isJsonArray()))) {
            throw new NotValidInputException(prefix, node);
        }

        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(Frame.container(node, prefix, remainingDepth, topLevel));

        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            JsonElement current = frame.node();

            if (frame.leaf() || frame.remainingDepth() == 0) {
                out.put(frame.key(), current);
            } else if (current.isJsonObject()) {
                pushChildren(pending, objectChildren(current.getAsJsonObject(), frame, style, preserveSequences));
            } else if (preserveSequences) {
                out.put(frame.key(), current);
            } else {
                pushChildren(pending, arrayChildren(current.getAsJsonArray(), frame, style));
            }
        }
    }

    private static List<Frame> objectChildren(
            JsonObject object,
            Frame parent,
            SeparatorStyle style,
            boolean preserveSequences) {

        List<Frame> children = new ArrayList<>(object.size());
        for (Map.Entry<String, JsonElement> member : object.entrySet()) {
            String key = KeyComposer.compose(parent.topLevel(), parent.key(), member.getKey(), style);
            children.add(child(key, member.getValue(), parent, preserveSequences));
        }
        return children;
    }

    private static List<Frame> arrayChildren(JsonArray array, Frame parent, SeparatorStyle style) {
        List<Frame> children = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            String key = KeyComposer.compose(parent.topLevel(), parent.key(), Integer.toString(i), style);
            children.add(child(key, array.get(i), parent, false));
        }
        return children;
    }

    private static Frame child(String key, JsonElement value, Frame parent, boolean preserveSequences) {
        if (value.isJsonObject() || (value.isJsonArray() && !preserveSequences)) {
            return Frame.container(value, key, parent.remainingDepth() - 1, false);
        }
        // primitive, JSON null, or an array kept whole
        return Frame.leaf(value, key);
    }

    // Reversed so the first child is popped first
    private static void pushChildren(Deque<Frame> pending, List<Frame> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }

    private record Frame(JsonElement node, String key, int remainingDepth, boolean topLevel, boolean leaf) {

        static Frame container(JsonElement node, String key, int remainingDepth, boolean topLevel) {
            return new Frame(node, key, remainingDepth, topLevel, false);
        }

        static Frame leaf(JsonElement node, String key) {
            return new Frame(node, key, 0, false, true);
        }
    }

    /** Raised when a scalar sits where an object or array was required. */
    public static class NotValidInputException extends FlattenException {
        public static final String MESSAGE = "not a valid input: mapping or sequence";

        public NotValidInputException(String key, JsonElement node) {
            super(MESSAGE + " (got " + describe(node) + (key.isEmpty() ? "" : " at '" + key + "'") + ")");
        }

        private static String describe(JsonElement node) {
            if (node == null || node.isJsonNull()) return "null";
            return node.isJsonPrimitive() ? "primitive " + node : node.getClass().getSimpleName();
        }
    }
}
