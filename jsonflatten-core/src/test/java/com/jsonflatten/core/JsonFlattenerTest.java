package com.jsonflatten.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFlattenerTest {

    private static final String DOCUMENT = """
            {
              "foo": { "jim": "bean" },
              "fee": "bar",
              "n1": {
                "alist": [ "a", "b", "c", { "d": "other", "e": "another" } ]
              },
              "number": 1.4567,
              "bool": true
            }
            """;

    private static final String DEEP = """
            {
              "a": { "b": { "c": { "d": { "e": "f" } } } },
              "g": "h"
            }
            """;

    private static JsonObject parse(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }

    private static Map<String, JsonElement> expected(String json) {
        return parse(json).asMap();
    }

    // --- Styles ---

    @Test
    void dotStyle() {
        Map<String, JsonElement> flat = JsonFlattener.flatten(parse(DOCUMENT), "", SeparatorStyle.DOT, -1);
        assertEquals(expected("""
                {
                  "foo.jim": "bean",
                  "fee": "bar",
                  "n1.alist.0": "a",
                  "n1.alist.1": "b",
                  "n1.alist.2": "c",
                  "n1.alist.3.d": "other",
                  "n1.alist.3.e": "another",
                  "number": 1.4567,
                  "bool": true
                }
                """), flat);
    }

    @Test
    void railsStyle() {
        Map<String, JsonElement> flat = JsonFlattener.flatten(parse(DOCUMENT), "", SeparatorStyle.RAILS, -1);
        assertEquals("bean", flat.get("foo[jim]").getAsString());
        assertEquals("a", flat.get("n1[alist][0]").getAsString());
        assertEquals("another", flat.get("n1[alist][3][e]").getAsString());
        assertEquals(9, flat.size());
    }

    @Test
    void pathStyle() {
        Map<String, JsonElement> flat = JsonFlattener.flatten(parse(DOCUMENT), "", SeparatorStyle.PATH, -1);
        assertEquals("bean", flat.get("foo/jim").getAsString());
        assertEquals("other", flat.get("n1/alist/3/d").getAsString());
        assertEquals(1.4567, flat.get("number").getAsDouble());
        assertTrue(flat.get("bool").getAsBoolean());
    }

    @Test
    void underscoreStyleWithPrefix() {
        Map<String, JsonElement> flat = JsonFlattener.flatten(parse(DOCUMENT), "flag-", SeparatorStyle.UNDERSCORE, -1);
        assertEquals(expected("""
                {
                  "flag-foo_jim": "bean",
                  "flag-fee": "bar",
                  "flag-n1_alist_0": "a",
                  "flag-n1_alist_1": "b",
                  "flag-n1_alist_2": "c",
                  "flag-n1_alist_3_d": "other",
                  "flag-n1_alist_3_e": "another",
                  "flag-number": 1.4567,
                  "flag-bool": true
                }
                """), flat);
    }

    @Test
    void prefixAppliedExactlyOnce() {
        Map<String, JsonElement> flat = JsonFlattener.flatten(parse("{\"a\": {\"b\": \"c\"}, \"e\": \"f\"}"),
                "p:", SeparatorStyle.DOT, -1);
        assertEquals(expected("{\"p:a.b\": \"c\", \"p:e\": \"f\"}"), flat);
    }

    // --- Depth ---

    @Test
    void depthOne() {
        JsonObject nested = parse("{\"foo\": {\"bar\": {\"baz\": \"qux\"}}, \"quux\": 789.1}");
        assertEquals(expected("{\"foo.bar\": {\"baz\": \"qux\"}, \"quux\": 789.1}"),
                JsonFlattener.flatten(nested, "", SeparatorStyle.DOT, 1));
    }

    @Test
    void depthTwo() {
        assertEquals(expected("{\"a_b_c\": {\"d\": {\"e\": \"f\"}}, \"g\": \"h\"}"),
                JsonFlattener.flatten(parse(DEEP), "", SeparatorStyle.UNDERSCORE, 2));
    }

    @Test
    void depthThree() {
        assertEquals(expected("{\"a/b/c/d\": {\"e\": \"f\"}, \"g\": \"h\"}"),
                JsonFlattener.flatten(parse(DEEP), "", SeparatorStyle.PATH, 3));
    }

    @Test
    void depthFourReachesLeaves() {
        assertEquals(expected("{\"a/b/c/d/e\": \"f\", \"g\": \"h\"}"),
                JsonFlattener.flatten(parse(DEEP), "", SeparatorStyle.PATH, 4));
    }

    @Test
    void depthBeyondNestingIsUnlimited() {
        assertEquals(expected("{\"test_a[b][c][d][e]\": \"f\", \"test_g\": \"h\"}"),
                JsonFlattener.flatten(parse(DEEP), "test_", SeparatorStyle.RAILS, 5));
    }

    @Test
    void fourLevelExampleTruncatedAtTwoAndThree() {
        JsonObject nested = parse("{\"a\": {\"b\": {\"c\": {\"d\": \"e\"}}}}");
        assertEquals(expected("{\"a_b_c\": {\"d\": \"e\"}}"),
                JsonFlattener.flatten(nested, "", SeparatorStyle.UNDERSCORE, 2));
        assertEquals(expected("{\"a/b/c/d\": \"e\"}"),
                JsonFlattener.flatten(nested, "", SeparatorStyle.PATH, 3));
    }

    @Test
    void zeroDepthReturnsInputUnderPrefix() {
        JsonObject nested = parse(DOCUMENT);
        Map<String, JsonElement> flat = JsonFlattener.flatten(nested, "", SeparatorStyle.DOT, 0);
        assertEquals(1, flat.size());
        assertSame(nested, flat.get(""));

        Map<String, JsonElement> prefixed = JsonFlattener.flatten(nested, "doc", SeparatorStyle.DOT, 0);
        assertSame(nested, prefixed.get("doc"));
    }

    @Test
    void anyNegativeDepthIsUnlimited() {
        assertEquals(JsonFlattener.flatten(parse(DEEP), "", SeparatorStyle.DOT, -1),
                JsonFlattener.flatten(parse(DEEP), "", SeparatorStyle.DOT, -7));
    }

    @Test
    void fullFlattenLeavesOnlyScalars() {
        JsonObject nested = parse("""
                {
                  "a": [ [ [ 1, { "b": [ null, false ] } ] ], {} ],
                  "c": { "d": { "e": [ "x", { "f": { "g": 2.5 } } ] } },
                  "h": null
                }
                """);
        Map<String, JsonElement> flat = JsonFlattener.flatten(nested, "", SeparatorStyle.DOT, -1);
        for (Map.Entry<String, JsonElement> entry : flat.entrySet()) {
            JsonElement value = entry.getValue();
            assertTrue(value.isJsonPrimitive() || value.isJsonNull(), entry.getKey() + " -> " + value);
        }
        assertEquals(JsonNull.INSTANCE, flat.get("a.0.0.1.b.0"));
        assertEquals(new JsonPrimitive(2.5), flat.get("c.d.e.1.f.g"));
        assertEquals(JsonNull.INSTANCE, flat.get("h"));
    }

    @Test
    void entriesFollowDocumentOrder() {
        Map<String, JsonElement> flat = JsonFlattener.flatten(parse(DOCUMENT), "", SeparatorStyle.DOT, -1);
        assertEquals(List.of("foo.jim", "fee", "n1.alist.0", "n1.alist.1", "n1.alist.2",
                "n1.alist.3.d", "n1.alist.3.e", "number", "bool"), new ArrayList<>(flat.keySet()));
    }

    // --- Preserving sequences ---

    @Test
    void arraysFlattenedByDefault() {
        assertEquals(expected("{\"z.0\": \"one\", \"z.1\": \"two\"}"),
                JsonFlattener.flatten(parse("{\"z\": [\"one\", \"two\"]}"), "", SeparatorStyle.DOT, -1));
    }

    @Test
    void arraysKeptWhenPreserving() {
        Map<String, JsonElement> flat = JsonFlattener.flattenPreservingSequences(
                parse("{\"z\": [\"one\", \"two\"], \"o\": {\"l\": [{\"k\": 1}]}}"), "", SeparatorStyle.DOT, -1);
        assertEquals(expected("{\"z\": [\"one\", \"two\"], \"o.l\": [{\"k\": 1}]}"), flat);
    }

    @Test
    void preservingRespectsDepth() {
        Map<String, JsonElement> flat = JsonFlattener.flattenPreservingSequences(
                parse(DEEP), "", SeparatorStyle.DOT, 1);
        assertEquals(expected("{\"a.b\": {\"c\": {\"d\": {\"e\": \"f\"}}}, \"g\": \"h\"}"), flat);
    }

    // --- Options and plain maps ---

    @Test
    void optionsOverloadMatchesPositionalForm() {
        FlattenOptions options = FlattenOptions.defaults()
                .withPrefix("x-")
                .withStyle(SeparatorStyle.PATH)
                .withDepth(2);
        assertEquals(JsonFlattener.flatten(parse(DEEP), "x-", SeparatorStyle.PATH, 2),
                JsonFlattener.flatten(parse(DEEP), options));
    }

    @Test
    void plainJavaMapsAreFlattened() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("list", new ArrayList<>(Arrays.asList(1, "two", null)));
        inner.put("flag", true);
        Map<String, Object> nested = new HashMap<>();
        nested.put("inner", inner);
        nested.put("name", "n");
        nested.put("missing", null);

        Map<String, JsonElement> flat = JsonFlattener.flattenMap(nested, FlattenOptions.defaults());

        assertEquals(new JsonPrimitive(1), flat.get("inner.list.0"));
        assertEquals(new JsonPrimitive("two"), flat.get("inner.list.1"));
        assertEquals(JsonNull.INSTANCE, flat.get("inner.list.2"));
        assertEquals(new JsonPrimitive(true), flat.get("inner.flag"));
        assertEquals(new JsonPrimitive("n"), flat.get("name"));
        assertEquals(JsonNull.INSTANCE, flat.get("missing"));
        assertEquals(6, flat.size());
    }

    @Test
    void plainJavaMapsPreservingSequences() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("z", new ArrayList<>(List.of("one", "two")));

        Map<String, JsonElement> flat = JsonFlattener.flattenMap(nested,
                FlattenOptions.defaults().withPreserveSequences(true));
        assertEquals(JsonParser.parseString("[\"one\", \"two\"]"), flat.get("z"));
    }

    @Test
    void nullInputRejected() {
        assertThrows(NullPointerException.class,
                () -> JsonFlattener.flatten(null, "", SeparatorStyle.DOT, -1));
    }
}
