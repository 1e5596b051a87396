package io.stencil.data;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    @Test
    void testCompactIsIdempotent() {
        String json = "{\"b\":1,\"a\":[true,null,2.5,\"x\"],\"c\":{\"d\":-3}}";
        Store store = new Store();
        Value value = Json.decode(store, json);
        assertEquals(json, value.toJson());
        assertEquals(json, Json.decode(store, value.toJson()).toJson());
    }

    @Test
    void testPretty() {
        Store store = new Store();
        Value value = Json.decode(store, "{\"a\":[1,{\"b\":null}],\"c\":\"d\"}");
        String expected = "{\n"
                + "  \"a\": [\n"
                + "    1,\n"
                + "    {\n"
                + "      \"b\": null\n"
                + "    }\n"
                + "  ],\n"
                + "  \"c\": \"d\"\n"
                + "}";
        assertEquals(expected, value.toPrettyJson());
    }

    @Test
    void testPrettyEmptyContainers() {
        Store store = new Store();
        assertEquals("{\n}", store.createObject().toPrettyJson());
        assertEquals("[\n]", store.createArray().toPrettyJson());
        assertEquals("{\n  \"a\": [\n  ]\n}", Json.decode(store, "{\"a\":[]}").toPrettyJson());
        assertEquals("{}", store.createObject().toJson());
    }

    @Test
    void testFloatsKeepDecimalPoint() {
        Store store = new Store();
        assertEquals("1.0", store.floating(1.0).toJson());
        assertEquals("1.25", store.floating(1.25).toJson());
        assertEquals("-100.0", store.floating(-100.0).toJson());
        assertEquals("100000000000000000000.0", store.floating(1e20).toJson());
        assertEquals("0.0000001", store.floating(1e-7).toJson());
        assertEquals("0.0", store.floating(0.0).toJson());
    }

    @Test
    void testIntegers() {
        Store store = new Store();
        assertEquals("42", store.integer(42).toJson());
        assertEquals(IntegerValue.MAX.toString(), store.integer(IntegerValue.MAX).toJson());
        Value big = Json.decode(store, "[123456789012345678901234567890]");
        assertEquals(new BigInteger("123456789012345678901234567890"), ((IntegerValue) big.asArray().get(0)).getValue());
    }

    @Test
    void testNumberClassification() {
        Store store = new Store();
        ArrayValue array = Json.decode(store, "[1,1.0,-3,2.50]").asArray();
        assertEquals(Value.Type.INTEGER, array.get(0).getType());
        assertEquals(Value.Type.FLOAT, array.get(1).getType());
        assertEquals(Value.Type.INTEGER, array.get(2).getType());
        assertEquals(Value.Type.FLOAT, array.get(3).getType());
        assertEquals("[1,1.0,-3,2.5]", array.toJson());
    }

    @Test
    void testIntegerOutOfRange() {
        Store store = new Store();
        assertThrows(JsonDecodeException.class, () -> Json.decode(store, "[10000000000000000000000000000000000000000]"));
    }

    @Test
    void testStringEscaping() {
        Store store = new Store();
        ObjectValue object = store.object();
        object.put("say \"hi\"", "line1\nline2\ttab\\");
        String json = object.toJson();
        assertEquals("{\"say \\\"hi\\\"\":\"line1\\nline2\\ttab\\\\\"}", json);
        assertTrue(Json.decode(store, json).eql(object));
    }

    @Test
    void testUnicodeRoundTrip() {
        Store store = new Store();
        Value value = Json.decode(store, "{\"name\":\"héllo 世界\"}");
        assertEquals("héllo 世界", value.asObject().getString("name"));
        assertTrue(Json.decode(store, value.toJson()).eql(value));
    }

    @Test
    void testKeyOrderPreserved() {
        Store store = new Store();
        Value value = Json.decode(store, "{\"z\":1,\"y\":2,\"x\":3,\"w\":4}");
        assertEquals("{\"z\":1,\"y\":2,\"x\":3,\"w\":4}", value.toJson());
    }

    @Test
    void testRoundTripBuiltTree() {
        Store store = new Store();
        ObjectValue root = store.object();
        root.put("s", "text");
        root.put("i", -12);
        root.put("f", 0.125);
        root.put("b", false);
        root.put("n", store.nullValue());
        ArrayValue list = store.createArray();
        list.append("x");
        list.append(store.integer(IntegerValue.MIN));
        list.append(store.createObject());
        root.put("list", list);
        Store other = new Store();
        Value copy = other.fromJson(store.toJson());
        assertTrue(copy.eql(root));
        assertTrue(root.eql(copy));
        assertEquals(store.toJson(), other.toJson());
    }

    @Test
    void testInvalidJson() {
        Store store = new Store();
        assertThrows(JsonDecodeException.class, () -> Json.decode(store, "{\"a\":1"));
        assertThrows(JsonDecodeException.class, () -> Json.decode(store, "{\"a\" 1}"));
        assertThrows(JsonDecodeException.class, () -> Json.decode(store, ""));
        assertThrows(JsonDecodeException.class, () -> Json.decode(store, null));
        JsonDecodeException e = assertThrows(JsonDecodeException.class, () -> Json.decode(store, "[1,2"));
        assertTrue(e.getMessage().startsWith("invalid json"));
    }

    @Test
    void testNestingTooDeep() {
        Store store = new Store();
        ArrayValue current = store.createArray();
        for (int i = 0; i < 600; i++) {
            ArrayValue parent = store.createArray();
            parent.append(current);
            current = parent;
        }
        ArrayValue outer = current;
        DataException e = assertThrows(DataException.class, outer::toJson);
        assertTrue(e.getMessage().contains("nesting deeper than"));
    }

}
