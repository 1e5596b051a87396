/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.stencil.data;

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static net.minidev.json.JSONValue.defaultReader;

/**
 * JSON codec for the value tree. Decoding is strict RFC 4627 and keeps object key
 * order. Encoding produces compact or two-space indented output.
 */
public class Json {

    static final String INDENT = "  ";

    private Json() {
        // only static methods
    }

    public static String encode(Value value, boolean pretty, int maxDepth) {
        StringBuilder sb = new StringBuilder();
        encode(value, pretty, maxDepth, sb);
        return sb.toString();
    }

    public static void encode(Value value, boolean pretty, int maxDepth, StringBuilder sb) {
        encode(value, pretty, 0, maxDepth, sb);
    }

    private static void encode(Value value, boolean pretty, int depth, int maxDepth, StringBuilder sb) {
        if (depth > maxDepth) {
            throw new DataException("nesting deeper than " + maxDepth);
        }
        switch (value.getType()) {
            case OBJECT -> encodeObject((ObjectValue) value, pretty, depth, maxDepth, sb);
            case ARRAY -> encodeArray((ArrayValue) value, pretty, depth, maxDepth, sb);
            case STRING -> quote(((StringValue) value).getValue(), sb);
            case INTEGER -> sb.append(((IntegerValue) value).getValue());
            case FLOAT -> sb.append(FloatValue.toJsonNumber(((FloatValue) value).getValue()));
            case BOOLEAN -> sb.append(((BooleanValue) value).getValue());
            case NULL -> sb.append("null");
        }
    }

    private static void encodeObject(ObjectValue object, boolean pretty, int depth, int maxDepth, StringBuilder sb) {
        sb.append('{');
        if (pretty) {
            sb.append('\n');
        }
        Iterator<Map.Entry<String, Value>> iterator = object.map.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Value> entry = iterator.next();
            if (pretty) {
                pad(sb, depth + 1);
            }
            quote(entry.getKey(), sb);
            sb.append(pretty ? ": " : ":");
            encode(entry.getValue(), pretty, depth + 1, maxDepth, sb);
            if (iterator.hasNext()) {
                sb.append(',');
            }
            if (pretty) {
                sb.append('\n');
            }
        }
        if (pretty) {
            pad(sb, depth);
        }
        sb.append('}');
    }

    private static void encodeArray(ArrayValue array, boolean pretty, int depth, int maxDepth, StringBuilder sb) {
        sb.append('[');
        if (pretty) {
            sb.append('\n');
        }
        Iterator<Value> iterator = array.list.iterator();
        while (iterator.hasNext()) {
            Value child = iterator.next();
            if (pretty) {
                pad(sb, depth + 1);
            }
            encode(child, pretty, depth + 1, maxDepth, sb);
            if (iterator.hasNext()) {
                sb.append(',');
            }
            if (pretty) {
                sb.append('\n');
            }
        }
        if (pretty) {
            pad(sb, depth);
        }
        sb.append(']');
    }

    private static void pad(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }

    static void quote(String raw, StringBuilder sb) {
        sb.append('"').append(JSONValue.escape(raw, JSONStyle.LT_COMPRESS)).append('"');
    }

    //==================================================================

    /**
     * Parses any JSON value into detached values of the given store. The root
     * of the store is left untouched.
     */
    public static Value decode(Store store, String json) {
        return toValue(store, parse(json), 0, store.getConfig().getMaxDepth());
    }

    static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new JsonDecodeException("invalid json: empty input");
        }
        try {
            JSONParser parser = new JSONParser(JSONParser.MODE_RFC4627);
            return parser.parse(json, defaultReader.DEFAULT_ORDERED);
        } catch (ParseException | RuntimeException e) {
            throw new JsonDecodeException("invalid json: " + e.getMessage(), e);
        }
    }

    private static Value toValue(Store store, Object o, int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new JsonDecodeException("nesting deeper than " + maxDepth);
        }
        if (o == null) {
            return store.nullValue();
        }
        if (o instanceof Map<?, ?> map) {
            ObjectValue object = store.createObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                object.put(entry.getKey().toString(), toValue(store, entry.getValue(), depth + 1, maxDepth));
            }
            return object;
        }
        if (o instanceof List<?> list) {
            ArrayValue array = store.createArray();
            for (Object item : list) {
                array.append(toValue(store, item, depth + 1, maxDepth));
            }
            return array;
        }
        if (o instanceof String s) {
            return store.string(s);
        }
        if (o instanceof Boolean b) {
            return store.bool(b);
        }
        if (o instanceof Integer || o instanceof Long || o instanceof BigInteger) {
            BigInteger bi = o instanceof BigInteger big ? big : BigInteger.valueOf(((Number) o).longValue());
            if (!IntegerValue.inRange(bi)) {
                throw new JsonDecodeException("integer out of 128-bit range: " + bi);
            }
            return store.integer(bi);
        }
        if (o instanceof Double || o instanceof Float || o instanceof BigDecimal) {
            double d = ((Number) o).doubleValue();
            if (!Double.isFinite(d)) {
                throw new JsonDecodeException("float out of range: " + o);
            }
            return store.floating(d);
        }
        throw new JsonDecodeException("unexpected json value: " + o.getClass().getName());
    }

}
