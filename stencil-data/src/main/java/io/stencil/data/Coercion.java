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

import io.stencil.common.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Formattable;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Conversions between the value tree and plain Java objects. Supported types form a
 * closed table, anything outside it is rejected with {@link UnsupportedTypeException}.
 */
public class Coercion {

    private Coercion() {
        // only static methods
    }

    enum Kind {
        NONE,
        OPTIONAL,
        DEFAULT,
        FLOAT,
        STRING,
        CHARS,
        BYTES,
        STRING_ARRAY,
        VALUE,
        FORMATTABLE
    }

    enum Target {
        STRING,
        INT,
        LONG,
        SHORT,
        BYTE,
        BIG_INTEGER,
        DOUBLE,
        FLOAT,
        BIG_DECIMAL,
        BOOLEAN,
        VALUE,
        OBJECT,
        ARRAY
    }

    private static final Map<Class<?>, Target> TARGETS = new HashMap<>();

    static {
        TARGETS.put(String.class, Target.STRING);
        TARGETS.put(int.class, Target.INT);
        TARGETS.put(Integer.class, Target.INT);
        TARGETS.put(long.class, Target.LONG);
        TARGETS.put(Long.class, Target.LONG);
        TARGETS.put(short.class, Target.SHORT);
        TARGETS.put(Short.class, Target.SHORT);
        TARGETS.put(byte.class, Target.BYTE);
        TARGETS.put(Byte.class, Target.BYTE);
        TARGETS.put(BigInteger.class, Target.BIG_INTEGER);
        TARGETS.put(double.class, Target.DOUBLE);
        TARGETS.put(Double.class, Target.DOUBLE);
        TARGETS.put(float.class, Target.FLOAT);
        TARGETS.put(Float.class, Target.FLOAT);
        TARGETS.put(BigDecimal.class, Target.BIG_DECIMAL);
        TARGETS.put(boolean.class, Target.BOOLEAN);
        TARGETS.put(Boolean.class, Target.BOOLEAN);
        TARGETS.put(Value.class, Target.VALUE);
        TARGETS.put(ObjectValue.class, Target.OBJECT);
        TARGETS.put(ArrayValue.class, Target.ARRAY);
    }

    static Kind kindOf(Object o) {
        if (o == null) {
            return Kind.NONE;
        }
        if (o instanceof Value) {
            return Kind.VALUE;
        }
        if (o instanceof Optional) {
            return Kind.OPTIONAL;
        }
        if (o instanceof CharSequence) {
            return Kind.STRING;
        }
        if (o instanceof Boolean || o instanceof Character || o instanceof Integer || o instanceof Long
                || o instanceof Short || o instanceof Byte || o instanceof BigInteger) {
            return Kind.DEFAULT;
        }
        if (o instanceof Double || o instanceof Float || o instanceof BigDecimal) {
            return Kind.FLOAT;
        }
        if (o instanceof char[]) {
            return Kind.CHARS;
        }
        if (o instanceof byte[]) {
            return Kind.BYTES;
        }
        if (o instanceof String[]) {
            return Kind.STRING_ARRAY;
        }
        if (o instanceof Formattable) {
            return Kind.FORMATTABLE;
        }
        throw new UnsupportedTypeException(o.getClass());
    }

    /**
     * Renders any supported Java value as output text. {@code null} and an empty
     * {@link Optional} render as the empty string.
     */
    public static String toText(Object o) {
        return switch (kindOf(o)) {
            case NONE -> StringUtils.EMPTY;
            case OPTIONAL -> ((Optional<?>) o).map(Coercion::toText).orElse(StringUtils.EMPTY);
            case DEFAULT, STRING, VALUE -> o.toString();
            case FLOAT -> formatDecimal((Number) o);
            case CHARS -> new String((char[]) o);
            case BYTES -> new String((byte[]) o, StandardCharsets.UTF_8);
            case STRING_ARRAY -> String.join("\n", (String[]) o);
            case FORMATTABLE -> String.format("%s", o);
        };
    }

    /**
     * Shortest plain decimal text, no exponent and no trailing zeros.
     */
    static String formatDecimal(Number n) {
        BigDecimal bd;
        if (n instanceof BigDecimal big) {
            bd = big;
        } else if (n instanceof Float f) {
            if (!Float.isFinite(f)) {
                return f.toString();
            }
            bd = new BigDecimal(f.toString());
        } else {
            double d = n.doubleValue();
            if (!Double.isFinite(d)) {
                return Double.toString(d);
            }
            bd = BigDecimal.valueOf(d);
        }
        if (bd.signum() == 0) {
            return "0";
        }
        return bd.stripTrailingZeros().toPlainString();
    }

    /**
     * Converts a resolved value to the requested Java type. Numbers narrow exactly,
     * a value that does not fit is an {@link ArithmeticException}.
     *
     * @param reference the path that was resolved, used in error messages
     * @throws UnknownReferenceException when the value is missing or of the wrong variant
     * @throws UnsupportedTypeException when the requested type is not in the table
     */
    @SuppressWarnings("unchecked")
    public static <T> T fromValue(Class<T> type, Value value, String reference) {
        Target target = TARGETS.get(type);
        if (target == null) {
            throw new UnsupportedTypeException(type);
        }
        if (value == null) {
            throw new UnknownReferenceException(reference);
        }
        Object result = switch (target) {
            case STRING -> value instanceof StringValue s ? s.getValue() : null;
            case INT -> value instanceof IntegerValue i ? (Object) i.getValue().intValueExact() : null;
            case LONG -> value instanceof IntegerValue i ? (Object) i.getValue().longValueExact() : null;
            case SHORT -> value instanceof IntegerValue i ? (Object) i.getValue().shortValueExact() : null;
            case BYTE -> value instanceof IntegerValue i ? (Object) i.getValue().byteValueExact() : null;
            case BIG_INTEGER -> value instanceof IntegerValue i ? i.getValue() : null;
            case DOUBLE -> value instanceof FloatValue f ? (Object) f.getValue() : null;
            case FLOAT -> value instanceof FloatValue f ? (Object) (float) f.getValue() : null;
            case BIG_DECIMAL -> value instanceof FloatValue f ? BigDecimal.valueOf(f.getValue()) : null;
            case BOOLEAN -> value instanceof BooleanValue b ? (Object) b.getValue() : null;
            case VALUE -> value;
            case OBJECT -> value instanceof ObjectValue ? value : null;
            case ARRAY -> value instanceof ArrayValue ? value : null;
        };
        if (result == null) {
            throw new UnknownReferenceException(reference, "data reference `" + reference + "` is "
                    + value.getType() + ", not " + target);
        }
        return (T) result;
    }

    /**
     * Builds detached values in the given store from plain Java objects: maps, collections,
     * arrays, strings, numbers, booleans and {@code null}. A {@link Value} owned by another
     * store is deep copied.
     */
    public static Value toValue(Store store, Object o) {
        return toValue(store, o, 0, store.getConfig().getMaxDepth());
    }

    private static Value toValue(Store store, Object o, int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new DataException("nesting deeper than " + maxDepth + ", cyclic data ?");
        }
        if (o == null) {
            return store.nullValue();
        }
        if (o instanceof Value value) {
            return value.getStore() == store ? value : value.clone(store);
        }
        if (o instanceof Optional<?> optional) {
            return toValue(store, optional.orElse(null), depth, maxDepth);
        }
        if (o instanceof Map<?, ?> map) {
            ObjectValue object = store.createObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                object.put(String.valueOf(entry.getKey()), toValue(store, entry.getValue(), depth + 1, maxDepth));
            }
            return object;
        }
        if (o instanceof Collection<?> collection) {
            ArrayValue array = store.createArray();
            for (Object item : collection) {
                array.append(toValue(store, item, depth + 1, maxDepth));
            }
            return array;
        }
        if (o instanceof Object[] items) {
            ArrayValue array = store.createArray();
            for (Object item : items) {
                array.append(toValue(store, item, depth + 1, maxDepth));
            }
            return array;
        }
        if (o instanceof CharSequence || o instanceof Character) {
            return store.string(o.toString());
        }
        if (o instanceof char[] chars) {
            return store.string(new String(chars));
        }
        if (o instanceof Boolean b) {
            return store.bool(b);
        }
        if (o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte) {
            return store.integer(((Number) o).longValue());
        }
        if (o instanceof BigInteger bi) {
            return store.integer(bi);
        }
        if (o instanceof Double || o instanceof Float || o instanceof BigDecimal) {
            return store.floating(((Number) o).doubleValue());
        }
        throw new UnsupportedTypeException(o.getClass());
    }

}
