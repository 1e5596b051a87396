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

import java.util.Arrays;
import java.util.List;

/**
 * A node of the data tree. The variant set is closed:
 * <pre>
 * Value (sealed)
 * ├── ObjectValue  - string keys to child values
 * ├── ArrayValue   - ordered, append-only children
 * ├── StringValue
 * ├── IntegerValue - signed 128-bit range
 * ├── FloatValue   - finite double
 * ├── BooleanValue
 * └── NullValue
 * </pre>
 * Every value is created by a {@link Store} and stays owned by it. The variant of a
 * value never changes; mutation means putting or appending children into a container.
 * <p>
 * Container operations called on the wrong variant fail with {@link IllegalStateException},
 * lookups on the wrong variant return {@code null}.
 */
public abstract sealed class Value permits ObjectValue, ArrayValue, StringValue, IntegerValue, FloatValue, BooleanValue, NullValue {

    public enum Type {
        OBJECT,
        ARRAY,
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        NULL
    }

    final Store store;

    Value(Store store) {
        this.store = store;
        store.track(this);
    }

    public abstract Type getType();

    /**
     * Returns the idiomatic Java representation: {@code String}, {@code BigInteger},
     * {@code Double}, {@code Boolean}, {@code null}, or for containers a deep
     * {@code Map} / {@code List} copy.
     */
    public abstract Object getJavaValue();

    public Store getStore() {
        return store;
    }

    public boolean isObject() {
        return getType() == Type.OBJECT;
    }

    public boolean isArray() {
        return getType() == Type.ARRAY;
    }

    public boolean isContainer() {
        return isObject() || isArray();
    }

    public boolean isNull() {
        return getType() == Type.NULL;
    }

    public ObjectValue asObject() {
        if (this instanceof ObjectValue object) {
            return object;
        }
        throw notA(Type.OBJECT);
    }

    public ArrayValue asArray() {
        if (this instanceof ArrayValue array) {
            return array;
        }
        throw notA(Type.ARRAY);
    }

    IllegalStateException notA(Type expected) {
        return new IllegalStateException("not " + expected + ": " + getType());
    }

    /**
     * True if {@code target} is this value or one of its descendants.
     */
    boolean reaches(Value target) {
        if (this == target) {
            return true;
        }
        Iterable<Value> children = switch (getType()) {
            case OBJECT -> ((ObjectValue) this).map.values();
            case ARRAY -> ((ArrayValue) this).list;
            case STRING, INTEGER, FLOAT, BOOLEAN, NULL -> List.of();
        };
        for (Value child : children) {
            if (child.reaches(target)) {
                return true;
            }
        }
        return false;
    }

    //==================================================================
    // container api, overridden by ObjectValue / ArrayValue

    public Value get(String key) {
        throw notA(Type.OBJECT);
    }

    public void put(String key, Value value) {
        throw notA(Type.OBJECT);
    }

    public void append(Value value) {
        throw notA(Type.ARRAY);
    }

    public int count() {
        throw new IllegalStateException("not a container: " + getType());
    }

    /**
     * Typed lookup of a direct child of an object. Returns {@code null} when this is not
     * an object, when the key is absent, or when the child is of another variant.
     */
    public <T> T getT(Type type, String key) {
        return null;
    }

    public Value chain(String... keys) {
        return chain(Arrays.asList(keys));
    }

    /**
     * Walks nested objects key by key. Returns a value only if the last key lands on a
     * non-object leaf.
     */
    public Value chain(List<String> keys) {
        return null;
    }

    //==================================================================

    /**
     * Deep structural equality. Object key order is ignored, array order is not.
     */
    public boolean eql(Value other) {
        if (other == this) {
            return true;
        }
        if (other == null || other.getType() != getType()) {
            return false;
        }
        return switch (getType()) {
            case OBJECT -> ((ObjectValue) this).eqlObject((ObjectValue) other);
            case ARRAY -> ((ArrayValue) this).eqlArray((ArrayValue) other);
            case STRING -> ((StringValue) this).getValue().equals(((StringValue) other).getValue());
            case INTEGER -> ((IntegerValue) this).getValue().equals(((IntegerValue) other).getValue());
            case FLOAT -> ((FloatValue) this).getValue() == ((FloatValue) other).getValue();
            case BOOLEAN -> ((BooleanValue) this).getValue() == ((BooleanValue) other).getValue();
            case NULL -> true;
        };
    }

    public String toJson() {
        return Json.encode(this, false, store.getConfig().getMaxDepth());
    }

    public String toPrettyJson() {
        return Json.encode(this, true, store.getConfig().getMaxDepth());
    }

    /**
     * Deep copy through the JSON codec into the given store. The copy shares nothing
     * with this value.
     */
    public Value clone(Store target) {
        return Json.decode(target, toJson());
    }

    /**
     * Deep copy into a fresh store with the same configuration.
     */
    @Override
    public Value clone() {
        return clone(new Store(store.getConfig()));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Value other && eql(other);
    }

    @Override
    public int hashCode() {
        return switch (getType()) {
            case OBJECT -> ((ObjectValue) this).map.hashCode();
            case ARRAY -> ((ArrayValue) this).list.hashCode();
            case STRING -> ((StringValue) this).getValue().hashCode();
            case INTEGER -> ((IntegerValue) this).getValue().hashCode();
            case FLOAT -> {
                double d = ((FloatValue) this).getValue();
                yield Double.hashCode(d == 0.0 ? 0.0 : d); // -0.0 == 0.0
            }
            case BOOLEAN -> Boolean.hashCode(((BooleanValue) this).getValue());
            case NULL -> 0;
        };
    }

    /**
     * Display text: scalars render their plain value ({@code null} renders empty),
     * containers render as compact JSON.
     */
    @Override
    public abstract String toString();

}
