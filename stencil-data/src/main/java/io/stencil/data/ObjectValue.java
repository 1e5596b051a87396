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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * String-keyed container. Keys keep insertion order, which is also the order used
 * for JSON output and iteration. Putting an existing key replaces the value in place.
 */
public final class ObjectValue extends Value {

    public record Item(String key, Value value) {
    }

    final Map<String, Value> map = new LinkedHashMap<>();

    ObjectValue(Store store) {
        super(store);
    }

    @Override
    public Type getType() {
        return Type.OBJECT;
    }

    @Override
    public Value get(String key) {
        return map.get(key);
    }

    public boolean contains(String key) {
        return map.containsKey(key);
    }

    /**
     * A {@code null} value is stored as a Null value, call as {@code put(key, (Value) null)}
     * or use {@link #putNull(String)}.
     *
     * @throws IllegalArgumentException if the value belongs to another store or already
     * contains this object
     */
    @Override
    public void put(String key, Value value) {
        if (key == null) {
            throw new IllegalArgumentException("object key must not be null");
        }
        Value child = store.adopt(value);
        if (child.reaches(this)) {
            throw new IllegalArgumentException("cannot put a container inside itself: " + key);
        }
        map.put(key, child);
    }

    public void putNull(String key) {
        put(key, store.nullValue());
    }

    public void put(String key, String value) {
        put(key, store.string(value));
    }

    public void put(String key, long value) {
        put(key, store.integer(value));
    }

    public void put(String key, double value) {
        put(key, store.floating(value));
    }

    public void put(String key, boolean value) {
        put(key, store.bool(value));
    }

    @Override
    public int count() {
        return map.size();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(map.keySet());
    }

    public List<Item> items() {
        List<Item> items = new ArrayList<>(map.size());
        map.forEach((k, v) -> items.add(new Item(k, v)));
        return items;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getT(Type type, String key) {
        Value value = map.get(key);
        if (value == null || value.getType() != type) {
            return null;
        }
        Object result = switch (type) {
            case OBJECT, ARRAY -> value;
            case STRING, INTEGER, FLOAT, BOOLEAN, NULL -> value.getJavaValue();
        };
        return (T) result;
    }

    public String getString(String key) {
        return getT(Type.STRING, key);
    }

    public BigInteger getInteger(String key) {
        return getT(Type.INTEGER, key);
    }

    public Double getFloat(String key) {
        return getT(Type.FLOAT, key);
    }

    public Boolean getBoolean(String key) {
        return getT(Type.BOOLEAN, key);
    }

    public ObjectValue getObject(String key) {
        return getT(Type.OBJECT, key);
    }

    public ArrayValue getArray(String key) {
        return getT(Type.ARRAY, key);
    }

    @Override
    public Value chain(List<String> keys) {
        ObjectValue current = this;
        int remaining = keys.size();
        for (String key : keys) {
            remaining--;
            Value value = current.map.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof ObjectValue object) {
                current = object;
            } else {
                return remaining == 0 ? value : null;
            }
        }
        return null;
    }

    boolean eqlObject(ObjectValue other) {
        if (map.size() != other.map.size()) {
            return false;
        }
        for (Map.Entry<String, Value> entry : map.entrySet()) {
            Value otherValue = other.map.get(entry.getKey());
            if (otherValue == null || !entry.getValue().eql(otherValue)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Object getJavaValue() {
        Map<String, Object> result = new LinkedHashMap<>(map.size());
        map.forEach((k, v) -> result.put(k, v.getJavaValue()));
        return result;
    }

    @Override
    public String toString() {
        return toJson();
    }

}
