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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, append-only container.
 */
public final class ArrayValue extends Value implements Iterable<Value> {

    final List<Value> list = new ArrayList<>();

    ArrayValue(Store store) {
        super(store);
    }

    @Override
    public Type getType() {
        return Type.ARRAY;
    }

    /**
     * A {@code null} value is appended as a Null value, call as {@code append((Value) null)}
     * or use {@link #appendNull()}.
     *
     * @throws IllegalArgumentException if the value belongs to another store or already
     * contains this array
     */
    @Override
    public void append(Value value) {
        Value child = store.adopt(value);
        if (child.reaches(this)) {
            throw new IllegalArgumentException("cannot append a container to itself");
        }
        list.add(child);
    }

    public void appendNull() {
        append(store.nullValue());
    }

    public void append(String value) {
        append(store.string(value));
    }

    public void append(long value) {
        append(store.integer(value));
    }

    /**
     * Returns {@code null} when the index is out of range.
     */
    public Value get(int index) {
        if (index < 0 || index >= list.size()) {
            return null;
        }
        return list.get(index);
    }

    @Override
    public int count() {
        return list.size();
    }

    public List<Value> items() {
        return Collections.unmodifiableList(list);
    }

    public Cursor cursor() {
        return new Cursor(list);
    }

    @Override
    public Iterator<Value> iterator() {
        return items().iterator();
    }

    boolean eqlArray(ArrayValue other) {
        int size = list.size();
        if (size != other.list.size()) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (!list.get(i).eql(other.list.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Object getJavaValue() {
        List<Object> result = new ArrayList<>(list.size());
        for (Value value : list) {
            result.add(value.getJavaValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return toJson();
    }

    /**
     * Forward-only position over the elements, {@link #next()} returns {@code null}
     * once exhausted.
     */
    public static class Cursor {

        private final List<Value> list;
        private int index;

        Cursor(List<Value> list) {
            this.list = list;
        }

        public Value next() {
            if (index >= list.size()) {
                return null;
            }
            return list.get(index++);
        }

        public int getIndex() {
            return index;
        }

    }

}
