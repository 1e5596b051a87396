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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns a tree of {@link Value}s plus the text produced while rendering from it.
 * <p>
 * Typical use:
 * <pre>
 * try (Store store = new Store()) {
 *     ObjectValue root = store.object();   // first container call binds the root
 *     root.put("name", "world");
 *     store.write("hello " + store.getValueString("name"));
 *     String text = store.getOutput();
 * }
 * </pre>
 * A store is meant for one render or build at a time and is not thread safe. Values replaced
 * by {@code put} stay valid for callers still holding them, everything is dropped on
 * {@link #reset()} or {@link #close()}.
 */
public class Store implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Store.class);

    private final DataConfig config;
    private final Map<String, Value> constants = new HashMap<>();

    private Value root;
    private ObjectValue overlay;
    private StringBuilder output;
    private boolean outputStarted;
    private long allocated;
    private boolean closed;

    public Store() {
        this(DataConfig.defaults());
    }

    public Store(DataConfig config) {
        this.config = config;
        this.output = new StringBuilder(config.getOutputCapacity());
    }

    public DataConfig getConfig() {
        return config;
    }

    void track(Value value) {
        checkOpen();
        allocated++;
    }

    void checkOpen() {
        if (closed) {
            throw new IllegalStateException("store is closed");
        }
    }

    Value adopt(Value value) {
        checkOpen();
        if (value == null) {
            return nullValue();
        }
        if (value.store != this) {
            throw new IllegalArgumentException("value belongs to another store, use clone(store) to copy it");
        }
        return value;
    }

    /**
     * Number of values created since construction or the last {@link #reset()}, including
     * ones no longer reachable from the root.
     */
    public long getAllocated() {
        return allocated;
    }

    //==================================================================
    // construction

    public StringValue string(String value) {
        return new StringValue(this, value);
    }

    public IntegerValue integer(long value) {
        return new IntegerValue(this, BigInteger.valueOf(value));
    }

    public IntegerValue integer(BigInteger value) {
        return new IntegerValue(this, value);
    }

    public FloatValue floating(double value) {
        return new FloatValue(this, value);
    }

    public BooleanValue bool(boolean value) {
        return new BooleanValue(this, value);
    }

    public NullValue nullValue() {
        return new NullValue(this);
    }

    /**
     * Creates an object. The first container created through this method or {@link #array()}
     * becomes the root, later calls return detached objects.
     */
    public ObjectValue object() {
        ObjectValue object = createObject();
        if (root == null) {
            root = object;
        }
        return object;
    }

    public ArrayValue array() {
        ArrayValue array = createArray();
        if (root == null) {
            root = array;
        }
        return array;
    }

    /**
     * Creates an object that is never bound as the root.
     */
    public ObjectValue createObject() {
        return new ObjectValue(this);
    }

    public ArrayValue createArray() {
        return new ArrayValue(this);
    }

    /**
     * Returns the root, creating it with the requested variant if none is bound yet.
     *
     * @throws IncompatibleRootTypeException if the root is bound to the other variant
     */
    public Value root(Value.Type type) {
        if (type != Value.Type.OBJECT && type != Value.Type.ARRAY) {
            throw new IllegalArgumentException("root must be OBJECT or ARRAY: " + type);
        }
        checkOpen();
        if (root != null) {
            if (root.getType() != type) {
                throw new IncompatibleRootTypeException(root.getType(), type);
            }
            return root;
        }
        root = type == Value.Type.OBJECT ? createObject() : createArray();
        return root;
    }

    public Value getRoot() {
        return root;
    }

    //==================================================================
    // root lookups

    /**
     * Exact key of the root object, {@code null} when there is no root object or no such key.
     */
    public Value get(String key) {
        return root instanceof ObjectValue object ? object.get(key) : null;
    }

    public <T> T getT(Value.Type type, String key) {
        return root == null ? null : root.getT(type, key);
    }

    public String getString(String key) {
        return getT(Value.Type.STRING, key);
    }

    public BigInteger getInteger(String key) {
        return getT(Value.Type.INTEGER, key);
    }

    public Double getFloat(String key) {
        return getT(Value.Type.FLOAT, key);
    }

    public Boolean getBoolean(String key) {
        return getT(Value.Type.BOOLEAN, key);
    }

    public ObjectValue getObject(String key) {
        return getT(Value.Type.OBJECT, key);
    }

    public ArrayValue getArray(String key) {
        return getT(Value.Type.ARRAY, key);
    }

    public Value chain(String... keys) {
        return chain(Arrays.asList(keys));
    }

    public Value chain(List<String> keys) {
        return root == null ? null : root.chain(keys);
    }

    //==================================================================
    // overlay

    /**
     * Sets the object consulted before the root during path resolution. The overlay shadows
     * the tree and is never merged into it. Pass {@code null} to remove it.
     */
    public void setOverlay(ObjectValue overlay) {
        this.overlay = overlay == null ? null : adopt(overlay).asObject();
    }

    public ObjectValue getOverlay() {
        return overlay;
    }

    public void clearOverlay() {
        overlay = null;
    }

    //==================================================================
    // path resolution

    /**
     * Resolves a dotted path such as {@code foo.bar.2.baz}. The overlay is tried first,
     * by exact key and then as a path, then the root. Array segments must be plain decimal
     * indexes. In the root, a scalar reached before the last segment is returned as the
     * result. In the overlay, a path only matches when every segment is consumed.
     *
     * @return the value or {@code null} if not found
     */
    public Value getValue(String path) {
        if (path == null) {
            return null;
        }
        if (overlay != null) {
            Value value = overlay.get(path);
            if (value == null) {
                value = walk(overlay, path, false);
            }
            if (value != null) {
                return value;
            }
        }
        return root == null ? null : walk(root, path, true);
    }

    /**
     * Like {@link #getValue(String)} but unresolved paths fail.
     *
     * @throws UnknownReferenceException if the path does not resolve
     */
    public Value resolve(String path) {
        Value value = getValue(path);
        if (value == null) {
            throw new UnknownReferenceException(path);
        }
        return value;
    }

    static Value walk(Value start, String path, boolean scalarShortCircuit) {
        Value current = start;
        for (String segment : path.split("\\.", -1)) {
            switch (current.getType()) {
                case OBJECT -> current = current.get(segment);
                case ARRAY -> current = ((ArrayValue) current).get(parseIndex(segment));
                default -> {
                    return scalarShortCircuit ? current : null;
                }
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) { // too many digits, no array is that long
            return -1;
        }
    }

    /**
     * Display text of the value at the given path. Objects and arrays render as the
     * empty string.
     *
     * @throws UnknownReferenceException if the path does not resolve
     */
    public String getValueString(String path) {
        Value value = resolve(path);
        return value.isContainer() ? StringUtils.EMPTY : value.toString();
    }

    //==================================================================
    // constants

    public void addConst(String name, Value value) {
        constants.put(name, adopt(value));
    }

    /**
     * Typed constant lookup, using the same conversions as {@link #getCoerce(Class, String)}.
     *
     * @throws MissingConstantException if the name was never registered
     * @throws UnknownReferenceException if the constant is of another variant
     */
    public <T> T getConst(Class<T> type, String name) {
        Value value = constants.get(name);
        if (value == null) {
            throw new MissingConstantException(name);
        }
        return Coercion.fromValue(type, value, name);
    }

    public boolean hasConst(String name) {
        return constants.containsKey(name);
    }

    //==================================================================
    // coercion

    public <T> T getCoerce(Class<T> type, String path) {
        return Coercion.fromValue(type, getValue(path), path);
    }

    public String coerceString(Object o) {
        return Coercion.toText(o);
    }

    public Value toValue(Object o) {
        checkOpen();
        return Coercion.toValue(this, o);
    }

    //==================================================================
    // json

    /**
     * Compact JSON of the root, {@code null} when there is no root.
     */
    public String toJson() {
        return root == null ? null : encode(false);
    }

    /**
     * Indented JSON of the root with a trailing newline, {@code null} when there is no root.
     */
    public String toPrettyJson() {
        return root == null ? null : encode(true) + "\n";
    }

    private String encode(boolean pretty) {
        StringBuilder sb = new StringBuilder(config.getScratchCapacity());
        Json.encode(root, pretty, config.getMaxDepth(), sb);
        return sb.toString();
    }

    /**
     * Decodes JSON text and binds the result as the root. The top level must be an object
     * or an array. Nothing is bound if decoding fails.
     *
     * @throws JsonDecodeException if the text is not valid JSON or out of range
     * @throws IncompatibleRootTypeException if a root of the other variant is already bound
     */
    public Value fromJson(String json) {
        checkOpen();
        Value value = Json.decode(this, json);
        if (!value.isContainer()) {
            throw new JsonDecodeException("top level json must be an object or array, was: " + value.getType());
        }
        if (root != null && root.getType() != value.getType()) {
            throw new IncompatibleRootTypeException(root.getType(), value.getType());
        }
        root = value;
        return value;
    }

    //==================================================================
    // output

    /**
     * Appends text to the output. The very first write after creation or
     * {@link #clearOutput()} drops one leading line terminator.
     */
    public void write(CharSequence text) {
        checkOpen();
        if (text == null) {
            return;
        }
        if (outputStarted) {
            output.append(text);
            return;
        }
        outputStarted = true;
        String s = text.toString();
        if (s.startsWith("\r\n")) {
            output.append(s, 2, s.length());
        } else if (s.startsWith("\n")) {
            output.append(s, 1, s.length());
        } else {
            output.append(s);
        }
    }

    /**
     * Removes one trailing line terminator from the output, if present.
     */
    public void chompOutputBuffer() {
        int length = output.length();
        if (length >= 2 && output.charAt(length - 2) == '\r' && output.charAt(length - 1) == '\n') {
            output.setLength(length - 2);
        } else if (length >= 1 && output.charAt(length - 1) == '\n') {
            output.setLength(length - 1);
        }
    }

    public String getOutput() {
        return output.toString();
    }

    public void clearOutput() {
        output.setLength(0);
        outputStarted = false;
    }

    public String strip(String text) {
        return StringUtils.strip(text);
    }

    public String chomp(String text) {
        return StringUtils.chomp(text);
    }

    //==================================================================
    // iteration

    public List<Value> arrayItems() {
        return root instanceof ArrayValue array ? array.items() : Collections.emptyList();
    }

    public List<ObjectValue.Item> objectItems() {
        return root instanceof ObjectValue object ? object.items() : Collections.emptyList();
    }

    //==================================================================

    /**
     * Structural equality of the two roots, two stores without a root are equal.
     */
    public boolean eql(Store other) {
        if (root == null || other.root == null) {
            return root == null && other.root == null;
        }
        return root.eql(other.root);
    }

    /**
     * Drops the root, overlay and output so the store can be filled again. Registered
     * constants are kept.
     */
    public void reset() {
        checkOpen();
        if (logger.isDebugEnabled()) {
            logger.debug("reset store, {} values allocated", allocated);
        }
        root = null;
        overlay = null;
        output = new StringBuilder(config.getOutputCapacity());
        outputStarted = false;
        allocated = 0;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        logger.debug("close store, {} values allocated", allocated);
        root = null;
        overlay = null;
        output = new StringBuilder(0);
        closed = true;
    }

}
