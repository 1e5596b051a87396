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

/**
 * Tuning knobs for a {@link Store}.
 * <p>
 * Defaults come from system properties so that an application can adjust them
 * without code changes:
 * <ul>
 *   <li>{@code stencil.data.maxDepth} - deepest container nesting the codec will walk (default 512)</li>
 *   <li>{@code stencil.data.outputCapacity} - initial size of the output buffer (default 1024)</li>
 *   <li>{@code stencil.data.scratchCapacity} - initial size of the JSON scratch buffer (default 256)</li>
 * </ul>
 */
public class DataConfig {

    public static final String MAX_DEPTH = "stencil.data.maxDepth";
    public static final String OUTPUT_CAPACITY = "stencil.data.outputCapacity";
    public static final String SCRATCH_CAPACITY = "stencil.data.scratchCapacity";

    private int maxDepth = intProperty(MAX_DEPTH, 512);
    private int outputCapacity = intProperty(OUTPUT_CAPACITY, 1024);
    private int scratchCapacity = intProperty(SCRATCH_CAPACITY, 256);

    private static int intProperty(String name, int defaultValue) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + name + ": " + raw, e);
        }
    }

    public static DataConfig defaults() {
        return new DataConfig();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public DataConfig setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        return this;
    }

    public int getOutputCapacity() {
        return outputCapacity;
    }

    public DataConfig setOutputCapacity(int outputCapacity) {
        this.outputCapacity = Math.max(0, outputCapacity);
        return this;
    }

    public int getScratchCapacity() {
        return scratchCapacity;
    }

    public DataConfig setScratchCapacity(int scratchCapacity) {
        this.scratchCapacity = Math.max(0, scratchCapacity);
        return this;
    }

    @Override
    public String toString() {
        return "[maxDepth: " + maxDepth + ", outputCapacity: " + outputCapacity + ", scratchCapacity: " + scratchCapacity + "]";
    }

}
