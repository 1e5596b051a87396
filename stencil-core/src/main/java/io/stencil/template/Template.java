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
package io.stencil.template;

public class Template {

    private final String key;
    private final String name;
    private final String prefix;
    private final boolean partial;
    private final TemplateFunction routine;

    Template(String key, String name, String prefix, boolean partial, TemplateFunction routine) {
        this.key = key;
        this.name = name;
        this.prefix = prefix;
        this.partial = partial;
        this.routine = routine;
    }

    /**
     * Logical name, e.g. {@code users/index} or {@code users/_row} for a partial.
     */
    public String getKey() {
        return key;
    }

    /**
     * Generated identifier, unique across the manifest.
     */
    public String getName() {
        return name;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isPartial() {
        return partial;
    }

    void render(RenderContext ctx) {
        routine.render(ctx);
    }

    @Override
    public String toString() {
        return prefix.isEmpty() ? key : prefix + ":" + key;
    }

}
