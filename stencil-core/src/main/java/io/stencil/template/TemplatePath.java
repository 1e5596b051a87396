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

/**
 * A prefixed location: either a template root directory or a single template file
 * within one of the roots.
 */
public record TemplatePath(String prefix, String path) {

    public TemplatePath {
        if (prefix == null || path == null) {
            throw new IllegalArgumentException("prefix and path are required");
        }
    }

    /**
     * Parses {@code prefix=path}, a bare path gets the empty prefix.
     */
    public static TemplatePath parse(String text) {
        int pos = text.indexOf('=');
        if (pos == -1) {
            return new TemplatePath("", text);
        }
        return new TemplatePath(text.substring(0, pos), text.substring(pos + 1));
    }

    @Override
    public String toString() {
        return prefix.isEmpty() ? path : prefix + "=" + path;
    }

}
