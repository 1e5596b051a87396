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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registry of compiled templates. Lookups walk the templates in registration order
 * and return {@code null} when nothing matches.
 */
public class Manifest {

    private final List<Template> all;

    Manifest(List<Template> all) {
        this.all = Collections.unmodifiableList(all);
    }

    /**
     * First full (non-partial) template with the given name, any prefix.
     */
    public Template find(String name) {
        for (Template template : all) {
            if (!template.isPartial() && template.getKey().equals(name)) {
                return template;
            }
        }
        return null;
    }

    public Template findPrefixed(String prefix, String name) {
        for (Template template : all) {
            if (!template.isPartial() && template.getPrefix().equals(prefix) && template.getKey().equals(name)) {
                return template;
            }
        }
        return null;
    }

    /**
     * Partial {@code foo/bar} is stored as {@code foo/_bar}.
     */
    public Template findPartial(String prefix, String name) {
        String key = partialKey(name);
        for (Template template : all) {
            if (template.isPartial() && template.getPrefix().equals(prefix) && template.getKey().equals(key)) {
                return template;
            }
        }
        return null;
    }

    public Template findPartial(String name) {
        String key = partialKey(name);
        for (Template template : all) {
            if (template.isPartial() && template.getKey().equals(key)) {
                return template;
            }
        }
        return null;
    }

    static String partialKey(String name) {
        int pos = name.lastIndexOf('/') + 1;
        if (name.startsWith("_", pos)) {
            return name;
        }
        return name.substring(0, pos) + "_" + name.substring(pos);
    }

    public List<Template> templates() {
        List<Template> list = new ArrayList<>(all.size());
        for (Template template : all) {
            if (!template.isPartial()) {
                list.add(template);
            }
        }
        return list;
    }

    public int size() {
        return all.size();
    }

}
