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

import io.stencil.common.StringUtils;
import io.stencil.data.ObjectValue;
import io.stencil.data.Store;

import java.util.Collections;
import java.util.Map;

/**
 * What a template routine sees while rendering: the data store, typed lookups and
 * the ability to splice in partials.
 */
public class RenderContext {

    private final Renderer renderer;
    private final Template template;
    private final Store store;
    private final String content;

    RenderContext(Renderer renderer, Template template, Store store, String content) {
        this.renderer = renderer;
        this.template = template;
        this.store = store;
        this.content = content;
    }

    public Store data() {
        return store;
    }

    public Template template() {
        return template;
    }

    /**
     * Writes any supported Java value as text.
     */
    public void write(Object o) {
        store.write(store.coerceString(o));
    }

    public void writeValue(String path) {
        store.write(store.getValueString(path));
    }

    public <T> T value(Class<T> type, String path) {
        return store.getCoerce(type, path);
    }

    public <T> T constant(Class<T> type, String name) {
        return store.getConst(type, name);
    }

    public void partial(String name) {
        partial(name, Collections.emptyMap());
    }

    /**
     * Renders a partial with the arguments visible as an overlay on the data. The previous
     * overlay is restored afterwards and one trailing newline of the partial is dropped.
     */
    public void partial(String name, Map<String, ?> args) {
        Template partial = renderer.findPartial(template.getPrefix(), name);
        ObjectValue overlay = store.createObject();
        args.forEach((k, v) -> overlay.put(k, store.toValue(v)));
        ObjectValue previous = store.getOverlay();
        store.setOverlay(overlay);
        try {
            partial.render(new RenderContext(renderer, partial, store, content));
        } finally {
            store.setOverlay(previous);
        }
        store.chompOutputBuffer();
    }

    /**
     * Output of the inner template when rendering a layout, empty otherwise.
     */
    public String content() {
        return content == null ? StringUtils.EMPTY : content;
    }

}
