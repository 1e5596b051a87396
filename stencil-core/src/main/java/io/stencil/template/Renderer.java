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
import io.stencil.data.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives templates of a {@link Manifest} against a {@link Store}. The store must have all
 * constants registered that the templates refer to.
 */
public class Renderer {

    private static final Logger logger = LoggerFactory.getLogger(Renderer.class);

    private final Manifest manifest;

    public Renderer(Manifest manifest) {
        this.manifest = manifest;
    }

    public Manifest getManifest() {
        return manifest;
    }

    public String render(String name, Store store) {
        Template template = find(name);
        run(template, store, null);
        return store.getOutput();
    }

    /**
     * Renders the template, then renders the layout with the template output available
     * through {@link RenderContext#content()}.
     */
    public String render(String name, Store store, String layoutName) {
        Template template = find(name);
        Template layout = find(layoutName);
        run(template, store, null);
        String content = store.getOutput();
        store.clearOutput();
        run(layout, store, content);
        return store.getOutput();
    }

    private Template find(String name) {
        Template template = manifest.find(name);
        if (template == null) {
            throw new TemplateNotFoundException(name);
        }
        return template;
    }

    Template findPartial(String prefix, String name) {
        Template partial = manifest.findPartial(prefix, name);
        if (partial == null) {
            partial = manifest.findPartial(name);
        }
        if (partial == null) {
            throw new TemplateNotFoundException(name);
        }
        return partial;
    }

    private void run(Template template, Store store, String content) {
        logger.debug("rendering: {}", template);
        try {
            template.render(new RenderContext(this, template, store, content));
        } catch (RuntimeException e) {
            logger.error("render failed: {} - {}", template, StringUtils.throwableToString(e));
            throw e;
        }
    }

}
