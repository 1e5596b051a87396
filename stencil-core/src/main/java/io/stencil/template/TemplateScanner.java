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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds template files below a root directory by extension.
 */
public class TemplateScanner {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".html", ".txt");

    private final List<String> extensions;

    public TemplateScanner() {
        this(DEFAULT_EXTENSIONS);
    }

    public TemplateScanner(List<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * Returns the files below the root, paths relative to it and sorted so that
     * the result does not depend on the file system.
     */
    public List<TemplatePath> scan(TemplatePath root) {
        Path dir = Path.of(root.path());
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("not a directory: " + dir);
        }
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::matches)
                    .map(p -> dir.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .map(p -> new TemplatePath(root.prefix(), p))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to scan template root: " + dir, e);
        }
    }

    private boolean matches(Path file) {
        String name = file.getFileName().toString();
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

}
