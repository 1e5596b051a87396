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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects template roots and files, validates that logical names are unique per prefix
 * and binds every template to its routine.
 * <pre>
 * Manifest manifest = new ManifestBuilder()
 *         .root("", "src/templates")
 *         .template("", "users/index.html", ctx -&gt; ctx.writeValue("user.name"))
 *         .build();
 * </pre>
 */
public class ManifestBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ManifestBuilder.class);

    static final String NAME_PREFIX = "tpl_";
    static final int NAME_LENGTH = 16;

    private final Map<String, Path> roots = new LinkedHashMap<>();
    private final List<TemplatePath> files = new ArrayList<>();
    private final Map<TemplatePath, TemplateFunction> routines = new HashMap<>();

    public ManifestBuilder root(String prefix, String dir) {
        return root(new TemplatePath(prefix, dir));
    }

    public ManifestBuilder root(TemplatePath root) {
        if (roots.containsKey(root.prefix())) {
            throw new IllegalArgumentException("template prefix already registered: " + root.prefix());
        }
        roots.put(root.prefix(), Path.of(root.path()).toAbsolutePath().normalize());
        return this;
    }

    /**
     * Registers a template file without a routine, enough for {@link #validate()}.
     * Relative paths resolve against the root of the prefix.
     */
    public ManifestBuilder file(String prefix, String path) {
        files.add(new TemplatePath(prefix, path));
        return this;
    }

    public ManifestBuilder file(TemplatePath file) {
        files.add(file);
        return this;
    }

    public ManifestBuilder template(String prefix, String path, TemplateFunction routine) {
        TemplatePath file = new TemplatePath(prefix, path);
        files.add(file);
        routines.put(file, routine);
        return this;
    }

    /**
     * First pass: computes logical names, generates identifiers and reports templates
     * whose logical name is already taken within the same prefix.
     */
    public ManifestResult validate() {
        List<ManifestResult.Entry> entries = new ArrayList<>(files.size());
        List<ManifestResult.Failure> failures = new ArrayList<>();
        Map<String, Set<String>> keysByPrefix = new HashMap<>();
        Set<String> names = new HashSet<>();
        for (TemplatePath file : files) {
            Path root = roots.get(file.prefix());
            if (root == null) {
                throw new IllegalArgumentException("unknown template prefix: '" + file.prefix() + "' for " + file.path());
            }
            String key = toKey(root, resolve(root, file.path()));
            if (!keysByPrefix.computeIfAbsent(file.prefix(), k -> new HashSet<>()).add(key)) {
                logger.warn("duplicate template: {}", file.path());
                failures.add(new ManifestResult.Failure(file.prefix(), key, file.path(), "duplicate template"));
                continue;
            }
            entries.add(new ManifestResult.Entry(file.prefix(), key, generateName(names), isPartial(key), file.path()));
        }
        return new ManifestResult(entries, failures);
    }

    /**
     * Second pass: validates and binds routines, grouped by root in registration order.
     *
     * @throws ManifestException if any template name is duplicated
     * @throws IllegalStateException if a template has no routine
     */
    public Manifest build() {
        ManifestResult result = validate();
        if (!result.pass) {
            throw new ManifestException(result);
        }
        List<Template> templates = new ArrayList<>(result.entries.size());
        for (String prefix : roots.keySet()) {
            for (ManifestResult.Entry entry : result.entries) {
                if (!entry.prefix().equals(prefix)) {
                    continue;
                }
                TemplateFunction routine = routines.get(new TemplatePath(entry.prefix(), entry.path()));
                if (routine == null) {
                    throw new IllegalStateException("no routine bound for template: " + entry.path());
                }
                templates.add(new Template(entry.key(), entry.name(), entry.prefix(), entry.partial(), routine));
            }
        }
        logger.debug("compiled {} template(s)", templates.size());
        return new Manifest(templates);
    }

    static Path resolve(Path root, String path) {
        Path file = root.resolve(path).normalize();
        if (!file.startsWith(root) || file.equals(root)) {
            throw new IllegalArgumentException("template is not inside its root: " + path + " (root: " + root + ")");
        }
        return file;
    }

    /**
     * Path relative to the root, '/' separated, without the file extension.
     */
    static String toKey(Path root, Path file) {
        StringBuilder sb = new StringBuilder();
        for (Path part : root.relativize(file)) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(part);
        }
        String key = sb.toString();
        int slash = key.lastIndexOf('/');
        int dot = key.lastIndexOf('.');
        return dot > slash + 1 ? key.substring(0, dot) : key;
    }

    static boolean isPartial(String key) {
        return key.startsWith("_", key.lastIndexOf('/') + 1);
    }

    private static String generateName(Set<String> taken) {
        String name;
        do {
            name = NAME_PREFIX + StringUtils.randomAlphaNumeric(NAME_LENGTH);
        } while (!taken.add(name));
        return name;
    }

}
