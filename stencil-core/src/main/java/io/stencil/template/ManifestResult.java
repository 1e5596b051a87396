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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a set of template files: the templates that got an identifier,
 * and the files whose logical name clashed with an earlier one in the same prefix.
 */
public class ManifestResult {

    public record Entry(
            String prefix,
            String key,
            String name,       // generated identifier
            boolean partial,
            String path
    ) {
    }

    public record Failure(
            String prefix,
            String key,
            String path,
            String reason      // e.g. "duplicate template"
    ) {
        public Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("prefix", prefix);
            map.put("key", key);
            map.put("path", path);
            map.put("reason", reason);
            return map;
        }
    }

    public final boolean pass;
    public final List<Entry> entries;
    public final List<Failure> failures;

    ManifestResult(List<Entry> entries, List<Failure> failures) {
        this.pass = failures.isEmpty();
        this.entries = List.copyOf(entries);
        this.failures = List.copyOf(failures);
    }

    public String getMessage() {
        if (pass) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        sb.append(failures.size()).append(" duplicate template(s), template names must be uniquely identifiable");
        for (Failure failure : failures) {
            sb.append("\n  ").append(failure.path()).append(" (").append(failure.prefix()).append(':').append(failure.key()).append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return pass ? "[pass] " + entries.size() + " template(s)" : getMessage();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>(4);
        map.put("pass", pass);
        map.put("count", entries.size());
        if (!failures.isEmpty()) {
            List<Map<String, Object>> list = new ArrayList<>(failures.size());
            for (Failure f : failures) {
                list.add(f.toMap());
            }
            map.put("failures", list);
        }
        return map;
    }

}
