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
package io.stencil.cli;

import io.stencil.output.Console;
import io.stencil.template.ManifestBuilder;
import io.stencil.template.ManifestResult;
import io.stencil.template.TemplatePath;
import io.stencil.template.TemplateScanner;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * The 'manifest' subcommand, lists the templates found below one or more roots and
 * checks that their names are unique.
 * <pre>
 * stencil manifest src/views
 * stencil manifest views=src/views mail=src/mail --ext .html,.txt
 * </pre>
 */
@Command(
        name = "manifest",
        mixinStandardHelpOptions = true,
        description = "List templates and check for duplicate names"
)
public class ManifestCommand implements Callable<Integer> {

    @Parameters(
            arity = "1..*",
            description = "Template roots as prefix=dir or dir"
    )
    List<String> roots;

    @Option(
            names = {"-e", "--ext"},
            split = ",",
            description = "Template file extensions (default: .html,.txt)"
    )
    List<String> extensions;

    @Override
    public Integer call() {
        TemplateScanner scanner = new TemplateScanner(extensions == null ? TemplateScanner.DEFAULT_EXTENSIONS : extensions);
        ManifestBuilder builder = new ManifestBuilder();
        try {
            for (String text : roots) {
                TemplatePath root = TemplatePath.parse(text);
                builder.root(root);
                for (TemplatePath file : scanner.scan(root)) {
                    builder.file(file);
                }
            }
        } catch (IllegalArgumentException | UncheckedIOException e) {
            Console.println(Console.fail(e.getMessage()));
            return 1;
        }
        ManifestResult result = builder.validate();
        for (ManifestResult.Entry entry : result.entries) {
            String key = entry.prefix().isEmpty() ? entry.key() : entry.prefix() + ":" + entry.key();
            Console.println(entry.name() + " " + key + (entry.partial() ? " (partial)" : ""));
        }
        if (!result.pass) {
            Console.println(Console.fail(result.getMessage()));
            return 1;
        }
        Console.println(Console.pass(result.entries.size() + " template(s)"));
        return 0;
    }

}
