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

import io.stencil.data.DataException;
import io.stencil.data.Store;
import io.stencil.output.Console;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * The 'format' subcommand, decodes JSON and prints it back in canonical form.
 * <pre>
 * stencil format data.json
 * cat data.json | stencil format --pretty
 * </pre>
 */
@Command(
        name = "format",
        mixinStandardHelpOptions = true,
        description = "Print JSON in canonical compact or pretty form"
)
public class FormatCommand implements Callable<Integer> {

    @Parameters(
            arity = "0..1",
            description = "JSON file to read (default: standard input)"
    )
    String file;

    @Option(
            names = {"-p", "--pretty"},
            description = "Indent output with two spaces per level"
    )
    boolean pretty;

    @Override
    public Integer call() {
        String json;
        try {
            json = Inputs.read(file);
        } catch (IOException e) {
            Console.println(Console.fail("failed to read input: " + e.getMessage()));
            return 1;
        }
        try (Store store = new Store()) {
            store.fromJson(json);
            if (pretty) {
                Console.print(store.toPrettyJson());
            } else {
                Console.println(store.toJson());
            }
            return 0;
        } catch (DataException e) {
            Console.println(Console.fail(e.getMessage()));
            return 1;
        }
    }

}
