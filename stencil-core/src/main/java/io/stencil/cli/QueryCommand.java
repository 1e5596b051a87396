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
import io.stencil.data.Json;
import io.stencil.data.Store;
import io.stencil.data.UnknownReferenceException;
import io.stencil.data.Value;
import io.stencil.output.Console;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * The 'query' subcommand, resolves dotted paths against a JSON document.
 * <pre>
 * stencil query data.json user.name items.0.title
 * stencil query data.json name --overlay '{"name":"override"}'
 * </pre>
 * Every path prints one line. Unknown references are reported and make the exit code 1.
 */
@Command(
        name = "query",
        mixinStandardHelpOptions = true,
        description = "Resolve dotted paths against a JSON document"
)
public class QueryCommand implements Callable<Integer> {

    @Parameters(
            index = "0",
            description = "JSON file to read, - for standard input"
    )
    String file;

    @Parameters(
            index = "1..*",
            arity = "1..*",
            description = "Paths to resolve, e.g. user.name or items.0"
    )
    List<String> paths;

    @Option(
            names = {"-o", "--overlay"},
            description = "JSON object consulted before the document"
    )
    String overlay;

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
            if (overlay != null) {
                Value value = Json.decode(store, overlay);
                if (!value.isObject()) {
                    Console.println(Console.fail("overlay must be a json object"));
                    return 1;
                }
                store.setOverlay(value.asObject());
            }
            int exitCode = 0;
            for (String path : paths) {
                try {
                    Console.println(store.getValueString(path));
                } catch (UnknownReferenceException e) {
                    Console.println(Console.fail(e.getMessage()));
                    exitCode = 1;
                }
            }
            return exitCode;
        } catch (DataException e) {
            Console.println(Console.fail(e.getMessage()));
            return 1;
        }
    }

}
