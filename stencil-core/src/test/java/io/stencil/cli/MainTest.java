package io.stencil.cli;

import io.stencil.Globals;
import io.stencil.Main;
import io.stencil.output.Console;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path dir;

    ByteArrayOutputStream baos;
    PrintStream original;
    InputStream originalStdin;

    @BeforeEach
    void beforeEach() {
        baos = new ByteArrayOutputStream();
        original = Console.getOutput();
        originalStdin = Inputs.stdin;
        Console.setOutput(new PrintStream(baos, true, StandardCharsets.UTF_8));
        Console.setColorsEnabled(false);
    }

    @AfterEach
    void afterEach() {
        Console.setOutput(original);
        Inputs.stdin = originalStdin;
    }

    private String output() {
        return baos.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file.toString();
    }

    @Test
    void testFormatCompact() throws IOException {
        String file = write("data.json", "{ \"b\": 1,\n \"a\": [1.0, true, null] }");
        assertEquals(0, Main.execute("format", file));
        assertEquals("{\"b\":1,\"a\":[1.0,true,null]}\n", output());
    }

    @Test
    void testFormatPretty() throws IOException {
        String file = write("data.json", "{\"a\":{\"b\":\"c\"}}");
        assertEquals(0, Main.execute("format", file, "--pretty"));
        assertEquals("{\n  \"a\": {\n    \"b\": \"c\"\n  }\n}\n", output());
    }

    @Test
    void testFormatStdin() {
        Inputs.stdin = new ByteArrayInputStream("[1, 2]".getBytes(StandardCharsets.UTF_8));
        assertEquals(0, Main.execute("format"));
        assertEquals("[1,2]\n", output());
    }

    @Test
    void testFormatInvalid() throws IOException {
        String file = write("bad.json", "{\"a\":");
        assertEquals(1, Main.execute("format", file));
        assertTrue(output().startsWith("invalid json"));
    }

    @Test
    void testFormatMissingFile() {
        assertEquals(1, Main.execute("format", dir.resolve("nope.json").toString()));
        assertTrue(output().startsWith("failed to read input"));
    }

    @Test
    void testQuery() throws IOException {
        String file = write("data.json", "{\"user\":{\"name\":\"Ada\",\"tags\":[\"x\",\"y\"]},\"n\":1.50}");
        assertEquals(0, Main.execute("query", file, "user.name", "user.tags.1", "n", "user"));
        assertEquals("Ada\ny\n1.5\n\n", output());
    }

    @Test
    void testQueryUnknownReference() throws IOException {
        String file = write("data.json", "{\"a\":1}");
        assertEquals(1, Main.execute("query", file, "nope", "a"));
        assertEquals("unknown data reference: nope\n1\n", output());
    }

    @Test
    void testQueryOverlay() throws IOException {
        String file = write("data.json", "{\"a\":\"root\",\"b\":\"root\"}");
        assertEquals(0, Main.execute("query", file, "a", "b", "--overlay", "{\"a\":\"overlay\"}"));
        assertEquals("overlay\nroot\n", output());
    }

    @Test
    void testQueryOverlayMustBeObject() throws IOException {
        String file = write("data.json", "{\"a\":1}");
        assertEquals(1, Main.execute("query", file, "a", "--overlay", "[1]"));
        assertEquals("overlay must be a json object\n", output());
    }

    @Test
    void testManifest() throws IOException {
        write("views/index.html", "");
        write("views/users/_row.html", "");
        write("views/users/list.html", "");
        assertEquals(0, Main.execute("manifest", "web=" + dir.resolve("views")));
        String out = output();
        assertTrue(out.contains(" web:index\n"));
        assertTrue(out.contains(" web:users/_row (partial)\n"));
        assertTrue(out.contains(" web:users/list\n"));
        assertTrue(out.endsWith("3 template(s)\n"));
    }

    @Test
    void testManifestDuplicates() throws IOException {
        write("views/about.html", "");
        write("views/about.txt", "");
        assertEquals(1, Main.execute("manifest", dir.resolve("views").toString()));
        assertTrue(output().contains("1 duplicate template(s)"));
    }

    @Test
    void testManifestExtensions() throws IOException {
        write("views/about.html", "");
        write("views/about.txt", "");
        assertEquals(0, Main.execute("manifest", dir.resolve("views").toString(), "--ext", ".html"));
        assertTrue(output().endsWith("1 template(s)\n"));
    }

    @Test
    void testManifestMissingRoot() {
        assertEquals(1, Main.execute("manifest", dir.resolve("missing").toString()));
        assertTrue(output().startsWith("not a directory"));
    }

    @Test
    void testNoSubcommandPrintsUsage() {
        assertEquals(0, Main.execute());
        String out = output();
        assertTrue(out.contains("stencil"));
        assertTrue(out.contains("format"));
        assertTrue(out.contains("manifest"));
    }

    @Test
    void testVersion() {
        assertNotNull(Globals.STENCIL_VERSION);
        assertFalse(Globals.STENCIL_VERSION.contains("${"));
    }

}
