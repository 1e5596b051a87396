package io.stencil.template;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateScannerTest {

    @TempDir
    Path dir;

    private void touch(String path) throws IOException {
        Path file = dir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

    @Test
    void testScan() throws IOException {
        touch("index.html");
        touch("users/_row.html");
        touch("users/list.html");
        touch("notes.md");
        List<TemplatePath> files = new TemplateScanner().scan(new TemplatePath("web", dir.toString()));
        assertEquals(List.of(
                new TemplatePath("web", "index.html"),
                new TemplatePath("web", "users/_row.html"),
                new TemplatePath("web", "users/list.html")), files);
    }

    @Test
    void testScanExtensions() throws IOException {
        touch("a.html");
        touch("b.md");
        List<TemplatePath> files = new TemplateScanner(List.of(".md")).scan(new TemplatePath("", dir.toString()));
        assertEquals(List.of(new TemplatePath("", "b.md")), files);
    }

    @Test
    void testScannedFilesFeedManifest() throws IOException {
        touch("index.html");
        touch("index.txt");
        TemplatePath root = new TemplatePath("", dir.toString());
        ManifestBuilder builder = new ManifestBuilder().root(root);
        new TemplateScanner().scan(root).forEach(builder::file);
        ManifestResult result = builder.validate();
        assertFalse(result.pass);
        assertEquals("index", result.failures.get(0).key());
    }

    @Test
    void testNotADirectory() {
        TemplatePath root = new TemplatePath("", dir.resolve("missing").toString());
        assertThrows(IllegalArgumentException.class, () -> new TemplateScanner().scan(root));
    }

}
