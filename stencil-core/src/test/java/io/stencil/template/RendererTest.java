package io.stencil.template;

import io.stencil.data.ArrayValue;
import io.stencil.data.MissingConstantException;
import io.stencil.data.ObjectValue;
import io.stencil.data.Store;
import io.stencil.data.UnknownReferenceException;
import io.stencil.data.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RendererTest {

    Renderer renderer;
    Store store;

    @BeforeEach
    void beforeEach() {
        Manifest manifest = new ManifestBuilder()
                .root("", "views")
                .root("admin", "admin")
                .template("", "hello.html", ctx -> {
                    ctx.write("\nHello ");
                    ctx.writeValue("user.name");
                    ctx.write("!");
                })
                .template("", "list.html", ctx -> {
                    ctx.write("<ul>");
                    for (Value item : ctx.value(ArrayValue.class, "items")) {
                        ctx.partial("row", Map.of("label", item));
                    }
                    ctx.write("</ul>");
                })
                .template("", "_row.html", ctx -> {
                    ctx.write("<li>");
                    ctx.writeValue("label");
                    ctx.write("</li>\n");
                })
                .template("", "limits.html", ctx -> {
                    int limit = ctx.constant(int.class, "limit");
                    ctx.write(limit * 2);
                    ctx.write(" ");
                    ctx.write(ctx.value(Double.class, "ratio"));
                })
                .template("", "layout.html", ctx -> {
                    ctx.write("<main>");
                    ctx.write(ctx.content());
                    ctx.write("</main>");
                })
                .template("", "nested.html", ctx -> ctx.partial("outer", Map.of("who", "outer")))
                .template("", "_outer.html", ctx -> {
                    ctx.writeValue("who");
                    ctx.write("/");
                    ctx.partial("inner", Map.of("who", "inner"));
                    ctx.write("/");
                    ctx.writeValue("who");
                })
                .template("", "_inner.html", ctx -> ctx.writeValue("who"))
                .template("", "broken.html", ctx -> ctx.writeValue("missing.path"))
                .template("", "orphan.html", ctx -> ctx.partial("nope"))
                .template("admin", "panel.html", ctx -> ctx.partial("row", Map.of("label", "x")))
                .template("admin", "_row.html", ctx -> ctx.write("admin-row"))
                .build();
        renderer = new Renderer(manifest);
        store = new Store();
        store.fromJson("{\"user\":{\"name\":\"Ada\"},\"items\":[\"one\",\"two\"],\"ratio\":0.25}");
    }

    @Test
    void testRender() {
        assertEquals("Hello Ada!", renderer.render("hello", store));
    }

    @Test
    void testPartialWithArguments() {
        assertEquals("<ul><li>one</li><li>two</li></ul>", renderer.render("list", store));
        assertNull(store.getOverlay());
        assertNull(store.get("label"));
    }

    @Test
    void testNestedPartialsRestoreOverlay() {
        assertEquals("outer/inner/outer", renderer.render("nested", store));
        assertNull(store.getOverlay());
    }

    @Test
    void testPartialPrefersOwnPrefix() {
        assertEquals("admin-row", renderer.render("panel", store));
    }

    @Test
    void testConstants() {
        store.addConst("limit", store.integer(21));
        assertEquals("42 0.25", renderer.render("limits", store));
    }

    @Test
    void testMissingConstant() {
        assertThrows(MissingConstantException.class, () -> renderer.render("limits", store));
    }

    @Test
    void testLayout() {
        assertEquals("<main>Hello Ada!</main>", renderer.render("hello", store, "layout"));
    }

    @Test
    void testContentOutsideLayoutIsEmpty() {
        assertEquals("<main></main>", renderer.render("layout", store));
    }

    @Test
    void testUnknownReferencePropagates() {
        UnknownReferenceException e = assertThrows(UnknownReferenceException.class, () -> renderer.render("broken", store));
        assertEquals("missing.path", e.getReference());
    }

    @Test
    void testTemplateNotFound() {
        TemplateNotFoundException e = assertThrows(TemplateNotFoundException.class, () -> renderer.render("nope", store));
        assertEquals("nope", e.getTemplateName());
        assertThrows(TemplateNotFoundException.class, () -> renderer.render("row", store));
        assertThrows(TemplateNotFoundException.class, () -> renderer.render("orphan", store));
        assertThrows(TemplateNotFoundException.class, () -> renderer.render("hello", store, "nope"));
    }

    @Test
    void testRenderAgainstBuiltTree() {
        Store built = new Store();
        ObjectValue root = built.object();
        ObjectValue user = built.createObject();
        user.put("name", "Grace");
        root.put("user", user);
        assertEquals("Hello Grace!", renderer.render("hello", built));
    }

}
