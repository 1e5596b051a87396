package io.stencil.data;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathTest {

    Store store;

    @BeforeEach
    void beforeEach() {
        store = new Store();
        store.fromJson("{\"a\":{\"b\":{\"c\":\"leaf\"}},\"items\":[10,20,{\"name\":\"third\"}],\"empty\":\"\"}");
    }

    private String get(String path) {
        Value value = store.getValue(path);
        return value == null ? null : value.toString();
    }

    @Test
    void testNestedObjects() {
        assertEquals("leaf", get("a.b.c"));
        assertTrue(store.getValue("a.b").isObject());
        assertNull(get("a.x"));
        assertNull(get("x"));
    }

    @Test
    void testScalarShortCircuit() {
        assertEquals("leaf", get("a.b.c.d"));
        assertEquals("leaf", get("a.b.c.d.e.f"));
        assertEquals("10", get("items.0.whatever"));
    }

    @Test
    void testArrayIndexes() {
        assertEquals("10", get("items.0"));
        assertEquals("20", get("items.1"));
        assertEquals("third", get("items.2.name"));
        assertNull(get("items.3"));
        assertNull(get("items.x"));
        assertNull(get("items.-1"));
        assertNull(get("items.1x"));
        assertNull(get("items.99999999999999999999"));
        assertNull(get("items."));
    }

    @Test
    void testEmptySegments() {
        assertNull(get(""));
        assertNull(get("a..b"));
        assertNull(store.getValue(null));
    }

    @Test
    void testOverlayPrecedence() {
        Store store = new Store();
        store.object().put("x", "root-val");
        ObjectValue overlay = store.createObject();
        overlay.put("x", "overlay-val");
        store.setOverlay(overlay);
        assertEquals("overlay-val", store.getValueString("x"));
        store.clearOverlay();
        assertEquals("root-val", store.getValueString("x"));
        assertEquals("root-val", store.getString("x"));
    }

    @Test
    void testOverlayPathFallsBackToRoot() {
        store.fromJson("{\"user\":{\"name\":\"root\",\"age\":3}}");
        ObjectValue overlay = store.createObject();
        ObjectValue user = store.createObject();
        user.put("name", "overlay");
        overlay.put("user", user);
        overlay.put("a.b", "dotted");
        store.setOverlay(overlay);
        assertEquals("overlay", store.getValueString("user.name"));
        assertEquals("3", store.getValueString("user.age"));
        assertEquals("dotted", store.getValueString("a.b"));
        assertSame(overlay, store.getOverlay());
        assertNull(store.getRoot().get("a.b"));
    }

    @Test
    void testOverlayScalarDoesNotShadowLongerPath() {
        store.fromJson("{\"user\":{\"name\":\"root\"}}");
        ObjectValue overlay = store.createObject();
        overlay.put("user", "bob");
        store.setOverlay(overlay);
        assertEquals("bob", store.getValueString("user"));
        assertEquals("root", store.getValueString("user.name"));
        assertNull(store.getValue("user.missing"));
    }

    @Test
    void testResolve() {
        assertEquals("leaf", store.resolve("a.b.c").toString());
        UnknownReferenceException e = assertThrows(UnknownReferenceException.class, () -> store.resolve("a.nope"));
        assertEquals("a.nope", e.getReference());
        assertEquals("unknown data reference: a.nope", e.getMessage());
    }

    @Test
    void testGetValueString() {
        assertEquals("leaf", store.getValueString("a.b.c"));
        assertEquals("", store.getValueString("a"));
        assertEquals("", store.getValueString("items"));
        assertEquals("", store.getValueString("empty"));
        assertEquals("20", store.getValueString("items.1"));
        assertThrows(UnknownReferenceException.class, () -> store.getValueString("missing"));
    }

    @Test
    void testChain() {
        assertEquals("leaf", store.chain("a", "b", "c").toString());
        assertNull(store.chain("a", "b"));
        assertNull(store.chain("a", "b", "c", "d"));
        assertNull(store.chain("items", "0"));
        assertNull(store.chain("nope"));
        assertNull(store.chain());
    }

    @Test
    void testNoRoot() {
        Store empty = new Store();
        assertNull(empty.getValue("a"));
        assertNull(empty.chain("a"));
        assertThrows(UnknownReferenceException.class, () -> empty.getValueString("a"));
    }

}
