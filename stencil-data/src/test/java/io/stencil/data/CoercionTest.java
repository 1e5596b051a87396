package io.stencil.data;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Formattable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CoercionTest {

    Store store;

    @BeforeEach
    void beforeEach() {
        store = new Store();
        store.fromJson("{\"n\":42,\"wide\":300,\"huge\":12345678901234,\"f\":1.5,\"s\":\"x\",\"b\":true,\"o\":{},\"a\":[]}");
    }

    @Test
    void testToTextScalars() {
        assertEquals("", Coercion.toText(null));
        assertEquals("", Coercion.toText(Optional.empty()));
        assertEquals("5", Coercion.toText(Optional.of(5)));
        assertEquals("true", Coercion.toText(true));
        assertEquals("42", Coercion.toText(42L));
        assertEquals("7", Coercion.toText((short) 7));
        assertEquals("c", Coercion.toText('c'));
        assertEquals("123456789012345678901234567890", Coercion.toText(new BigInteger("123456789012345678901234567890")));
    }

    @Test
    void testToTextDecimals() {
        assertEquals("1", Coercion.toText(1.0));
        assertEquals("2.5", Coercion.toText(2.50));
        assertEquals("1.5", Coercion.toText(1.5f));
        assertEquals("3.14", Coercion.toText(new BigDecimal("3.140")));
        assertEquals("100000000000000000000", Coercion.toText(1e20));
        assertEquals("0.0001", Coercion.toText(0.0001));
        assertEquals("0", Coercion.toText(0.0));
    }

    @Test
    void testToTextText() {
        assertEquals("abc", Coercion.toText("abc"));
        assertEquals("sb", Coercion.toText(new StringBuilder("sb")));
        assertEquals("chars", Coercion.toText("chars".toCharArray()));
        assertEquals("héllo", Coercion.toText("héllo".getBytes(StandardCharsets.UTF_8)));
        assertEquals("a\nb\nc", Coercion.toText(new String[]{"a", "b", "c"}));
    }

    @Test
    void testToTextValue() {
        assertEquals("x", Coercion.toText(store.getValue("s")));
        assertEquals("1.5", Coercion.toText(store.getValue("f")));
        assertEquals("[]", Coercion.toText(store.getValue("a")));
    }

    @Test
    void testToTextFormattable() {
        Formattable formattable = (formatter, flags, width, precision) -> formatter.format("custom");
        assertEquals("custom", Coercion.toText(formattable));
    }

    @Test
    void testToTextUnsupported() {
        UnsupportedTypeException e = assertThrows(UnsupportedTypeException.class, () -> Coercion.toText(new Object()));
        assertEquals("java.lang.Object", e.getTypeName());
        assertThrows(UnsupportedTypeException.class, () -> Coercion.toText(List.of("a")));
        assertThrows(UnsupportedTypeException.class, () -> store.coerceString(new Date()));
    }

    @Test
    void testGetCoerceIntegers() {
        int n = store.getCoerce(int.class, "n");
        assertEquals(42, n);
        assertEquals(42L, store.getCoerce(Long.class, "n"));
        assertEquals((short) 300, store.getCoerce(short.class, "wide"));
        assertEquals(BigInteger.valueOf(12345678901234L), store.getCoerce(BigInteger.class, "huge"));
        assertThrows(ArithmeticException.class, () -> store.getCoerce(byte.class, "wide"));
        assertThrows(ArithmeticException.class, () -> store.getCoerce(int.class, "huge"));
    }

    @Test
    void testGetCoerceOthers() {
        assertEquals("x", store.getCoerce(String.class, "s"));
        assertEquals(1.5, store.getCoerce(double.class, "f"));
        assertEquals(1.5f, store.getCoerce(Float.class, "f"));
        assertEquals(new BigDecimal("1.5"), store.getCoerce(BigDecimal.class, "f"));
        assertTrue(store.getCoerce(boolean.class, "b"));
        assertTrue(store.getCoerce(ObjectValue.class, "o").isObject());
        assertTrue(store.getCoerce(ArrayValue.class, "a").isArray());
        assertEquals("42", store.getCoerce(Value.class, "n").toString());
    }

    @Test
    void testGetCoerceMismatch() {
        UnknownReferenceException e = assertThrows(UnknownReferenceException.class, () -> store.getCoerce(String.class, "n"));
        assertEquals("n", e.getReference());
        assertThrows(UnknownReferenceException.class, () -> store.getCoerce(int.class, "f"));
        assertThrows(UnknownReferenceException.class, () -> store.getCoerce(double.class, "n"));
        assertThrows(UnknownReferenceException.class, () -> store.getCoerce(ObjectValue.class, "a"));
        assertThrows(UnknownReferenceException.class, () -> store.getCoerce(String.class, "missing"));
    }

    @Test
    void testGetCoerceUnsupported() {
        UnsupportedTypeException e = assertThrows(UnsupportedTypeException.class, () -> store.getCoerce(Date.class, "n"));
        assertEquals("java.util.Date", e.getTypeName());
        assertThrows(UnsupportedTypeException.class, () -> store.getCoerce(char.class, "s"));
    }

    @Test
    void testToValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "bob");
        map.put("tags", List.of("a", "b"));
        map.put("age", 30);
        map.put("score", 9.5);
        map.put("admin", false);
        map.put("none", null);
        map.put("maybe", Optional.empty());
        map.put("array", new Object[]{1, 'c'});
        Value value = store.toValue(map);
        assertEquals("{\"name\":\"bob\",\"tags\":[\"a\",\"b\"],\"age\":30,\"score\":9.5,\"admin\":false,\"none\":null,\"maybe\":null,\"array\":[1,\"c\"]}", value.toJson());
        assertSame(store, value.getStore());
        assertNotSame(value, store.getRoot());
    }

    @Test
    void testToValuePassesOwnValuesAndCopiesForeign() {
        Value own = store.getValue("o");
        assertSame(own, store.toValue(own));
        Store other = new Store();
        Value foreign = other.string("far");
        Value copied = store.toValue(foreign);
        assertNotSame(foreign, copied);
        assertSame(store, copied.getStore());
        assertEquals("far", copied.toString());
    }

    @Test
    void testToValueUnsupported() {
        assertThrows(UnsupportedTypeException.class, () -> store.toValue(new Date()));
        assertThrows(UnsupportedTypeException.class, () -> store.toValue(Map.of("k", new Object())));
    }

}
