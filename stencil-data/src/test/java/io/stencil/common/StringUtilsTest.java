package io.stencil.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StringUtilsTest {

    @Test
    void testStrip() {
        assertEquals("", StringUtils.strip(null));
        assertEquals("", StringUtils.strip(" \n"));
        assertEquals("a b", StringUtils.strip("\t a b \r\n"));
    }

    @Test
    void testChomp() {
        assertEquals("", StringUtils.chomp(null));
        assertEquals("", StringUtils.chomp("\n"));
        assertEquals("a", StringUtils.chomp("a\r\n"));
        assertEquals("a\n", StringUtils.chomp("a\n\n"));
        assertEquals("\na", StringUtils.chomp("\na"));
    }

    @Test
    void testRandomAlphaNumeric() {
        String random = StringUtils.randomAlphaNumeric(16);
        assertEquals(16, random.length());
        assertTrue(random.matches("[a-zA-Z0-9]+"));
        assertNotEquals(random, StringUtils.randomAlphaNumeric(16));
    }

    @Test
    void testThrowableToString() {
        String trace = StringUtils.throwableToString(new IllegalStateException("boom"));
        assertTrue(trace.startsWith("java.lang.IllegalStateException: boom"));
        assertTrue(trace.contains("StringUtilsTest"));
    }

}
