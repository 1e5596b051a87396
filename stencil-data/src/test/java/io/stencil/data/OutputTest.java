package io.stencil.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputTest {

    @Test
    void testFirstWriteDropsLeadingNewline() {
        Store store = new Store();
        store.write("\nHello");
        store.write("\nWorld\n");
        assertEquals("Hello\nWorld\n", store.getOutput());
    }

    @Test
    void testFirstWriteDropsLeadingCrLf() {
        Store store = new Store();
        store.write("\r\n\r\nA");
        assertEquals("\r\nA", store.getOutput());
    }

    @Test
    void testFirstWriteWithoutNewline() {
        Store store = new Store();
        store.write("x");
        store.write("\ny");
        assertEquals("x\ny", store.getOutput());
    }

    @Test
    void testEmptyFirstWriteArmsTrim() {
        Store store = new Store();
        store.write("");
        store.write("\nkept");
        assertEquals("\nkept", store.getOutput());
        store.write(null);
        assertEquals("\nkept", store.getOutput());
    }

    @Test
    void testChompOutputBuffer() {
        Store store = new Store();
        store.write("a\n\n");
        store.chompOutputBuffer();
        assertEquals("a\n", store.getOutput());
        store.write("b\r\n");
        store.chompOutputBuffer();
        assertEquals("a\nb", store.getOutput());
        store.chompOutputBuffer();
        assertEquals("a\nb", store.getOutput());
    }

    @Test
    void testChompEmptyBuffer() {
        Store store = new Store();
        store.chompOutputBuffer();
        assertEquals("", store.getOutput());
    }

    @Test
    void testClearOutput() {
        Store store = new Store();
        store.write("one");
        store.clearOutput();
        assertEquals("", store.getOutput());
        store.write("\ntwo");
        assertEquals("two", store.getOutput());
    }

    @Test
    void testStripAndChomp() {
        Store store = new Store();
        assertEquals("text", store.strip("  \n text \t\n"));
        assertEquals("text\n", store.chomp("text\n\n"));
        assertEquals("text", store.chomp("text\r\n"));
        assertEquals("text", store.chomp("text"));
    }

}
