package org.aipomoea.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

    @Test
    void testRemoveExtension() {
        assertEquals("img1", Utils.removeExtension("img1.jpg"));
        assertEquals("a.b", Utils.removeExtension("a.b.png"));
        assertEquals(".hidden", Utils.removeExtension(".hidden"));
        assertEquals("noext", Utils.removeExtension("noext"));
    }

    @Test
    void testBaseName_bothSeparators() {
        assertEquals("x.jpg", Utils.baseName("C:\\up\\x.jpg"));
        assertEquals("x.jpg", Utils.baseName("/up/x.jpg"));
        assertEquals("x.jpg", Utils.baseName("x.jpg"));
    }

    @Test
    void testStrip() {
        assertEquals("A_1.jpg", Utils.strip(" - A_1.jpg -", " -"));
        assertEquals("", Utils.strip(" - ", " -"));
    }

    @Test
    void testTokenize_keepsEmptyTokens() {
        assertEquals(List.of("Matrix", "Gen", "Rep"), Utils.tokenize("Matrix-Gen_Rep"));
        assertEquals(List.of("A", "", "1"), Utils.tokenize("A__1"));
    }

    @Test
    void testEscapeCsvField() {
        assertEquals("", Utils.escapeCsvField(null));
        assertEquals("plain", Utils.escapeCsvField("plain"));
        assertEquals("\"a,b\"", Utils.escapeCsvField("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", Utils.escapeCsvField("say \"hi\""));
    }
}
