package com.sentrius.yang;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class YangStringsTest {

    @Test
    void testUnescape() {
        assertEquals("say \"hi\"", YangStrings.unescape("say \\\"hi\\\""));
        assertEquals("a\nb\tc", YangStrings.unescape("a\\nb\\tc"));
        assertEquals("\\d+", YangStrings.unescape("\\\\d+"));
    }

    @Test
    void testEscapedBackslashBeforeLetter() {
        assertEquals("a\\nb", YangStrings.unescape("a\\\\nb"));
        assertEquals("a\\tb", YangStrings.unescape("a\\\\tb"));
        assertEquals("\\\"", YangStrings.unescape("\\\\\\\""));
    }

    @Test
    void testUnknownEscapesAndTrailingBackslash() {
        assertEquals("\\d", YangStrings.unescape("\\d"));
        assertEquals("end\\", YangStrings.unescape("end\\"));
        assertEquals("plain", YangStrings.unescape("plain"));
        assertNull(YangStrings.unescape(null));
    }

    @Test
    void testUnquote() {
        assertEquals("\\d+", YangStrings.unquote("\"\\\\d+\""));
        assertEquals("\\\\d+", YangStrings.unquote("'\\\\d+'"));
        assertEquals("bare", YangStrings.unquote("bare"));
        assertEquals("\"", YangStrings.unquote("\""));
    }
}
