package com.questrail.lsnp.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineEscapingTest
{
    @Test
    void plainValueIsReturnedUnchanged() {
        String value = "hello: world";
        assertSame(value, LineEscaping.escape(value));
        assertSame(value, LineEscaping.unescape(value));
    }

    @Test
    void lineBreaksAndBackslashesAreEscaped() {
        assertEquals("a\\nb\\rc\\\\d", LineEscaping.escape("a\nb\rc\\d"));
    }

    @Test
    void escapedValueContainsNoLineBreaks() {
        String escaped = LineEscaping.escape("line one\nline two\r\n");
        assertEquals(-1, escaped.indexOf('\n'));
        assertEquals(-1, escaped.indexOf('\r'));
    }

    @Test
    void unescapeReversesEscape() {
        String original = "C:\\temp\\new\nsecond line\\n literal";
        assertEquals(original, LineEscaping.unescape(LineEscaping.escape(original)));
    }

    /**
     * Peers that never escape backslashes still produce readable values: an
     * unknown escape and a trailing backslash are kept as they are.
     */
    @Test
    void unknownEscapesAndTrailingBackslashAreKeptVerbatim() {
        assertEquals("\\q", LineEscaping.unescape("\\q"));
        assertEquals("end\\", LineEscaping.unescape("end\\"));
    }
}
