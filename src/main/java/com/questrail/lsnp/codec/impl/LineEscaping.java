package com.questrail.lsnp.codec.impl;

/**
 * LineEscaping
 * -----------------------------------------------------------------------------
 * Escapes field values so that they never contain a raw line break.
 *
 * <ul>
 *   <li>{@code \} is written as {@code \\}</li>
 *   <li>LF is written as {@code \n}</li>
 *   <li>CR is written as {@code \r}</li>
 * </ul>
 *
 * <p>Unescaping is lenient: an unknown escape pair or a trailing lone
 * backslash is kept verbatim, which keeps values from peers that never escape
 * backslashes readable.</p>
 */
final class LineEscaping
{
    private static final char ESCAPE = '\\';

    private LineEscaping() {}

    static String escape(String value)
    {
        // Fast path: nearly all values are single-line without backslashes.
        if (value.indexOf(ESCAPE) < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }

        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case ESCAPE -> out.append(ESCAPE).append(ESCAPE);
                case '\n' -> out.append(ESCAPE).append('n');
                case '\r' -> out.append(ESCAPE).append('r');
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    static String unescape(String value)
    {
        if (value.indexOf(ESCAPE) < 0) {
            return value;
        }

        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != ESCAPE || i + 1 >= value.length()) {
                out.append(c);
                continue;
            }

            char next = value.charAt(i + 1);
            switch (next) {
                case ESCAPE -> { out.append(ESCAPE); i++; }
                case 'n' -> { out.append('\n'); i++; }
                case 'r' -> { out.append('\r'); i++; }
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
