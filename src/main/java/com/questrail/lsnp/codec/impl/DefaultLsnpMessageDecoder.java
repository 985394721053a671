package com.questrail.lsnp.codec.impl;

import com.questrail.lsnp.api.InvalidMessageFormatException;
import com.questrail.lsnp.codec.LsnpMessageDecoder;
import com.questrail.lsnp.model.LsnpMessage;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultLsnpMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link LsnpMessageDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Strict UTF-8 decoding (malformed input is rejected, not replaced)</li>
 *   <li>Terminator check: the body must be followed by an empty line</li>
 *   <li>Line parsing: the first colon splits key from value</li>
 *   <li>Value unescaping</li>
 *   <li>{@code TYPE} presence check</li>
 * </ol>
 *
 * <p>CRLF line endings are accepted. When a key repeats, the last value wins.</p>
 */
public final class DefaultLsnpMessageDecoder implements LsnpMessageDecoder
{
    @Override
    public LsnpMessage decode(byte[] datagram)
    {
        Objects.requireNonNull(datagram, "datagram");

        final String text = decodeUtf8(datagram).replace("\r\n", "\n");
        final String body = body(text);

        Map<String, String> fields = new LinkedHashMap<>();
        for (String line : body.split("\n", -1)) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new InvalidMessageFormatException("Line is not KEY:VALUE: '" + abbreviate(line) + "'");
            }
            fields.put(line.substring(0, colon), LineEscaping.unescape(line.substring(colon + 1)));
        }

        return LsnpMessage.of(fields);
    }

    /**
     * Returns the message text before the terminating empty line. Only
     * whitespace may follow the terminator.
     */
    private static String body(String text)
    {
        int end = text.indexOf("\n\n");
        if (end < 0) {
            throw new InvalidMessageFormatException("Message is not terminated by an empty line");
        }
        if (end == 0) {
            throw new InvalidMessageFormatException("Message has no fields");
        }
        if (!text.substring(end + 2).isBlank()) {
            throw new InvalidMessageFormatException("Unexpected data after message terminator");
        }
        return text.substring(0, end);
    }

    private static String decodeUtf8(byte[] datagram)
    {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(datagram))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidMessageFormatException("Datagram is not valid UTF-8", e);
        }
    }

    private static String abbreviate(String line)
    {
        return line.length() <= 40 ? line : line.substring(0, 40) + "...";
    }
}
