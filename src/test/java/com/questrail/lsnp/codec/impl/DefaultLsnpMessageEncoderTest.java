package com.questrail.lsnp.codec.impl;

import com.questrail.lsnp.api.PayloadTooLargeException;
import com.questrail.lsnp.codec.PayloadLimits;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.MessageType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultLsnpMessageEncoderTest
{
    private final DefaultLsnpMessageEncoder encoder = new DefaultLsnpMessageEncoder();
    private final DefaultLsnpMessageDecoder decoder = new DefaultLsnpMessageDecoder();

    @Test
    void encodesOneLinePerFieldAndBlankLineTerminator() {
        LsnpMessage m = LsnpMessage.builder(MessageType.POST)
                .put(LsnpFields.USER_ID, "alice@10.0.0.1")
                .put(LsnpFields.CONTENT, "hello")
                .build();

        String wire = new String(encoder.encode(m), StandardCharsets.UTF_8);
        assertEquals("TYPE:POST\nUSER_ID:alice@10.0.0.1\nCONTENT:hello\n\n", wire);
    }

    @Test
    void valuesWithColonsNewlinesAndBase64SurviveDecode() {
        byte[] avatar = new byte[300];
        for (int i = 0; i < avatar.length; i++) {
            avatar[i] = (byte) i;
        }

        LsnpMessage m = LsnpMessage.builder(MessageType.PROFILE)
                .put(LsnpFields.USER_ID, "alice@10.0.0.1")
                .put(LsnpFields.DISPLAY_NAME, "Alice: the first")
                .put(LsnpFields.STATUS, "line one\nline two\r\nwith \\ backslash")
                .put(LsnpFields.AVATAR_DATA, Base64.getEncoder().encodeToString(avatar))
                .build();

        assertEquals(m, decoder.decode(encoder.encode(m)));
    }

    @Test
    void nonAsciiContentIsEncodedAsUtf8() {
        LsnpMessage m = LsnpMessage.builder(MessageType.POST).put(LsnpFields.CONTENT, "café ☕").build();
        LsnpMessage back = decoder.decode(encoder.encode(m));
        assertEquals("café ☕", back.require(LsnpFields.CONTENT));
    }

    @Test
    void payloadAboveHardLimitIsRefused() {
        DefaultLsnpMessageEncoder small = new DefaultLsnpMessageEncoder(new PayloadLimits(64, 128, 64));
        LsnpMessage m = LsnpMessage.builder(MessageType.POST).put(LsnpFields.CONTENT, "x".repeat(200)).build();

        PayloadTooLargeException e = assertThrows(PayloadTooLargeException.class, () -> small.encode(m));
        assertTrue(e.getMessage().contains("128"));
    }

    @Test
    void payloadBetweenSoftAndHardLimitIsStillEncoded() {
        DefaultLsnpMessageEncoder small = new DefaultLsnpMessageEncoder(new PayloadLimits(64, 1024, 64));
        LsnpMessage m = LsnpMessage.builder(MessageType.POST).put(LsnpFields.CONTENT, "x".repeat(200)).build();

        assertTrue(small.encode(m).length > 64);
    }
}
