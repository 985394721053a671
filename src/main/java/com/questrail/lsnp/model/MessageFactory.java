package com.questrail.lsnp.model;

import com.questrail.lsnp.internal.time.WallClock;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Starts outbound messages with the envelope every LSNP message carries:
 * {@code TYPE}, the sender field, {@code MESSAGE_ID} and {@code TIMESTAMP}.
 *
 * <p>Message ids are 64 random bits rendered as 16 lowercase hex digits.
 * Uniqueness is probabilistic and not checked.</p>
 */
public final class MessageFactory
{
    private static final SecureRandom RANDOM = new SecureRandom();

    private final UserId self;
    private final WallClock wallClock;

    public MessageFactory(UserId self, WallClock wallClock) {
        this.self = Objects.requireNonNull(self, "self");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public UserId self() {
        return self;
    }

    public LsnpMessage.Builder begin(MessageType type) {
        return LsnpMessage.builder(type)
                .put(type.senderField(), self)
                .put(LsnpFields.MESSAGE_ID, newMessageId())
                .put(LsnpFields.TIMESTAMP, wallClock.epochSeconds());
    }

    /**
     * Same as {@link #begin} plus a {@code TO} field.
     */
    public LsnpMessage.Builder beginTo(MessageType type, UserId to) {
        return begin(type).put(LsnpFields.TO, Objects.requireNonNull(to, "to"));
    }

    public static String newMessageId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
