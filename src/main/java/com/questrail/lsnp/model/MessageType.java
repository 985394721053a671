package com.questrail.lsnp.model;

import java.util.Optional;

/**
 * Message types understood by this node.
 *
 * <p>The wire carries the type as free text in the {@code TYPE} field. Values
 * not listed here are legal on the wire and are ignored by the router, which
 * is what lets the protocol grow additively.</p>
 */
public enum MessageType
{
    POST(true),
    DM(false),
    PROFILE(true),
    PEER_DISCOVERY(true),
    PEER_LIST_REQUEST(false),
    PEER_LIST_RESPONSE(false),
    FOLLOW(false),
    UNFOLLOW(false),
    GROUP_CREATE(false),
    GROUP_UPDATE(false),
    GROUP_MESSAGE(false),
    LIKE(false),
    UNLIKE(false),
    TICTACTOE_INVITE(false),
    TICTACTOE_MOVE(false),
    TICTACTOE_RESULT(false),
    REVOKE(true);

    private final boolean userIdSender;

    MessageType(boolean userIdSender) {
        this.userIdSender = userIdSender;
    }

    /**
     * Name of the field that identifies the sender for this type. Broadcast-style
     * types use {@code USER_ID}; addressed types use {@code FROM}.
     */
    public String senderField() {
        return userIdSender ? LsnpFields.USER_ID : LsnpFields.FROM;
    }

    /**
     * {@code true} for types that must carry a {@code TO} field.
     */
    public boolean isAddressed() {
        return switch (this) {
            case DM, FOLLOW, UNFOLLOW, LIKE, UNLIKE,
                 TICTACTOE_INVITE, TICTACTOE_MOVE, TICTACTOE_RESULT -> true;
            default -> false;
        };
    }

    public String wireName() {
        return name();
    }

    public static Optional<MessageType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MessageType t : values()) {
            if (t.name().equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
