package com.questrail.lsnp.security;

import com.questrail.lsnp.model.MessageType;

import java.util.Optional;

/**
 * Permission scope named in the third segment of a token.
 */
public enum TokenScope
{
    CHAT("chat"),
    BROADCAST("broadcast"),
    FOLLOW("follow"),
    GROUP("group"),
    GAME("game");

    private final String wireName;

    TokenScope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TokenScope> fromWire(String value) {
        for (TokenScope s : values()) {
            if (s.wireName.equals(value)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Scope a message of the given type must carry, or empty for the
     * discovery family and {@code REVOKE}, which are never tokenized.
     */
    public static Optional<TokenScope> requiredFor(MessageType type) {
        return switch (type) {
            case POST, PROFILE, LIKE, UNLIKE -> Optional.of(BROADCAST);
            case DM -> Optional.of(CHAT);
            case FOLLOW, UNFOLLOW -> Optional.of(FOLLOW);
            case GROUP_CREATE, GROUP_UPDATE, GROUP_MESSAGE -> Optional.of(GROUP);
            case TICTACTOE_INVITE, TICTACTOE_MOVE, TICTACTOE_RESULT -> Optional.of(GAME);
            case PEER_DISCOVERY, PEER_LIST_REQUEST, PEER_LIST_RESPONSE, REVOKE -> Optional.empty();
        };
    }
}
