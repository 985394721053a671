package com.questrail.lsnp.security;

import com.questrail.lsnp.model.UserId;

import java.util.Objects;

/**
 * Parsed form of a {@code TOKEN} field value.
 */
public record Token(UserId userId, long expiryEpochSeconds, String scope)
{
    public Token {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(scope, "scope");
    }

    /**
     * @throws TokenRejectedException if the value is not {@code user|expiry|scope}
     */
    public static Token parse(String value) {
        Objects.requireNonNull(value, "value");
        String[] parts = value.split("\\|", -1);
        if (parts.length != 3) {
            throw new TokenRejectedException("Malformed token");
        }
        try {
            return new Token(UserId.parse(parts[0]), Long.parseLong(parts[1]), parts[2]);
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too.
            throw new TokenRejectedException("Malformed token: " + e.getMessage());
        }
    }

    public String wireValue() {
        return userId.value() + "|" + expiryEpochSeconds + "|" + scope;
    }
}
