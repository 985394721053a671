package com.questrail.lsnp.security;

import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.UserId;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Issues {@code user|expiry|scope} tokens valid for a fixed lifetime.
 * Message types without a scope are passed through unchanged.
 */
public final class ExpiringTokenIssuer implements TokenIssuer
{
    private final UserId self;
    private final Duration ttl;
    private final WallClock wallClock;

    public ExpiringTokenIssuer(UserId self, Duration ttl, WallClock wallClock) {
        this.self = Objects.requireNonNull(self, "self");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public Token issue(TokenScope scope) {
        Objects.requireNonNull(scope, "scope");
        return new Token(self, wallClock.epochSeconds() + ttl.toSeconds(), scope.wireName());
    }

    @Override
    public LsnpMessage stamp(LsnpMessage message) {
        Objects.requireNonNull(message, "message");
        Optional<TokenScope> scope = message.type().flatMap(TokenScope::requiredFor);
        if (scope.isEmpty()) {
            return message;
        }
        return message.toBuilder()
                .put(LsnpFields.TOKEN, issue(scope.get()).wireValue())
                .build();
    }
}
