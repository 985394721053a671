package com.questrail.lsnp.security;

import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ExpiringTokenVerifier
 * -----------------------------------------------------------------------------
 * Enforces tokens on inbound messages. A token is accepted when:
 * <ol>
 *   <li>the {@code TOKEN} field is present and well formed</li>
 *   <li>it has not been revoked</li>
 *   <li>its expiry lies in the future</li>
 *   <li>its user id equals the message sender</li>
 *   <li>its scope equals the scope required by the message type</li>
 * </ol>
 *
 * <p>The revocation list is bounded; the oldest revocations are forgotten
 * first.</p>
 */
public final class ExpiringTokenVerifier implements TokenVerifier
{
    private static final Logger log = LoggerFactory.getLogger(ExpiringTokenVerifier.class);

    public static final int DEFAULT_MAX_REVOCATIONS = 1000;

    private final WallClock wallClock;
    private final Map<String, Boolean> revoked;

    public ExpiringTokenVerifier(WallClock wallClock) {
        this(wallClock, DEFAULT_MAX_REVOCATIONS);
    }

    public ExpiringTokenVerifier(WallClock wallClock, int maxRevocations) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        if (maxRevocations <= 0) {
            throw new IllegalArgumentException("maxRevocations must be > 0");
        }
        this.revoked = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > maxRevocations;
            }
        };
    }

    @Override
    public void verify(LsnpMessage message, TokenScope scope)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(scope, "scope");

        String raw = message.get(LsnpFields.TOKEN)
                .orElseThrow(() -> new TokenRejectedException("Missing TOKEN"));

        if (isRevoked(raw)) {
            throw new TokenRejectedException("Token has been revoked");
        }

        Token token = Token.parse(raw);

        if (token.expiryEpochSeconds() < wallClock.epochSeconds()) {
            throw new TokenRejectedException("Token expired");
        }
        if (!token.userId().equals(message.sender())) {
            throw new TokenRejectedException("Token belongs to " + token.userId() + ", not " + message.sender());
        }
        if (!token.scope().equals(scope.wireName())) {
            throw new TokenRejectedException("Token scope is '" + token.scope() + "', expected '" + scope.wireName() + "'");
        }
    }

    @Override
    public synchronized void revoke(String token)
    {
        Objects.requireNonNull(token, "token");
        revoked.put(token, Boolean.TRUE);
        log.info("Revoked token for {}", token.split("\\|", 2)[0]);
    }

    public synchronized boolean isRevoked(String token)
    {
        return revoked.containsKey(token);
    }
}
