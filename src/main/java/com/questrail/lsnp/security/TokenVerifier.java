package com.questrail.lsnp.security;

import com.questrail.lsnp.model.LsnpMessage;

/**
 * Checks the token of an inbound message before it is dispatched.
 */
@FunctionalInterface
public interface TokenVerifier
{
    /** Accepts every message, tokenized or not. */
    TokenVerifier ACCEPT_ALL = (message, scope) -> {};

    /**
     * @param scope the scope the message type requires
     * @throws TokenRejectedException if the message must not be dispatched
     */
    void verify(LsnpMessage message, TokenScope scope);

    /**
     * Refuses {@code token} from now on. Verifiers that keep no revocation
     * list ignore this.
     */
    default void revoke(String token) {
    }
}
