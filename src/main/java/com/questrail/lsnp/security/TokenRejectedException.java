package com.questrail.lsnp.security;

import com.questrail.lsnp.api.LsnpException;

/**
 * Inbound message carried a missing, malformed, expired, revoked, foreign or
 * wrongly scoped token. The message is dropped.
 */
public final class TokenRejectedException extends LsnpException
{
    public TokenRejectedException(String message) {
        super(message);
    }
}
