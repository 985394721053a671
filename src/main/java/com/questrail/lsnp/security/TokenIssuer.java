package com.questrail.lsnp.security;

import com.questrail.lsnp.model.LsnpMessage;

/**
 * Stamps outbound messages with a {@code TOKEN} field.
 */
@FunctionalInterface
public interface TokenIssuer
{
    /** Leaves messages untouched. */
    TokenIssuer NONE = message -> message;

    LsnpMessage stamp(LsnpMessage message);
}
