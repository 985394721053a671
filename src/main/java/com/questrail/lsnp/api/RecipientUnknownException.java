package com.questrail.lsnp.api;

import com.questrail.lsnp.model.UserId;

/**
 * Raised when an addressed action names a peer that is not currently in the
 * peer registry. No packet leaves the node when this is thrown.
 */
public final class RecipientUnknownException extends LsnpException
{
    private final UserId recipient;

    public RecipientUnknownException(UserId recipient) {
        super("Recipient not known: " + recipient);
        this.recipient = recipient;
    }

    public UserId recipient() {
        return recipient;
    }
}
