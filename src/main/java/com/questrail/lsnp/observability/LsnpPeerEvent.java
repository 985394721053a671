package com.questrail.lsnp.observability;

import com.questrail.lsnp.model.UserId;

import java.time.Instant;

/**
 * Peer table membership change.
 */
public record LsnpPeerEvent(
    Instant timestamp,
    Kind kind,
    UserId userId
) {
    public enum Kind { JOINED, LEFT }
}
