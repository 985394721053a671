package com.questrail.lsnp.model;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Immutable snapshot of one live peer as known to the local registry.
 *
 * @param userId        globally unique identifier ({@code username@ip})
 * @param address       unicast address the peer listens on
 * @param lastSeenNanos monotonic time of the last announcement or profile
 * @param profile       latest published profile
 */
public record Peer(UserId userId,
                   InetSocketAddress address,
                   long lastSeenNanos,
                   PeerProfile profile)
{
    public Peer {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(profile, "profile");
    }

    public Peer withAddress(InetSocketAddress address, long seenNanos) {
        return new Peer(userId, address, seenNanos, profile);
    }

    public Peer withProfile(PeerProfile profile, long seenNanos) {
        return new Peer(userId, address, seenNanos, profile);
    }

    public String ip() {
        return address.getHostString();
    }

    public int port() {
        return address.getPort();
    }
}
