package com.questrail.lsnp.config;

import java.time.Duration;
import java.util.Objects;

/**
 * LsnpTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for a node.
 *
 * <ul>
 *   <li><b>announceInterval</b>: cadence of {@code PEER_DISCOVERY} broadcasts
 *       and of the peer timeout sweep.</li>
 *   <li><b>peerTimeout</b>: a peer not heard from for longer than this is
 *       removed by the next sweep.</li>
 *   <li><b>receiveTimeout</b>: how long the receive loop blocks on the inbox
 *       before checking whether it should stop.</li>
 *   <li><b>postTtl</b>: {@code TTL} stamped on outbound posts.</li>
 *   <li><b>tokenTtl</b>: lifetime of issued tokens.</li>
 * </ul>
 */
public record LsnpTimingPolicy(
        Duration announceInterval,
        Duration peerTimeout,
        Duration receiveTimeout,
        Duration postTtl,
        Duration tokenTtl
) {
    public LsnpTimingPolicy {
        Objects.requireNonNull(announceInterval, "announceInterval");
        Objects.requireNonNull(peerTimeout, "peerTimeout");
        Objects.requireNonNull(receiveTimeout, "receiveTimeout");
        Objects.requireNonNull(postTtl, "postTtl");
        Objects.requireNonNull(tokenTtl, "tokenTtl");

        requirePositive(announceInterval, "announceInterval");
        requirePositive(peerTimeout, "peerTimeout");
        requirePositive(receiveTimeout, "receiveTimeout");
        requirePositive(postTtl, "postTtl");
        requirePositive(tokenTtl, "tokenTtl");
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Defaults: announce every 30 s, drop peers after 300 s of silence, 500 ms
     * receive timeout, one hour for post and token lifetimes.
     */
    public static LsnpTimingPolicy defaults() {
        return new LsnpTimingPolicy(
                Duration.ofSeconds(30),
                Duration.ofSeconds(300),
                Duration.ofMillis(500),
                Duration.ofSeconds(3600),
                Duration.ofSeconds(3600)
        );
    }

    public LsnpTimingPolicy withAnnounceInterval(Duration interval) {
        return new LsnpTimingPolicy(interval, peerTimeout, receiveTimeout, postTtl, tokenTtl);
    }

    public LsnpTimingPolicy withPeerTimeout(Duration timeout) {
        return new LsnpTimingPolicy(announceInterval, timeout, receiveTimeout, postTtl, tokenTtl);
    }

    public LsnpTimingPolicy withReceiveTimeout(Duration timeout) {
        return new LsnpTimingPolicy(announceInterval, peerTimeout, timeout, postTtl, tokenTtl);
    }
}
