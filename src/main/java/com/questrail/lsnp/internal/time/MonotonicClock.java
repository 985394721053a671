package com.questrail.lsnp.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for peer liveness and announce cadence.
 *
 * <p>Peer {@code last_seen} values and the timeout sweep are computed from this
 * clock only. Wall-clock time is used for message {@code TIMESTAMP} fields and
 * post expiry, never for liveness.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to each other.
     */
    long nowNanos();
}
