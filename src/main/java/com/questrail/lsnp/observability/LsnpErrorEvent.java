package com.questrail.lsnp.observability;

import java.time.Instant;

/**
 * An error or anomaly in the LSNP stack (dropped datagram, failed handler,
 * socket error).
 *
 * @param cause may be {@code null}
 */
public record LsnpErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
