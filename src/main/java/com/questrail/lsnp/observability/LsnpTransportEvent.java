package com.questrail.lsnp.observability;

import java.time.Instant;

/**
 * Endpoint lifecycle change.
 *
 * @param endpoint {@code "discovery"} or {@code "unicast"}
 * @param cause    failure cause when going down; {@code null} for orderly shutdown
 */
public record LsnpTransportEvent(
    Instant timestamp,
    String endpoint,
    boolean up,
    Throwable cause
) {
}
