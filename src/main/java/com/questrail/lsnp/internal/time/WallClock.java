package com.questrail.lsnp.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Calendar time source for {@code TIMESTAMP} fields, token expiry and post TTL.
 *
 * <p>May jump due to NTP or manual adjustment. Not used for peer liveness.</p>
 */
public interface WallClock
{
    Instant now();

    default long epochSeconds() {
        return now().getEpochSecond();
    }
}
