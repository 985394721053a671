package com.questrail.lsnp.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a direct-message thread.
 *
 * @param direction whether the local node sent or received it
 * @param timestamp sender timestamp
 * @param content   message text
 */
public record DmEntry(Direction direction, Instant timestamp, String content)
{
    public enum Direction { SENT, RECEIVED }

    public DmEntry {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(content, "content");
    }
}
