package com.questrail.lsnp.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * A message crossing the node boundary, or one refused at it.
 *
 * @param type   wire {@code TYPE} value, or {@code "?"} when the datagram never decoded
 * @param remote source for inbound/dropped, destination for outbound; {@code null}
 *               for broadcasts
 * @param detail free-form reason for {@link Direction#DROPPED}, otherwise empty
 */
public record LsnpMessageEvent(
    Instant timestamp,
    Direction direction,
    String type,
    SocketAddress remote,
    String detail
) {
    public enum Direction { INBOUND, OUTBOUND, DROPPED }

    public static LsnpMessageEvent dropped(Instant timestamp, String type, SocketAddress remote, String detail) {
        return new LsnpMessageEvent(timestamp, Direction.DROPPED, type, remote, detail);
    }
}
