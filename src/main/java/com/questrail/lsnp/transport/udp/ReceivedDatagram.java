package com.questrail.lsnp.transport.udp;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * One inbound datagram as taken from the {@link UdpTransport} inbox.
 *
 * @param source  sender address as reported by the socket
 * @param payload raw datagram bytes
 * @param via     which local endpoint received it
 */
public record ReceivedDatagram(InetSocketAddress source, byte[] payload, Via via)
{
    public enum Via { DISCOVERY, UNICAST }

    public ReceivedDatagram {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(via, "via");
    }
}
