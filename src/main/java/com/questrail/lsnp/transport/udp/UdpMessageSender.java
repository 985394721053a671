package com.questrail.lsnp.transport.udp;

import com.questrail.lsnp.codec.LsnpMessageEncoder;
import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.observability.LsnpMessageEvent;
import com.questrail.lsnp.observability.LsnpObservabilitySink;
import com.questrail.lsnp.security.TokenIssuer;
import com.questrail.lsnp.transport.MessageSender;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * UdpMessageSender
 * =============================================================================
 * Outbound half of the UDP wiring.
 *
 * <pre>
 *   LsnpMessage
 *        → TokenIssuer.stamp
 *            → LsnpMessageEncoder
 *                → UdpTransport.sendUnicast / sendBroadcast
 * </pre>
 *
 * <p>No retries and no acknowledgements: every call is one datagram.</p>
 */
public final class UdpMessageSender implements MessageSender
{
    private final UdpTransport transport;
    private final LsnpMessageEncoder encoder;
    private final TokenIssuer tokenIssuer;
    private final LsnpObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public UdpMessageSender(UdpTransport transport,
                            LsnpMessageEncoder encoder,
                            TokenIssuer tokenIssuer,
                            LsnpObservabilitySink observabilitySink,
                            WallClock wallClock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.tokenIssuer = Objects.requireNonNull(tokenIssuer, "tokenIssuer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void sendTo(InetSocketAddress remote, LsnpMessage message)
    {
        Objects.requireNonNull(remote, "remote");
        byte[] payload = encode(message);
        transport.sendUnicast(payload, remote);
        observabilitySink.onMessageEvent(new LsnpMessageEvent(
                wallClock.now(), LsnpMessageEvent.Direction.OUTBOUND, message.typeName(), remote, ""));
    }

    @Override
    public void broadcast(LsnpMessage message)
    {
        byte[] payload = encode(message);
        transport.sendBroadcast(payload);
        observabilitySink.onMessageEvent(new LsnpMessageEvent(
                wallClock.now(), LsnpMessageEvent.Direction.OUTBOUND, message.typeName(), null, ""));
    }

    private byte[] encode(LsnpMessage message)
    {
        Objects.requireNonNull(message, "message");
        return encoder.encode(tokenIssuer.stamp(message));
    }
}
