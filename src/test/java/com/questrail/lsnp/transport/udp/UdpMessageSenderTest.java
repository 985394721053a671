package com.questrail.lsnp.transport.udp;

import com.questrail.lsnp.api.PayloadTooLargeException;
import com.questrail.lsnp.codec.PayloadLimits;
import com.questrail.lsnp.codec.impl.DefaultLsnpMessageDecoder;
import com.questrail.lsnp.codec.impl.DefaultLsnpMessageEncoder;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.MessageFactory;
import com.questrail.lsnp.model.MessageType;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.observability.LsnpMessageEvent;
import com.questrail.lsnp.observability.RecordingObservabilitySink;
import com.questrail.lsnp.security.ExpiringTokenIssuer;
import com.questrail.lsnp.security.TokenIssuer;
import com.questrail.lsnp.time.ManualWallClock;
import com.questrail.lsnp.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class UdpMessageSenderTest
{
    private static final UserId ALICE = UserId.of("alice", "10.0.0.1");
    private static final UserId BOB = UserId.of("bob", "10.0.0.2");
    private static final InetSocketAddress BOB_ADDR = new InetSocketAddress("10.0.0.2", 40002);
    private static final InetSocketAddress BROADCAST = new InetSocketAddress("255.255.255.255", 50999);

    private final ManualWallClock clock = new ManualWallClock();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final MessageFactory messages = new MessageFactory(ALICE, clock);
    private final DefaultLsnpMessageDecoder decoder = new DefaultLsnpMessageDecoder();

    private FakeDatagramEndpoint discovery;
    private FakeDatagramEndpoint unicast;
    private UdpTransport transport;

    @BeforeEach
    void setUp() {
        discovery = new FakeDatagramEndpoint(new InetSocketAddress("10.0.0.1", 50999));
        unicast = new FakeDatagramEndpoint(new InetSocketAddress("10.0.0.1", 40001));
        transport = new UdpTransport(discovery, unicast, BROADCAST, 16, sink, clock);
        transport.start();
    }

    private UdpMessageSender sender(TokenIssuer issuer, PayloadLimits limits) {
        return new UdpMessageSender(transport, new DefaultLsnpMessageEncoder(limits), issuer, sink, clock);
    }

    @Test
    void sendToEncodesAndReportsOutbound() {
        LsnpMessage dm = messages.beginTo(MessageType.DM, BOB).put(LsnpFields.CONTENT, "hi").build();

        sender(TokenIssuer.NONE, PayloadLimits.defaults()).sendTo(BOB_ADDR, dm);

        assertEquals(1, unicast.sent().size());
        assertEquals(dm, decoder.decode(unicast.sent().get(0).payload()));

        LsnpMessageEvent event = sink.eventsOfType(LsnpMessageEvent.class).get(0);
        assertEquals(LsnpMessageEvent.Direction.OUTBOUND, event.direction());
        assertEquals("DM", event.type());
        assertEquals(BOB_ADDR, event.remote());
    }

    @Test
    void broadcastGoesOutOfTheDiscoveryEndpoint() {
        sender(TokenIssuer.NONE, PayloadLimits.defaults())
                .broadcast(messages.begin(MessageType.PEER_DISCOVERY).put(LsnpFields.PORT, 40001).build());

        assertEquals(0, unicast.sent().size());
        assertEquals(BROADCAST, discovery.sent().get(0).remote());
    }

    @Test
    void enabledIssuerAddsTokenOnTheWire() {
        ExpiringTokenIssuer issuer = new ExpiringTokenIssuer(ALICE, Duration.ofMinutes(5), clock);

        sender(issuer, PayloadLimits.defaults())
                .sendTo(BOB_ADDR, messages.beginTo(MessageType.DM, BOB).put(LsnpFields.CONTENT, "hi").build());

        LsnpMessage onWire = decoder.decode(unicast.sent().get(0).payload());
        assertTrue(onWire.require(LsnpFields.TOKEN).endsWith("|chat"));
    }

    @Test
    void oversizedMessageIsNeverSent() {
        UdpMessageSender small = sender(TokenIssuer.NONE, new PayloadLimits(64, 256, 64));
        LsnpMessage big = messages.begin(MessageType.POST).put(LsnpFields.CONTENT, "x".repeat(1000)).build();

        assertThrows(PayloadTooLargeException.class, () -> small.sendTo(BOB_ADDR, big));
        assertTrue(unicast.sent().isEmpty());
        assertTrue(sink.eventsOfType(LsnpMessageEvent.class).isEmpty());
    }
}
