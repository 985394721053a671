package com.questrail.lsnp.transport.udp;

import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.observability.LsnpMessageEvent;
import com.questrail.lsnp.observability.LsnpObservabilitySink;
import com.questrail.lsnp.observability.LsnpTransportEvent;
import com.questrail.lsnp.transport.DatagramEndpoint;
import com.questrail.lsnp.transport.DatagramEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * UdpTransport
 * =============================================================================
 * Byte-level UDP transport for one node: a discovery endpoint on the
 * well-known port and a unicast endpoint on an ephemeral port, both feeding a
 * single bounded inbox.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   discovery endpoint ─┐
 *                       ├→ DatagramInbox → receive(timeout) → receive loop
 *   unicast endpoint  ──┘
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   sendUnicast(bytes, peer)   → unicast endpoint
 *   sendBroadcast(bytes)       → discovery endpoint → broadcast address : discovery port
 * </pre>
 *
 * <p>This class never looks inside a payload. Decoding happens on the
 * receive loop, after {@link #receive(Duration)}.</p>
 */
public final class UdpTransport
{
    private static final Logger log = LoggerFactory.getLogger(UdpTransport.class);

    private final DatagramEndpoint discovery;
    private final DatagramEndpoint unicast;
    private final InetSocketAddress broadcastTarget;
    private final DatagramInbox inbox;
    private final LsnpObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final CountDownLatch ready = new CountDownLatch(2);
    private volatile Throwable startFailure;

    public UdpTransport(DatagramEndpoint discovery,
                        DatagramEndpoint unicast,
                        InetSocketAddress broadcastTarget,
                        int inboxCapacity,
                        LsnpObservabilitySink observabilitySink,
                        WallClock wallClock)
    {
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.unicast = Objects.requireNonNull(unicast, "unicast");
        this.broadcastTarget = Objects.requireNonNull(broadcastTarget, "broadcastTarget");
        this.inbox = new DatagramInbox(inboxCapacity);
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.discovery.setListener(new EndpointListener("discovery", ReceivedDatagram.Via.DISCOVERY));
        this.unicast.setListener(new EndpointListener("unicast", ReceivedDatagram.Via.UNICAST));
    }

    public void start()
    {
        discovery.start();
        unicast.start();
    }

    /**
     * Waits until both endpoints are bound.
     *
     * @return {@code true} if both came up within the timeout
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException
    {
        boolean up = ready.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        return up && startFailure == null;
    }

    public Optional<Throwable> startFailure()
    {
        return Optional.ofNullable(startFailure);
    }

    public void stop()
    {
        discovery.stop();
        unicast.stop();
    }

    public void sendUnicast(byte[] payload, InetSocketAddress remote)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(remote, "remote");
        unicast.send(remote, payload);
    }

    public void sendBroadcast(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        discovery.send(broadcastTarget, payload);
    }

    /**
     * Takes the next inbound datagram, waiting at most {@code timeout}.
     *
     * @return empty on timeout
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Optional<ReceivedDatagram> receive(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        return inbox.poll(timeout);
    }

    /**
     * Port the unicast endpoint is bound to, advertised as {@code PORT} in
     * discovery announcements. Zero until the endpoint is up.
     */
    public int unicastPort()
    {
        return unicast.localAddress().map(InetSocketAddress::getPort).orElse(0);
    }

    public int pendingDatagrams()
    {
        return inbox.size();
    }

    private final class EndpointListener implements DatagramEndpointListener
    {
        private final String name;
        private final ReceivedDatagram.Via via;
        private volatile boolean up;

        private EndpointListener(String name, ReceivedDatagram.Via via)
        {
            this.name = name;
            this.via = via;
        }

        @Override
        public void onTransportUp()
        {
            up = true;
            ready.countDown();
            observabilitySink.onTransportEvent(new LsnpTransportEvent(wallClock.now(), name, true, null));
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            if (!up && cause != null) {
                // Bind failure: release anyone waiting in awaitReady.
                startFailure = cause;
                ready.countDown();
            }
            up = false;
            observabilitySink.onTransportEvent(new LsnpTransportEvent(wallClock.now(), name, false, cause));
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            if (!(remote instanceof InetSocketAddress source)) {
                log.debug("Ignoring datagram from non-IP address {}", remote);
                return;
            }
            if (!inbox.offer(new ReceivedDatagram(source, payload, via))) {
                log.warn("Inbox full; dropping {} byte datagram from {}", payload.length, source);
                observabilitySink.onMessageEvent(
                        LsnpMessageEvent.dropped(wallClock.now(), "?", source, "inbox full"));
            }
        }
    }
}
