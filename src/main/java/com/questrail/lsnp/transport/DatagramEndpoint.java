package com.questrail.lsnp.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one bound UDP socket.
 *
 * <p>A node owns two of these: the discovery endpoint on the well-known port
 * and the unicast endpoint on an ephemeral port.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams. Binding may complete
     * asynchronously; the listener is told via
     * {@link DatagramEndpointListener#onTransportUp()}.
     */
    void start();

    /**
     * Stop the endpoint and release its resources. The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once.
     */
    void stop();

    /**
     * Send one datagram. Silently does nothing while the endpoint is not up.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * The bound local address once the endpoint is up. For an ephemeral bind
     * this carries the port the operating system chose.
     */
    Optional<InetSocketAddress> localAddress();
}
