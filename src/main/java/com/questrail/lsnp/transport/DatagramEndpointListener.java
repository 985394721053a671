package com.questrail.lsnp.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks for one endpoint are serialized (Netty delivers them on the
 * channel's event loop). Implementations must return quickly; the production
 * listener only enqueues.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause failure cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called once per received datagram with a private copy of its payload.
     *
     * @param remote  sender socket address
     * @param payload the complete datagram
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
