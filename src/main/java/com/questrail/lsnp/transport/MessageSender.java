package com.questrail.lsnp.transport;

import com.questrail.lsnp.model.LsnpMessage;

import java.net.InetSocketAddress;

/**
 * Message-level outbound port used by the registry and the router.
 *
 * <p>Implementations encode and transmit. Encoding failures surface as
 * {@link com.questrail.lsnp.api.PayloadTooLargeException} before anything is
 * written to the socket.</p>
 */
public interface MessageSender
{
    void sendTo(InetSocketAddress remote, LsnpMessage message);

    void broadcast(LsnpMessage message);
}
