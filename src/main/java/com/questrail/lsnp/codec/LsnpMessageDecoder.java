package com.questrail.lsnp.codec;

import com.questrail.lsnp.api.InvalidMessageFormatException;
import com.questrail.lsnp.model.LsnpMessage;

/**
 * Byte-level decoder for one LSNP datagram.
 *
 * <p>The input is always exactly one datagram. Accumulating partial data across
 * calls is not permitted.</p>
 */
public interface LsnpMessageDecoder
{
    /**
     * @param datagram raw bytes received from the transport
     * @return the decoded message, including fields this node does not know
     * @throws InvalidMessageFormatException if the datagram is not a
     *         well-formed, terminated LSNP message with a {@code TYPE} field
     */
    LsnpMessage decode(byte[] datagram);
}
