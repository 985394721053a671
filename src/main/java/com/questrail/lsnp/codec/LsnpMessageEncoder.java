package com.questrail.lsnp.codec;

import com.questrail.lsnp.api.PayloadTooLargeException;
import com.questrail.lsnp.model.LsnpMessage;

/**
 * Byte-level encoder producing exactly one datagram payload per message.
 */
public interface LsnpMessageEncoder
{
    /**
     * @throws PayloadTooLargeException if the encoded form exceeds the hard limit
     */
    byte[] encode(LsnpMessage message);
}
