package com.questrail.lsnp.api;

/**
 * Base type for every local error signalled by the LSNP core.
 *
 * <p>These exceptions are raised to the initiating caller only. They are never
 * serialized onto the wire and never turned into generic failure messages for
 * remote peers.</p>
 */
public class LsnpException extends RuntimeException
{
    public LsnpException(String message) {
        super(message);
    }

    public LsnpException(String message, Throwable cause) {
        super(message, cause);
    }
}
