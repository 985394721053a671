package com.questrail.lsnp.api;

/**
 * Indicates that inbound bytes could not be turned into a valid LSNP message,
 * or that a decoded message lacks a field its type requires.
 *
 * <p>On the receive path this is classified as a wire defect: the message is
 * logged and dropped and the receive loop continues.</p>
 */
public final class InvalidMessageFormatException extends LsnpException
{
    public InvalidMessageFormatException(String message) {
        super(message);
    }

    public InvalidMessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
