package com.questrail.lsnp.api;

/**
 * Raised before transmission when an encoded message (or an avatar) exceeds
 * the hard size limit. Nothing is sent.
 */
public final class PayloadTooLargeException extends LsnpException
{
    private final int size;
    private final int limit;

    public PayloadTooLargeException(String what, int size, int limit) {
        super(what + " is " + size + " bytes, limit is " + limit);
        this.size = size;
        this.limit = limit;
    }

    public int size() {
        return size;
    }

    public int limit() {
        return limit;
    }
}
