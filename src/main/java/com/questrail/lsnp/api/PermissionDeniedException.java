package com.questrail.lsnp.api;

/**
 * Raised when a caller attempts a group operation it is not entitled to,
 * such as a non-creator changing membership.
 */
public final class PermissionDeniedException extends LsnpException
{
    public PermissionDeniedException(String message) {
        super(message);
    }
}
