package com.questrail.lsnp.api;

/**
 * Receives {@link LsnpEvent}s from a running node.
 *
 * <p>Called from the receive loop or the scheduler thread. A listener that
 * throws is logged and does not affect other listeners or dispatch.</p>
 */
@FunctionalInterface
public interface LsnpEventListener
{
    void onEvent(LsnpEvent event);
}
