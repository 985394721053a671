package com.questrail.lsnp.observability;

/**
 * Receives structured observability events from the LSNP node.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from the receive loop, the scheduler thread and caller
 * threads; implementations must be thread-safe.</p>
 */
public interface LsnpObservabilitySink {

    void onMessageEvent(LsnpMessageEvent event);

    void onPeerEvent(LsnpPeerEvent event);

    void onTransportEvent(LsnpTransportEvent event);

    void onError(LsnpErrorEvent event);
}
