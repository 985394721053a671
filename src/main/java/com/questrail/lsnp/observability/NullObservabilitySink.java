package com.questrail.lsnp.observability;

/**
 * No-op implementation of LsnpObservabilitySink.
 */
public final class NullObservabilitySink implements LsnpObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMessageEvent(LsnpMessageEvent event) {}

    @Override
    public void onPeerEvent(LsnpPeerEvent event) {}

    @Override
    public void onTransportEvent(LsnpTransportEvent event) {}

    @Override
    public void onError(LsnpErrorEvent event) {}
}
