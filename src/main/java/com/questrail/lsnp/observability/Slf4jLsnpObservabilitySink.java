package com.questrail.lsnp.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LsnpObservabilitySink that emits logs via SLF4J.
 *
 * <p>Message traffic is logged at DEBUG (WARN for drops), peer churn and
 * transport changes at INFO.</p>
 */
public final class Slf4jLsnpObservabilitySink implements LsnpObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLsnpObservabilitySink.class);

    @Override
    public void onMessageEvent(LsnpMessageEvent event) {
        switch (event.direction()) {
            case INBOUND -> log.debug("<- {} from {}", event.type(), event.remote());
            case OUTBOUND -> log.debug("-> {} to {}", event.type(),
                    event.remote() == null ? "broadcast" : event.remote());
            case DROPPED -> log.warn("Dropped {} from {}: {}", event.type(), event.remote(), event.detail());
        }
    }

    @Override
    public void onPeerEvent(LsnpPeerEvent event) {
        log.info("Peer {} {}", event.userId(), event.kind() == LsnpPeerEvent.Kind.JOINED ? "joined" : "left");
    }

    @Override
    public void onTransportEvent(LsnpTransportEvent event) {
        if (event.up()) {
            log.info("LSNP {} endpoint up", event.endpoint());
        } else if (event.cause() == null) {
            log.info("LSNP {} endpoint down", event.endpoint());
        } else {
            log.warn("LSNP {} endpoint down: {}", event.endpoint(), event.cause().toString());
        }
    }

    @Override
    public void onError(LsnpErrorEvent event) {
        log.error("LSNP Error: {}", event.message(), event.cause());
    }
}
