package com.questrail.lsnp.runtime;

import com.questrail.lsnp.api.LsnpException;
import com.questrail.lsnp.codec.LsnpMessageDecoder;
import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.observability.LsnpErrorEvent;
import com.questrail.lsnp.observability.LsnpMessageEvent;
import com.questrail.lsnp.observability.LsnpObservabilitySink;
import com.questrail.lsnp.router.MessageRouter;
import com.questrail.lsnp.router.state.RecentMessageIds;
import com.questrail.lsnp.security.TokenRejectedException;
import com.questrail.lsnp.security.TokenScope;
import com.questrail.lsnp.security.TokenVerifier;
import com.questrail.lsnp.transport.udp.ReceivedDatagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * InboundDispatcher
 * =============================================================================
 * Boundary between raw datagrams and the router.
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 * <pre>
 *   ReceivedDatagram
 *        → LsnpMessageDecoder         (undecodable: onError + DROPPED)
 *            → RecentMessageIds       (optional; repeat MESSAGE_ID: DROPPED)
 *                → TokenVerifier      (rejected: WARN + DROPPED)
 *                    → MessageRouter.dispatch
 * </pre>
 *
 * <p>Nothing thrown while handling one datagram escapes this class; the
 * receive loop keeps going.</p>
 */
public final class InboundDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(InboundDispatcher.class);

    private final LsnpMessageDecoder decoder;
    private final MessageRouter router;
    private final TokenVerifier tokenVerifier;
    private final RecentMessageIds recentIds;
    private final LsnpObservabilitySink observabilitySink;
    private final WallClock wallClock;

    /**
     * @param recentIds duplicate filter, or {@code null} to dispatch repeats
     */
    public InboundDispatcher(LsnpMessageDecoder decoder,
                             MessageRouter router,
                             TokenVerifier tokenVerifier,
                             RecentMessageIds recentIds,
                             LsnpObservabilitySink observabilitySink,
                             WallClock wallClock)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.router = Objects.requireNonNull(router, "router");
        this.tokenVerifier = Objects.requireNonNull(tokenVerifier, "tokenVerifier");
        this.recentIds = recentIds; // may be null
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public void dispatch(ReceivedDatagram datagram)
    {
        Objects.requireNonNull(datagram, "datagram");

        // 1) Bytes -> message (drop undecodable datagrams)
        final LsnpMessage message;
        try {
            message = decoder.decode(datagram.payload());
        } catch (LsnpException e) {
            observabilitySink.onError(new LsnpErrorEvent(
                    wallClock.now(), "Undecodable datagram from " + datagram.source(), e));
            drop("?", datagram, e.getMessage());
            return;
        }

        // 2) Duplicate suppression
        if (recentIds != null && message.has(LsnpFields.MESSAGE_ID)
                && !recentIds.markSeen(message.messageId())) {
            drop(message.typeName(), datagram, "duplicate MESSAGE_ID " + message.messageId());
            return;
        }

        try {
            // 3) Token check for types that carry a scope
            Optional<TokenScope> scope = message.type().flatMap(TokenScope::requiredFor);
            if (scope.isPresent()) {
                tokenVerifier.verify(message, scope.get());
            }

            observabilitySink.onMessageEvent(new LsnpMessageEvent(
                    wallClock.now(), LsnpMessageEvent.Direction.INBOUND, message.typeName(), datagram.source(), ""));

            // 4) Route
            router.dispatch(message, datagram.source());
        } catch (TokenRejectedException e) {
            log.warn("Rejected {} from {}: {}", message.typeName(), datagram.source(), e.getMessage());
            drop(message.typeName(), datagram, e.getMessage());
        } catch (LsnpException e) {
            observabilitySink.onError(new LsnpErrorEvent(
                    wallClock.now(), "Failed to handle " + message.typeName() + " from " + datagram.source(), e));
            drop(message.typeName(), datagram, e.getMessage());
        }
    }

    private void drop(String type, ReceivedDatagram datagram, String reason)
    {
        observabilitySink.onMessageEvent(LsnpMessageEvent.dropped(wallClock.now(), type, datagram.source(), reason));
    }
}
