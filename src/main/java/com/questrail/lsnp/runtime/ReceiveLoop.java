package com.questrail.lsnp.runtime;

import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.observability.LsnpErrorEvent;
import com.questrail.lsnp.observability.LsnpObservabilitySink;
import com.questrail.lsnp.transport.udp.ReceivedDatagram;
import com.questrail.lsnp.transport.udp.UdpTransport;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ReceiveLoop
 * =============================================================================
 * Dedicated thread that takes datagrams off the transport inbox and hands
 * them to the {@link InboundDispatcher}, one at a time.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()   → starts the "lsnp-receive-loop" thread
 *   loop.stop()    → interrupts it and waits up to five seconds
 * </pre>
 *
 * <p>The thread wakes at least once per receive timeout so that {@link #stop()}
 * is observed even when no traffic arrives.</p>
 */
final class ReceiveLoop
{
    private final UdpTransport transport;
    private final InboundDispatcher dispatcher;
    private final Duration receiveTimeout;
    private final LsnpObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    ReceiveLoop(UdpTransport transport,
                InboundDispatcher dispatcher,
                Duration receiveTimeout,
                LsnpObservabilitySink observabilitySink,
                WallClock wallClock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.receiveTimeout = Objects.requireNonNull(receiveTimeout, "receiveTimeout");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    void start()
    {
        if (running.compareAndSet(false, true)) {
            thread = new Thread(this::run, "lsnp-receive-loop");
            thread.setDaemon(true);
            thread.start();
        }
    }

    void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = thread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    boolean isRunning()
    {
        return running.get();
    }

    /**
     * Dispatches everything already queued, on the calling thread. A datagram
     * whose handling fails is reported and skipped.
     *
     * @return number of datagrams taken off the inbox
     */
    int drain()
    {
        int n = 0;
        try {
            Optional<ReceivedDatagram> next;
            while ((next = transport.receive(Duration.ZERO)).isPresent()) {
                dispatchReporting(next.get());
                n++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return n;
    }

    private void run()
    {
        while (running.get()) {
            try {
                transport.receive(receiveTimeout).ifPresent(this::dispatchReporting);
            } catch (InterruptedException e) {
                // Expected during shutdown
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void dispatchReporting(ReceivedDatagram datagram)
    {
        try {
            dispatcher.dispatch(datagram);
        } catch (RuntimeException e) {
            observabilitySink.onError(new LsnpErrorEvent(
                    wallClock.now(), "Receive loop error on datagram from " + datagram.source(), e));
        }
    }
}
