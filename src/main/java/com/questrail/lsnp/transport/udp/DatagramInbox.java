package com.questrail.lsnp.transport.udp;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between the Netty I/O threads and the receive loop.
 * Producers never block; a full inbox refuses the datagram.
 */
final class DatagramInbox
{
    private final BlockingQueue<ReceivedDatagram> queue;

    DatagramInbox(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    boolean offer(ReceivedDatagram datagram)
    {
        return queue.offer(datagram);
    }

    Optional<ReceivedDatagram> poll(Duration timeout) throws InterruptedException
    {
        return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    int size()
    {
        return queue.size();
    }
}
