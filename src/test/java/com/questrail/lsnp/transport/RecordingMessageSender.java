package com.questrail.lsnp.transport;

import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.MessageType;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test {@link MessageSender} that only records. A broadcast is recorded with a
 * {@code null} destination.
 */
public final class RecordingMessageSender implements MessageSender {

    public record Outbound(InetSocketAddress remote, LsnpMessage message) {
        public boolean isBroadcast() {
            return remote == null;
        }
    }

    private final List<Outbound> sent = new ArrayList<>();

    @Override
    public synchronized void sendTo(InetSocketAddress remote, LsnpMessage message) {
        sent.add(new Outbound(remote, message));
    }

    @Override
    public synchronized void broadcast(LsnpMessage message) {
        sent.add(new Outbound(null, message));
    }

    public synchronized List<Outbound> sent() {
        return List.copyOf(sent);
    }

    public synchronized List<Outbound> sentOfType(MessageType type) {
        return sent.stream()
                .filter(o -> o.message().type().filter(type::equals).isPresent())
                .collect(Collectors.toList());
    }

    public synchronized void clear() {
        sent.clear();
    }
}
