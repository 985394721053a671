package com.questrail.lsnp.registry;

import com.questrail.lsnp.api.InvalidMessageFormatException;
import com.questrail.lsnp.api.RecipientUnknownException;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.MessageFactory;
import com.questrail.lsnp.model.MessageType;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.transport.MessageSender;

import io.netty.util.NetUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.function.IntSupplier;
import java.util.stream.Collectors;

/**
 * DiscoveryService
 * =============================================================================
 * Presence protocol on top of {@link PeerRegistry}.
 *
 * <h2>Announcements</h2>
 * {@link #announce()} broadcasts {@code PEER_DISCOVERY} with the unicast port
 * in {@code PORT}. The runtime calls it once at start and then at every
 * announce interval.
 *
 * <h2>Replies to new peers</h2>
 * When an announcement reveals a peer the registry did not know, a unicast
 * {@code PEER_DISCOVERY} goes straight back to it so that it learns about us
 * without waiting for our next broadcast. Announcements from known peers get
 * no reply, which keeps two nodes from answering each other forever.
 *
 * <h2>Peer lists</h2>
 * {@code PEER_LIST_REQUEST} is answered with {@code PEER_LIST_RESPONSE}
 * carrying {@code PEERS} as comma-separated {@code user_id=ip:port} entries.
 * Entries in a response only add peers we did not know; they never refresh a
 * known peer, whose liveness rests on its own announcements. Hosts must be IP
 * literals, so a peer list never triggers a name lookup.
 */
public final class DiscoveryService
{
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final PeerRegistry registry;
    private final MessageSender sender;
    private final MessageFactory messages;
    private final IntSupplier unicastPort;

    /**
     * @param unicastPort supplies the port advertised in {@code PORT}; read at
     *                    every announcement because the ephemeral bind completes
     *                    asynchronously
     */
    public DiscoveryService(PeerRegistry registry,
                            MessageSender sender,
                            MessageFactory messages,
                            IntSupplier unicastPort)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.unicastPort = Objects.requireNonNull(unicastPort, "unicastPort");
    }

    public void announce()
    {
        sender.broadcast(discoveryMessage());
    }

    public void onDiscovery(LsnpMessage message, InetSocketAddress source)
    {
        UserId from = message.sender();
        if (from.equals(messages.self())) {
            return;
        }

        int port = message.has(LsnpFields.PORT) ? message.requireInt(LsnpFields.PORT) : source.getPort();
        if (port <= 0 || port > 65535) {
            throw new InvalidMessageFormatException("PORT out of range: " + port);
        }

        InetSocketAddress address = new InetSocketAddress(source.getAddress(), port);
        if (registry.upsert(from, address) == PeerRegistry.Upsert.NEW) {
            sender.sendTo(address, discoveryMessage());
        }
    }

    /**
     * Asks a known peer for its peer table.
     *
     * @throws RecipientUnknownException if {@code target} is not in the registry
     */
    public void requestPeerList(UserId target)
    {
        Peer peer = registry.lookup(target).orElseThrow(() -> new RecipientUnknownException(target));
        sender.sendTo(peer.address(), messages.begin(MessageType.PEER_LIST_REQUEST).build());
    }

    public void onPeerListRequest(LsnpMessage message, InetSocketAddress source)
    {
        UserId from = message.sender();
        InetSocketAddress replyTo = registry.lookup(from).map(Peer::address).orElse(source);

        List<String> entries = registry.snapshot().stream()
                .filter(p -> !p.userId().equals(from))
                .map(p -> p.userId().value() + "=" + p.ip() + ":" + p.port())
                .collect(Collectors.toList());

        sender.sendTo(replyTo, messages.begin(MessageType.PEER_LIST_RESPONSE)
                .put(LsnpFields.PEERS, String.join(",", entries))
                .put(LsnpFields.COUNT, entries.size())
                .build());
    }

    /**
     * Adds every well-formed entry naming an unknown peer. Malformed entries
     * are skipped individually.
     *
     * @return number of entries that named a peer we did not know
     */
    public int onPeerListResponse(LsnpMessage message)
    {
        String raw = message.get(LsnpFields.PEERS).orElse("");
        int discovered = 0;
        for (String entry : raw.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            try {
                PeerListEntry e = PeerListEntry.parse(entry.trim());
                if (registry.addIfAbsent(e.userId(), e.address())) {
                    discovered++;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed peer list entry '{}': {}", entry, e.getMessage());
            }
        }
        return discovered;
    }

    private LsnpMessage discoveryMessage()
    {
        return messages.begin(MessageType.PEER_DISCOVERY)
                .put(LsnpFields.PORT, unicastPort.getAsInt())
                .build();
    }

    /**
     * One {@code user_id=ip:port} element of {@code PEERS}.
     */
    record PeerListEntry(UserId userId, InetSocketAddress address)
    {
        static PeerListEntry parse(String entry)
        {
            int eq = entry.indexOf('=');
            int colon = entry.lastIndexOf(':');
            if (eq <= 0 || colon <= eq + 1 || colon == entry.length() - 1) {
                throw new IllegalArgumentException("expected user_id=ip:port");
            }
            UserId user = UserId.parse(entry.substring(0, eq));
            String ip = entry.substring(eq + 1, colon);
            if (ip.startsWith("[") && ip.endsWith("]")) {
                ip = ip.substring(1, ip.length() - 1);
            }
            int port = Integer.parseInt(entry.substring(colon + 1));
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port out of range");
            }
            InetAddress address = NetUtil.createInetAddressFromIpAddressString(ip);
            if (address == null) {
                throw new IllegalArgumentException("host is not an IP literal: '" + ip + "'");
            }
            return new PeerListEntry(user, new InetSocketAddress(address, port));
        }
    }
}
