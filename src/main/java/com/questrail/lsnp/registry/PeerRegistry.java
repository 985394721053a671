package com.questrail.lsnp.registry;

import com.questrail.lsnp.internal.time.MonotonicClock;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.PeerProfile;
import com.questrail.lsnp.model.UserId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * PeerRegistry
 * =============================================================================
 * Table of live peers keyed by user id.
 *
 * <h2>Liveness</h2>
 * A first-hand sighting (announcement, profile) refreshes
 * {@code lastSeenNanos} from the {@link MonotonicClock}. Hearsay from a third
 * party's peer list only adds peers we did not know ({@link #addIfAbsent})
 * and never refreshes a known one. {@link #sweep()} removes peers whose last
 * sighting is older than the peer timeout.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>A user id maps to at most one peer.</li>
 *   <li>The local node never appears in its own table.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * All table access is guarded by this instance's monitor. Listener callbacks
 * run after the lock is released.
 */
public final class PeerRegistry
{
    private static final Logger log = LoggerFactory.getLogger(PeerRegistry.class);

    /**
     * Outcome of {@link #upsert}.
     */
    public enum Upsert { NEW, UPDATED, IGNORED_SELF }

    private final UserId self;
    private final MonotonicClock clock;
    private final Duration peerTimeout;

    private final Map<UserId, Peer> peers = new TreeMap<>();
    private final List<PeerRegistryListener> listeners = new CopyOnWriteArrayList<>();

    public PeerRegistry(UserId self, MonotonicClock clock, Duration peerTimeout)
    {
        this.self = Objects.requireNonNull(self, "self");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.peerTimeout = Objects.requireNonNull(peerTimeout, "peerTimeout");
    }

    public void addListener(PeerRegistryListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Records a sighting of {@code userId} at {@code address}. A known peer keeps
     * its profile; its address follows the latest sighting.
     */
    public Upsert upsert(UserId userId, InetSocketAddress address)
    {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(address, "address");

        if (userId.equals(self)) {
            return Upsert.IGNORED_SELF;
        }

        final Peer joined;
        synchronized (this) {
            long now = clock.nowNanos();
            Peer existing = peers.get(userId);
            if (existing != null) {
                peers.put(userId, existing.withAddress(address, now));
                return Upsert.UPDATED;
            }
            joined = new Peer(userId, address, now, PeerProfile.placeholder(userId));
            peers.put(userId, joined);
        }

        announceJoined(joined);
        return Upsert.NEW;
    }

    /**
     * Adds {@code userId} only if it is unknown. A known peer keeps its
     * address and last sighting untouched.
     *
     * @return {@code true} if the peer was added
     */
    public boolean addIfAbsent(UserId userId, InetSocketAddress address)
    {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(address, "address");

        if (userId.equals(self)) {
            return false;
        }

        final Peer joined;
        synchronized (this) {
            if (peers.containsKey(userId)) {
                return false;
            }
            joined = new Peer(userId, address, clock.nowNanos(), PeerProfile.placeholder(userId));
            peers.put(userId, joined);
        }

        announceJoined(joined);
        return true;
    }

    private void announceJoined(Peer joined)
    {
        log.debug("Discovered {} at {}", joined.userId(), joined.address());
        for (PeerRegistryListener l : listeners) {
            notifyJoined(l, joined);
        }
    }

    /**
     * Replaces the profile of a known peer and refreshes its liveness.
     *
     * @return {@code false} if the peer is unknown
     */
    public synchronized boolean updateProfile(UserId userId, PeerProfile profile)
    {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(profile, "profile");

        Peer existing = peers.get(userId);
        if (existing == null) {
            return false;
        }
        peers.put(userId, existing.withProfile(profile, clock.nowNanos()));
        return true;
    }

    public synchronized Optional<Peer> lookup(UserId userId)
    {
        return Optional.ofNullable(peers.get(userId));
    }

    /**
     * @return all live peers ordered by user id
     */
    public synchronized List<Peer> snapshot()
    {
        return Collections.unmodifiableList(new ArrayList<>(peers.values()));
    }

    public synchronized int size()
    {
        return peers.size();
    }

    /**
     * Removes every peer whose last sighting is older than the peer timeout.
     *
     * @return the removed peers
     */
    public List<Peer> sweep()
    {
        List<Peer> removed = new ArrayList<>();
        synchronized (this) {
            long now = clock.nowNanos();
            long timeoutNanos = peerTimeout.toNanos();
            Iterator<Peer> it = peers.values().iterator();
            while (it.hasNext()) {
                Peer p = it.next();
                if (now - p.lastSeenNanos() > timeoutNanos) {
                    it.remove();
                    removed.add(p);
                }
            }
        }

        for (Peer p : removed) {
            log.info("Peer {} timed out", p.userId());
            for (PeerRegistryListener l : listeners) {
                notifyLeft(l, p);
            }
        }
        return removed;
    }

    private static void notifyJoined(PeerRegistryListener l, Peer peer)
    {
        try {
            l.onPeerJoined(peer);
        } catch (RuntimeException e) {
            log.warn("Peer listener failed on join of {}", peer.userId(), e);
        }
    }

    private static void notifyLeft(PeerRegistryListener l, Peer peer)
    {
        try {
            l.onPeerLeft(peer);
        } catch (RuntimeException e) {
            log.warn("Peer listener failed on departure of {}", peer.userId(), e);
        }
    }
}
