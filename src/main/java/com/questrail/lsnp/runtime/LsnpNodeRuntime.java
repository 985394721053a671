package com.questrail.lsnp.runtime;

import com.questrail.lsnp.api.LsnpEventListener;
import com.questrail.lsnp.api.LsnpException;
import com.questrail.lsnp.api.LsnpNode;
import com.questrail.lsnp.codec.LsnpMessageDecoder;
import com.questrail.lsnp.codec.LsnpMessageEncoder;
import com.questrail.lsnp.codec.impl.DefaultLsnpMessageDecoder;
import com.questrail.lsnp.codec.impl.DefaultLsnpMessageEncoder;
import com.questrail.lsnp.config.LsnpNodeConfig;
import com.questrail.lsnp.config.LsnpTimingPolicy;
import com.questrail.lsnp.internal.time.MonotonicClock;
import com.questrail.lsnp.internal.time.MonotonicScheduler;
import com.questrail.lsnp.internal.time.PeriodicTask;
import com.questrail.lsnp.internal.time.ScheduledExecutorScheduler;
import com.questrail.lsnp.internal.time.SystemMonotonicClock;
import com.questrail.lsnp.internal.time.SystemWallClock;
import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.model.DmEntry;
import com.questrail.lsnp.model.Group;
import com.questrail.lsnp.model.MessageFactory;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.PeerProfile;
import com.questrail.lsnp.model.Post;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.observability.LsnpObservabilitySink;
import com.questrail.lsnp.observability.LsnpPeerEvent;
import com.questrail.lsnp.observability.NullObservabilitySink;
import com.questrail.lsnp.registry.DiscoveryService;
import com.questrail.lsnp.registry.PeerRegistry;
import com.questrail.lsnp.registry.PeerRegistryListener;
import com.questrail.lsnp.router.MessageRouter;
import com.questrail.lsnp.router.game.GameSession;
import com.questrail.lsnp.router.game.Symbol;
import com.questrail.lsnp.router.state.RecentMessageIds;
import com.questrail.lsnp.security.ExpiringTokenIssuer;
import com.questrail.lsnp.security.ExpiringTokenVerifier;
import com.questrail.lsnp.security.TokenIssuer;
import com.questrail.lsnp.security.TokenVerifier;
import com.questrail.lsnp.transport.DatagramEndpoint;
import com.questrail.lsnp.transport.udp.UdpMessageSender;
import com.questrail.lsnp.transport.udp.UdpTransport;
import com.questrail.lsnp.transport.udp.netty.NettyUdpDatagramEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LsnpNodeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one LSNP node.
 *
 * <h2>Activities</h2>
 * <ul>
 *   <li>Netty I/O threads: only enqueue datagrams into the transport inbox</li>
 *   <li>Receive loop: decodes and dispatches inbound datagrams, one at a time</li>
 *   <li>Scheduler thread: periodic announcements and peer sweeps</li>
 *   <li>Caller threads: outbound intents through {@link LsnpNode}</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()   → binds both endpoints, starts the receive loop,
 *                       announces at once, then every announce interval
 *   runtime.stop()    → cancels the timers, stops the loop, closes the sockets
 * </pre>
 *
 * <p>All state lives in memory and is gone after {@link #stop()}.</p>
 */
public final class LsnpNodeRuntime implements LsnpNode
{
    private static final Logger log = LoggerFactory.getLogger(LsnpNodeRuntime.class);

    private static final Duration START_TIMEOUT = Duration.ofSeconds(5);

    private final LsnpNodeConfig config;
    private final UdpTransport transport;
    private final PeerRegistry registry;
    private final MessageRouter router;
    private final ReceiveLoop receiveLoop;
    private final boolean receiveLoopEnabled;
    private final PeriodicTask announceTask;
    private final PeriodicTask sweepTask;
    private final ListenerFanOut listeners;
    private final ScheduledExecutorService schedulerExecutor; // null when a scheduler was injected

    private final AtomicBoolean started = new AtomicBoolean(false);

    private LsnpNodeRuntime(Builder b)
    {
        this.config = b.config;
        this.receiveLoopEnabled = b.receiveLoopEnabled;

        LsnpObservabilitySink sink = b.observabilitySink;
        MonotonicClock clock = b.monotonicClock != null ? b.monotonicClock : SystemMonotonicClock.INSTANCE;
        WallClock wallClock = b.wallClock != null ? b.wallClock : SystemWallClock.INSTANCE;
        LsnpTimingPolicy timing = config.timingPolicy();
        UserId self = config.userId();

        // 1. Scheduler
        MonotonicScheduler scheduler = b.scheduler;
        if (scheduler == null) {
            schedulerExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "lsnp-scheduler");
                t.setDaemon(true);
                return t;
            });
            scheduler = new ScheduledExecutorScheduler(schedulerExecutor, clock);
        } else {
            schedulerExecutor = null;
        }

        // 2. Transport
        DatagramEndpoint discoveryEndpoint = b.discoveryEndpoint != null
                ? b.discoveryEndpoint
                : new NettyUdpDatagramEndpoint("discovery", new InetSocketAddress(config.discoveryPort()), true, true);
        DatagramEndpoint unicastEndpoint = b.unicastEndpoint != null
                ? b.unicastEndpoint
                : new NettyUdpDatagramEndpoint("unicast", new InetSocketAddress(config.unicastPort()), false, false);
        this.transport = new UdpTransport(discoveryEndpoint, unicastEndpoint,
                config.broadcastTarget(), config.inboxCapacity(), sink, wallClock);

        // 3. Codec and security
        LsnpMessageDecoder decoder = new DefaultLsnpMessageDecoder();
        LsnpMessageEncoder encoder = new DefaultLsnpMessageEncoder(config.payloadLimits());
        TokenIssuer issuer = config.tokensEnabled()
                ? new ExpiringTokenIssuer(self, timing.tokenTtl(), wallClock)
                : TokenIssuer.NONE;
        TokenVerifier verifier = config.tokensEnabled()
                ? new ExpiringTokenVerifier(wallClock)
                : TokenVerifier.ACCEPT_ALL;
        UdpMessageSender sender = new UdpMessageSender(transport, encoder, issuer, sink, wallClock);

        // 4. Peers and discovery
        this.registry = new PeerRegistry(self, clock, timing.peerTimeout());
        registry.addListener(new PeerRegistryListener() {
            @Override
            public void onPeerJoined(Peer peer) {
                sink.onPeerEvent(new LsnpPeerEvent(wallClock.now(), LsnpPeerEvent.Kind.JOINED, peer.userId()));
            }

            @Override
            public void onPeerLeft(Peer peer) {
                sink.onPeerEvent(new LsnpPeerEvent(wallClock.now(), LsnpPeerEvent.Kind.LEFT, peer.userId()));
            }
        });
        MessageFactory messages = new MessageFactory(self, wallClock);
        DiscoveryService discovery = new DiscoveryService(registry, sender, messages, transport::unicastPort);

        // 5. Router and event delivery
        this.listeners = new ListenerFanOut(sink, wallClock);
        b.listeners.forEach(listeners::add);
        this.router = new MessageRouter(messages, registry, discovery, sender, wallClock,
                config.payloadLimits(), timing.postTtl(), listeners, verifier::revoke);

        // 6. Inbound boundary
        RecentMessageIds recentIds = config.duplicateFilterEnabled()
                ? new RecentMessageIds(config.duplicateFilterCapacity())
                : null;
        InboundDispatcher dispatcher = new InboundDispatcher(decoder, router, verifier, recentIds, sink, wallClock);
        this.receiveLoop = new ReceiveLoop(transport, dispatcher, timing.receiveTimeout(), sink, wallClock);

        // 7. Timers
        this.announceTask = new PeriodicTask("announce", scheduler, clock, timing.announceInterval(), discovery::announce);
        this.sweepTask = new PeriodicTask("peer-sweep", scheduler, clock, timing.announceInterval(), registry::sweep);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Binds the sockets and starts the node's activities.
     *
     * @throws LsnpException if an endpoint fails to bind within five seconds
     */
    public void start()
    {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        transport.start();
        final boolean ready;
        try {
            ready = transport.awaitReady(START_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transport.stop();
            throw new LsnpException("Interrupted while binding UDP endpoints", e);
        }
        if (!ready) {
            transport.stop();
            throw new LsnpException("UDP endpoints failed to bind", transport.startFailure().orElse(null));
        }

        if (receiveLoopEnabled) {
            receiveLoop.start();
        }
        announceTask.start(true);
        sweepTask.start(false);
        log.info("LSNP node {} started (unicast port {})", self(), transport.unicastPort());
    }

    public void stop()
    {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        announceTask.stop();
        sweepTask.stop();
        receiveLoop.stop();
        transport.stop();

        if (schedulerExecutor != null) {
            schedulerExecutor.shutdown();
            try {
                if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    schedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                schedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("LSNP node {} stopped", self());
    }

    /**
     * Dispatches every datagram already waiting in the inbox on the calling
     * thread. Used when the runtime was built without a receive loop.
     *
     * @return number of datagrams dispatched
     */
    public int drainInbox()
    {
        return receiveLoop.drain();
    }

    public void addListener(LsnpEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(LsnpEventListener listener) {
        listeners.remove(listener);
    }

    public LsnpNodeConfig config() {
        return config;
    }

    public int unicastPort() {
        return transport.unicastPort();
    }

    public PeerProfile selfProfile() {
        return router.selfProfile();
    }

    public List<Post> feedOf(UserId author) {
        return router.feedOf(author);
    }

    // -------------------------------------------------------------------------
    // LsnpNode
    // -------------------------------------------------------------------------

    @Override
    public Post post(String content) {
        return router.post(content);
    }

    @Override
    public void sendDirectMessage(UserId to, String content) {
        router.sendDirectMessage(to, content);
    }

    @Override
    public PeerProfile updateProfile(String displayName, String status, byte[] avatarBytes, String avatarMime) {
        return router.updateProfile(displayName, status, avatarBytes, avatarMime);
    }

    @Override
    public void follow(UserId target) {
        router.follow(target);
    }

    @Override
    public void unfollow(UserId target) {
        router.unfollow(target);
    }

    @Override
    public Group createGroup(String groupId, String name, Set<UserId> members) {
        return router.groups().createGroup(groupId, name, members);
    }

    @Override
    public Group updateGroup(String groupId, Set<UserId> add, Set<UserId> remove) {
        return router.groups().updateGroup(groupId, add, remove);
    }

    @Override
    public Group sendGroupMessage(String groupId, String content) {
        return router.groups().sendGroupMessage(groupId, content);
    }

    @Override
    public void like(UserId author, String postId) {
        router.like(author, postId);
    }

    @Override
    public void unlike(UserId author, String postId) {
        router.unlike(author, postId);
    }

    @Override
    public GameSession inviteToGame(UserId opponent, Symbol mySymbol, OptionalInt firstPosition) {
        return router.games().inviteToGame(opponent, mySymbol, firstPosition);
    }

    @Override
    public GameSession makeMove(String gameId, int position) {
        return router.games().makeMove(gameId, position);
    }

    @Override
    public void requestPeerList(UserId target) {
        router.requestPeerList(target);
    }

    @Override
    public void revokeToken(String token) {
        router.revokeToken(token);
    }

    @Override
    public UserId self() {
        return router.self();
    }

    @Override
    public List<Peer> peers() {
        return registry.snapshot();
    }

    @Override
    public List<DmEntry> directMessages(UserId counterpart) {
        return router.directMessages(counterpart);
    }

    @Override
    public List<Group> groups() {
        return router.groups().groups();
    }

    @Override
    public Set<UserId> likesOf(String postId) {
        return router.likesOf(postId);
    }

    @Override
    public Set<UserId> following() {
        return router.following();
    }

    @Override
    public Set<UserId> followers() {
        return router.followers();
    }

    @Override
    public List<Post> feed() {
        return router.feed();
    }

    @Override
    public Optional<GameSession> game(String gameId) {
        return router.games().game(gameId);
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private LsnpNodeConfig config;
        private LsnpObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private final List<LsnpEventListener> listeners = new ArrayList<>();
        private DatagramEndpoint discoveryEndpoint;
        private DatagramEndpoint unicastEndpoint;
        private MonotonicClock monotonicClock;
        private WallClock wallClock;
        private MonotonicScheduler scheduler;
        private boolean receiveLoopEnabled = true;

        public Builder withConfig(LsnpNodeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(LsnpObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withListener(LsnpEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Replaces the Netty sockets, typically with in-memory endpoints.
         */
        public Builder withEndpoints(DatagramEndpoint discovery, DatagramEndpoint unicast) {
            this.discoveryEndpoint = Objects.requireNonNull(discovery, "discovery");
            this.unicastEndpoint = Objects.requireNonNull(unicast, "unicast");
            return this;
        }

        public Builder withClocks(MonotonicClock monotonicClock, WallClock wallClock) {
            this.monotonicClock = monotonicClock;
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Replaces the internal single-thread scheduler. The runtime does not
         * shut an injected scheduler down.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * With the loop disabled, inbound datagrams wait in the inbox until
         * {@link LsnpNodeRuntime#drainInbox()} is called.
         */
        public Builder withReceiveLoopEnabled(boolean enabled) {
            this.receiveLoopEnabled = enabled;
            return this;
        }

        public LsnpNodeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            return new LsnpNodeRuntime(this);
        }
    }
}
