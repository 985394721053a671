package com.questrail.lsnp.runtime;

import com.questrail.lsnp.api.LsnpEvent;
import com.questrail.lsnp.api.RecipientUnknownException;
import com.questrail.lsnp.config.LsnpNodeConfig;
import com.questrail.lsnp.config.LsnpTimingPolicy;
import com.questrail.lsnp.model.DmEntry;
import com.questrail.lsnp.model.Group;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.Post;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.observability.LsnpErrorEvent;
import com.questrail.lsnp.observability.LsnpPeerEvent;
import com.questrail.lsnp.observability.RecordingObservabilitySink;
import com.questrail.lsnp.router.game.GameSession;
import com.questrail.lsnp.router.game.GameState;
import com.questrail.lsnp.router.game.Symbol;
import com.questrail.lsnp.time.DeterministicScheduler;
import com.questrail.lsnp.time.ManualMonotonicClock;
import com.questrail.lsnp.time.ManualWallClock;
import com.questrail.lsnp.transport.LoopbackNetwork;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LsnpNodeRuntimeTest
 * -----------------------------------------------------------------------------
 * Two complete nodes on an in-memory LAN. Both share one manual clock and one
 * deterministic scheduler; receive loops are off and inboxes are drained
 * explicitly, so every exchange happens in a fixed order.
 */
class LsnpNodeRuntimeTest
{
    private static final UserId ALICE = UserId.of("alice", "10.0.0.1");
    private static final UserId BOB = UserId.of("bob", "10.0.0.2");

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final ManualWallClock wall = new ManualWallClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final LoopbackNetwork lan = new LoopbackNetwork();
    private final RecordingObservabilitySink aliceSink = new RecordingObservabilitySink();
    private final RecordingObservabilitySink bobSink = new RecordingObservabilitySink();
    private final List<LsnpEvent> bobEvents = new CopyOnWriteArrayList<>();

    private LsnpNodeRuntime alice;
    private LsnpNodeRuntime bob;

    @BeforeEach
    void setUp() throws Exception {
        alice = node("alice", "10.0.0.1", 40001, aliceSink);
        bob = node("bob", "10.0.0.2", 40002, bobSink);
        bob.addListener(bobEvents::add);
    }

    @AfterEach
    void tearDown() {
        alice.stop();
        bob.stop();
    }

    private LsnpNodeRuntime node(String user, String ip, int unicastPort, RecordingObservabilitySink sink)
            throws Exception
    {
        return node(user, ip, unicastPort, sink, false);
    }

    private LsnpNodeRuntime node(String user, String ip, int unicastPort, RecordingObservabilitySink sink,
                                 boolean tokens)
            throws Exception
    {
        LsnpNodeConfig config = LsnpNodeConfig.builder()
                .withUsername(user)
                .withLocalAddress(InetAddress.getByName(ip))
                .withUnicastPort(unicastPort)
                .withTokensEnabled(tokens)
                .build();
        return LsnpNodeRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(sink)
                .withEndpoints(
                        lan.endpoint(new InetSocketAddress(ip, LsnpNodeConfig.DEFAULT_DISCOVERY_PORT)),
                        lan.endpoint(new InetSocketAddress(ip, unicastPort)))
                .withClocks(clock, wall)
                .withScheduler(scheduler)
                .withReceiveLoopEnabled(false)
                .build();
    }

    /** Runs the initial announcements and the replies they trigger. */
    private void discover() {
        alice.start();
        bob.start();
        scheduler.runDueTasks();
        bob.drainInbox();
        alice.drainInbox();
        bob.drainInbox();
    }

    private static Set<UserId> ids(List<Peer> peers) {
        return peers.stream().map(Peer::userId).collect(Collectors.toSet());
    }

    @Test
    void nodesDiscoverEachOther() {
        discover();

        assertEquals(Set.of(BOB), ids(alice.peers()));
        assertEquals(Set.of(ALICE), ids(bob.peers()));
        assertEquals(new InetSocketAddress("10.0.0.1", 40001), bob.peers().get(0).address());
        assertTrue(bobEvents.stream().anyMatch(e -> e instanceof LsnpEvent.PeerJoined));
        assertTrue(aliceSink.hasEventOfType(LsnpPeerEvent.class));
    }

    @Test
    void directMessageLandsOnceInRecipientsThread() {
        discover();

        alice.sendDirectMessage(BOB, "hi");
        assertEquals(1, bob.drainInbox());

        List<DmEntry> thread = bob.directMessages(ALICE);
        assertEquals(1, thread.size());
        assertEquals("hi", thread.get(0).content());
        assertEquals(DmEntry.Direction.RECEIVED, thread.get(0).direction());
        assertEquals(DmEntry.Direction.SENT, alice.directMessages(BOB).get(0).direction());
    }

    @Test
    void messageToStrangerFailsBeforeDiscovery() {
        alice.start();
        assertThrows(RecipientUnknownException.class, () -> alice.sendDirectMessage(BOB, "hello?"));
    }

    @Test
    void postsAndLikesTravelBothWays() {
        discover();
        bob.follow(ALICE);

        Post post = alice.post("hello LAN");
        bob.drainInbox();
        assertEquals(List.of("hello LAN"),
                bob.feed().stream().map(Post::content).collect(Collectors.toList()));

        bob.like(ALICE, post.postId());
        alice.drainInbox();
        assertEquals(Set.of(BOB), alice.likesOf(post.postId()));
    }

    @Test
    void followIsVisibleToTheFollowedUser() {
        discover();

        bob.follow(ALICE);
        alice.drainInbox();

        assertEquals(Set.of(ALICE), bob.following());
        assertEquals(Set.of(BOB), alice.followers());
    }

    @Test
    void groupCreatedByAliceReachesBob() {
        discover();

        alice.createGroup("lunch", "Lunch crew", Set.of(BOB));
        bob.drainInbox();

        Group g = bob.groups().get(0);
        assertEquals("Lunch crew", g.name());
        assertEquals(ALICE, g.creator());

        bob.sendGroupMessage("lunch", "noon?");
        alice.drainInbox();
        assertEquals("noon?", alice.groups().get(0).log().get(0).content());
    }

    @Test
    void memberAddedLaterJoinsGroupAndReceivesMessages() throws Exception {
        UserId carolId = UserId.of("carol", "10.0.0.3");
        LsnpNodeRuntime carol = node("carol", "10.0.0.3", 40003, new RecordingObservabilitySink());
        try {
            discover();
            carol.start();
            scheduler.runDueTasks();
            alice.drainInbox();
            bob.drainInbox();
            carol.drainInbox();
            assertEquals(Set.of(ALICE, BOB), ids(carol.peers()));

            alice.createGroup("lunch", "Lunch crew", Set.of(BOB));
            bob.drainInbox();
            alice.updateGroup("lunch", Set.of(carolId), Set.of());
            bob.drainInbox();
            carol.drainInbox();

            Group joined = carol.groups().get(0);
            assertEquals(ALICE, joined.creator());
            assertEquals("Lunch crew", joined.name());
            assertEquals(Set.of(ALICE, BOB, carolId), joined.members());
            assertEquals(joined.members(), bob.groups().get(0).members());

            alice.sendGroupMessage("lunch", "hello all");
            bob.sendGroupMessage("lunch", "hi carol");
            carol.drainInbox();

            assertEquals(List.of("hello all", "hi carol"), carol.groups().get(0).log().stream()
                    .map(Group.Entry::content).collect(Collectors.toList()));
        } finally {
            carol.stop();
        }
    }

    @Test
    void gameMovesStayInStepOnBothNodes() {
        discover();

        GameSession invited = alice.inviteToGame(BOB, Symbol.X, OptionalInt.of(5));
        bob.drainInbox();

        GameSession mirror = bob.game(invited.gameId()).orElseThrow();
        assertEquals(Symbol.O, mirror.turn());
        assertEquals(1, mirror.turnNumber());

        bob.makeMove(invited.gameId(), 1);
        alice.drainInbox();

        GameSession after = alice.game(invited.gameId()).orElseThrow();
        assertEquals(GameState.IN_PROGRESS, after.state());
        assertEquals(Symbol.X, after.turn());
        assertEquals(2, after.turnNumber());
    }

    @Test
    void silentPeerIsSweptAfterTimeout() {
        discover();
        bob.stop();

        clock.advance(Duration.ofSeconds(330));
        scheduler.runDueTasks();

        assertTrue(alice.peers().isEmpty());
        assertTrue(aliceSink.eventsOfType(LsnpPeerEvent.class).stream()
                .anyMatch(e -> e.kind() == LsnpPeerEvent.Kind.LEFT && e.userId().equals(BOB)));
    }

    @Test
    void periodicAnnouncementsKeepPeersAlive() {
        discover();

        for (int i = 0; i < 12; i++) {
            clock.advance(Duration.ofSeconds(30));
            scheduler.runDueTasks();
            alice.drainInbox();
            bob.drainInbox();
        }

        assertEquals(Set.of(BOB), ids(alice.peers()));
        assertEquals(Set.of(ALICE), ids(bob.peers()));
    }

    @Test
    void failingListenerDoesNotStarveOthers() {
        bob.addListener(e -> {
            throw new IllegalStateException("listener bug");
        });
        List<LsnpEvent> seen = new CopyOnWriteArrayList<>();
        bob.addListener(seen::add);
        discover();

        alice.sendDirectMessage(BOB, "still there?");
        bob.drainInbox();

        assertTrue(seen.stream().anyMatch(e -> e instanceof LsnpEvent.MessageReceived));
        assertTrue(bobSink.hasEventOfType(LsnpErrorEvent.class));
        assertEquals(1, bob.directMessages(ALICE).size());
    }

    @Test
    void revokedTokenIsRefusedByPeers() throws Exception {
        RecordingObservabilitySink erinSink = new RecordingObservabilitySink();
        LsnpNodeRuntime dave = node("dave", "10.0.0.4", 40004, new RecordingObservabilitySink(), true);
        LsnpNodeRuntime erin = node("erin", "10.0.0.5", 40005, erinSink, true);
        UserId daveId = UserId.of("dave", "10.0.0.4");
        UserId erinId = UserId.of("erin", "10.0.0.5");
        try {
            dave.start();
            erin.start();
            scheduler.runDueTasks();
            erin.drainInbox();
            dave.drainInbox();
            erin.drainInbox();

            dave.sendDirectMessage(erinId, "one");
            erin.drainInbox();
            assertEquals(1, erin.directMessages(daveId).size());

            long expiry = wall.epochSeconds() + LsnpTimingPolicy.defaults().tokenTtl().toSeconds();
            dave.revokeToken("dave@10.0.0.4|" + expiry + "|chat");
            erin.drainInbox();

            // Same second, so the same token is stamped again.
            dave.sendDirectMessage(erinId, "two");
            erin.drainInbox();
            assertEquals(1, erin.directMessages(daveId).size());
            assertTrue(erinSink.dropped().stream().anyMatch(e -> e.detail().contains("revoked")));

            wall.advance(Duration.ofSeconds(1));
            dave.sendDirectMessage(erinId, "three");
            erin.drainInbox();
            assertEquals(List.of("one", "three"),
                    erin.directMessages(daveId).stream().map(DmEntry::content).collect(Collectors.toList()));
        } finally {
            dave.stop();
            erin.stop();
        }
    }

    @Test
    void startAndStopAreIdempotent() {
        alice.start();
        alice.start();
        alice.stop();
        alice.stop();

        assertThrows(RecipientUnknownException.class, () -> alice.follow(BOB));
    }
}
