package com.questrail.lsnp.router;

import com.questrail.lsnp.api.LsnpEvent;
import com.questrail.lsnp.api.PayloadTooLargeException;
import com.questrail.lsnp.api.RecipientUnknownException;
import com.questrail.lsnp.codec.PayloadLimits;
import com.questrail.lsnp.model.DmEntry;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.MessageFactory;
import com.questrail.lsnp.model.MessageType;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.Post;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.registry.DiscoveryService;
import com.questrail.lsnp.registry.PeerRegistry;
import com.questrail.lsnp.time.ManualMonotonicClock;
import com.questrail.lsnp.time.ManualWallClock;
import com.questrail.lsnp.transport.RecordingMessageSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class MessageRouterTest
{
    private static final UserId ALICE = UserId.of("alice", "10.0.0.1");
    private static final UserId BOB = UserId.of("bob", "10.0.0.2");
    private static final UserId CAROL = UserId.of("carol", "10.0.0.3");
    private static final InetSocketAddress BOB_ADDR = new InetSocketAddress("10.0.0.2", 40002);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final ManualWallClock wall = new ManualWallClock();
    private final PeerRegistry registry = new PeerRegistry(ALICE, clock, Duration.ofSeconds(300));
    private final RecordingMessageSender sender = new RecordingMessageSender();
    private final List<LsnpEvent> events = new ArrayList<>();
    private final List<String> revoked = new ArrayList<>();
    private final MessageFactory aliceMessages = new MessageFactory(ALICE, wall);
    private final MessageFactory bobMessages = new MessageFactory(BOB, wall);

    private MessageRouter router;

    @BeforeEach
    void setUp() {
        DiscoveryService discovery = new DiscoveryService(registry, sender, aliceMessages, () -> 40001);
        router = new MessageRouter(aliceMessages, registry, discovery, sender, wall,
                PayloadLimits.defaults(), Duration.ofHours(1), events::add, revoked::add);
    }

    private void knowBob() {
        registry.upsert(BOB, BOB_ADDR);
        events.clear();
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    @Test
    void dmToUnknownUserSendsNothing() {
        assertThrows(RecipientUnknownException.class, () -> router.sendDirectMessage(BOB, "hi"));
        assertTrue(sender.sent().isEmpty());
        assertTrue(router.directMessages(BOB).isEmpty());
    }

    @Test
    void dmGoesToPeerAndIsRecordedAsSent() {
        knowBob();
        router.sendDirectMessage(BOB, "hi");

        RecordingMessageSender.Outbound out = sender.sent().get(0);
        assertEquals(BOB_ADDR, out.remote());
        assertEquals(BOB, out.message().recipient());
        assertEquals(ALICE, out.message().sender());
        assertEquals(List.of(DmEntry.Direction.SENT),
                router.directMessages(BOB).stream().map(DmEntry::direction).collect(Collectors.toList()));
    }

    @Test
    void postGoesToEveryPeerAndIntoOwnFeed() {
        knowBob();
        registry.upsert(CAROL, new InetSocketAddress("10.0.0.3", 40003));

        Post post = router.post("hello world");

        assertEquals(2, sender.sentOfType(MessageType.POST).size());
        assertEquals(post.postId(), sender.sent().get(0).message().messageId());
        assertEquals(3600, sender.sent().get(0).message().requireLong(LsnpFields.TTL));
        assertEquals(List.of(post), router.feed());
    }

    @Test
    void avatarOverLimitIsRefusedBeforeSending() {
        knowBob();
        byte[] avatar = new byte[20 * 1024 + 1];

        assertThrows(PayloadTooLargeException.class,
                () -> router.updateProfile("Alice", "busy", avatar, "image/png"));
        assertTrue(sender.sent().isEmpty());
    }

    @Test
    void profileWithAvatarIsBase64Encoded() {
        knowBob();
        byte[] avatar = {1, 2, 3, 4};

        router.updateProfile("Alice", "busy", avatar, "image/png");

        LsnpMessage m = sender.sent().get(0).message();
        assertEquals("base64", m.require(LsnpFields.AVATAR_ENCODING));
        assertArrayEquals(avatar, Base64.getDecoder().decode(m.require(LsnpFields.AVATAR_DATA)));
        assertEquals("image/png", router.selfProfile().avatar().orElseThrow());
    }

    @Test
    void followRequiresKnownPeerAndRecordsEdge() {
        assertThrows(RecipientUnknownException.class, () -> router.follow(BOB));

        knowBob();
        router.follow(BOB);
        router.follow(BOB);

        assertEquals(Set.of(BOB), router.following());
        assertEquals(2, sender.sentOfType(MessageType.FOLLOW).size());

        router.unfollow(BOB);
        assertTrue(router.following().isEmpty());
    }

    @Test
    void likeIsAddressedToTheAuthor() {
        knowBob();
        router.like(BOB, "post-1");
        router.like(BOB, "post-1");

        LsnpMessage like = sender.sent().get(0).message();
        assertEquals(BOB, like.recipient());
        assertEquals("post-1", like.require(LsnpFields.POST_ID));
        assertEquals(Set.of(ALICE), router.likesOf("post-1"));
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    @Test
    void inboundDmToUsIsAppendedAndReported() {
        knowBob();
        LsnpMessage dm = bobMessages.beginTo(MessageType.DM, ALICE).put(LsnpFields.CONTENT, "hi").build();

        router.dispatch(dm, BOB_ADDR);

        List<DmEntry> thread = router.directMessages(BOB);
        assertEquals(1, thread.size());
        assertEquals("hi", thread.get(0).content());
        assertEquals(DmEntry.Direction.RECEIVED, thread.get(0).direction());
        assertTrue(events.get(0) instanceof LsnpEvent.MessageReceived r && r.from().equals(BOB));
    }

    @Test
    void inboundDmForSomeoneElseIsIgnored() {
        LsnpMessage dm = bobMessages.beginTo(MessageType.DM, CAROL).put(LsnpFields.CONTENT, "psst").build();

        router.dispatch(dm, BOB_ADDR);

        assertTrue(router.directMessages(BOB).isEmpty());
        assertTrue(events.isEmpty());
    }

    @Test
    void ourOwnEchoIsIgnored() {
        LsnpMessage post = aliceMessages.begin(MessageType.POST).put(LsnpFields.CONTENT, "echo").build();
        router.dispatch(post, new InetSocketAddress("10.0.0.1", 50999));

        assertTrue(router.feed().isEmpty());
    }

    @Test
    void unknownTypeIsIgnored() {
        LsnpMessage odd = LsnpMessage.of(Map.of(LsnpFields.TYPE, "FILE_OFFER", LsnpFields.FROM, "bob@10.0.0.2"));
        assertDoesNotThrow(() -> router.dispatch(odd, BOB_ADDR));
        assertTrue(events.isEmpty());
    }

    @Test
    void inboundPostLandsInAuthorsFeedUntilItExpires() {
        knowBob();
        router.follow(BOB);
        LsnpMessage post = bobMessages.begin(MessageType.POST)
                .put(LsnpFields.CONTENT, "short lived")
                .put(LsnpFields.TTL, 60)
                .build();
        router.dispatch(post, BOB_ADDR);

        assertEquals(1, router.feedOf(BOB).size());
        wall.advance(Duration.ofSeconds(61));
        assertTrue(router.feedOf(BOB).isEmpty());
    }

    @Test
    void postFromAuthorWeDoNotFollowIsDropped() {
        knowBob();
        LsnpMessage post = bobMessages.begin(MessageType.POST).put(LsnpFields.CONTENT, "unsolicited").build();

        router.dispatch(post, BOB_ADDR);
        assertTrue(router.feedOf(BOB).isEmpty());
        assertTrue(events.isEmpty());

        router.follow(BOB);
        router.dispatch(bobMessages.begin(MessageType.POST).put(LsnpFields.CONTENT, "now you see it").build(), BOB_ADDR);
        assertEquals(1, router.feedOf(BOB).size());

        router.unfollow(BOB);
        router.dispatch(bobMessages.begin(MessageType.POST).put(LsnpFields.CONTENT, "gone again").build(), BOB_ADDR);
        assertEquals(1, router.feedOf(BOB).size());
    }

    @Test
    void revokeTokenTellsEveryPeerAndRevokesLocally() {
        knowBob();
        String token = "alice@10.0.0.1|1700003600|chat";

        router.revokeToken(token);

        RecordingMessageSender.Outbound out = sender.sentOfType(MessageType.REVOKE).get(0);
        assertEquals(BOB_ADDR, out.remote());
        assertEquals(token, out.message().require(LsnpFields.TOKEN));
        assertEquals(ALICE, out.message().sender());
        assertEquals(List.of(token), revoked);
    }

    @Test
    void revokingSomeoneElsesTokenSendsNothing() {
        knowBob();
        assertThrows(IllegalArgumentException.class, () -> router.revokeToken("bob@10.0.0.2|1700003600|chat"));
        assertThrows(IllegalArgumentException.class, () -> router.revokeToken("garbage"));
        assertTrue(sender.sent().isEmpty());
        assertTrue(revoked.isEmpty());
    }

    @Test
    void inboundRevokeIsHonouredOnlyForTheSendersOwnToken() {
        knowBob();
        String bobs = "bob@10.0.0.2|1700003600|broadcast";
        String carols = "carol@10.0.0.3|1700003600|broadcast";

        router.dispatch(bobMessages.begin(MessageType.REVOKE).put(LsnpFields.TOKEN, carols).build(), BOB_ADDR);
        assertTrue(revoked.isEmpty());

        router.dispatch(bobMessages.begin(MessageType.REVOKE).put(LsnpFields.TOKEN, bobs).build(), BOB_ADDR);
        assertEquals(List.of(bobs), revoked);
    }

    @Test
    void inboundProfileUpdatesPeer() {
        knowBob();
        LsnpMessage profile = bobMessages.begin(MessageType.PROFILE)
                .put(LsnpFields.DISPLAY_NAME, "Bobby")
                .put(LsnpFields.STATUS, "coding")
                .put(LsnpFields.AVATAR_TYPE, "image/png")
                .put(LsnpFields.AVATAR_ENCODING, "base64")
                .put(LsnpFields.AVATAR_DATA, "AQID")
                .build();

        router.dispatch(profile, BOB_ADDR);

        Peer bob = registry.lookup(BOB).orElseThrow();
        assertEquals("Bobby", bob.profile().displayName());
        assertEquals("coding", bob.profile().status());
        assertTrue(bob.profile().hasAvatar());
    }

    @Test
    void inboundFollowAndUnfollowTrackFollowers() {
        router.dispatch(bobMessages.beginTo(MessageType.FOLLOW, ALICE).build(), BOB_ADDR);
        assertEquals(Set.of(BOB), router.followers());

        router.dispatch(bobMessages.beginTo(MessageType.UNFOLLOW, ALICE).build(), BOB_ADDR);
        assertTrue(router.followers().isEmpty());
    }

    @Test
    void inboundLikeTwiceCountsOnce() {
        LsnpMessage like = bobMessages.beginTo(MessageType.LIKE, ALICE).put(LsnpFields.POST_ID, "p1").build();

        router.dispatch(like, BOB_ADDR);
        router.dispatch(like, BOB_ADDR);
        assertEquals(Set.of(BOB), router.likesOf("p1"));

        router.dispatch(bobMessages.beginTo(MessageType.UNLIKE, ALICE).put(LsnpFields.POST_ID, "p1").build(), BOB_ADDR);
        assertTrue(router.likesOf("p1").isEmpty());
    }

    @Test
    void peerDepartureDropsFollowEdgesAndIsReported() {
        knowBob();
        router.follow(BOB);
        router.dispatch(bobMessages.beginTo(MessageType.FOLLOW, ALICE).build(), BOB_ADDR);
        events.clear();

        clock.advanceMillis(301_000);
        registry.sweep();

        assertTrue(router.following().isEmpty());
        assertTrue(router.followers().isEmpty());
        assertTrue(events.get(0) instanceof LsnpEvent.PeerLeft left && left.peer().userId().equals(BOB));
    }

    @Test
    void discoveryIsRoutedToDiscoveryService() {
        LsnpMessage hello = bobMessages.begin(MessageType.PEER_DISCOVERY).put(LsnpFields.PORT, 40002).build();

        router.dispatch(hello, new InetSocketAddress("10.0.0.2", 50999));

        assertEquals(BOB_ADDR, registry.lookup(BOB).orElseThrow().address());
        assertTrue(events.get(0) instanceof LsnpEvent.PeerJoined);
    }
}
