package com.questrail.lsnp.router;

import com.questrail.lsnp.api.LsnpEvent;
import com.questrail.lsnp.api.PayloadTooLargeException;
import com.questrail.lsnp.api.RecipientUnknownException;
import com.questrail.lsnp.codec.PayloadLimits;
import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.model.DmEntry;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.MessageFactory;
import com.questrail.lsnp.model.MessageType;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.PeerProfile;
import com.questrail.lsnp.model.Post;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.registry.DiscoveryService;
import com.questrail.lsnp.registry.PeerRegistry;
import com.questrail.lsnp.registry.PeerRegistryListener;
import com.questrail.lsnp.router.game.GameCoordinator;
import com.questrail.lsnp.router.state.DirectMessageStore;
import com.questrail.lsnp.router.state.LikeIndex;
import com.questrail.lsnp.router.state.PostFeed;
import com.questrail.lsnp.router.state.SocialGraph;
import com.questrail.lsnp.security.Token;
import com.questrail.lsnp.security.TokenRejectedException;
import com.questrail.lsnp.transport.MessageSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * MessageRouter
 * =============================================================================
 * Dispatches decoded messages by {@code TYPE} and builds outbound messages for
 * local intents.
 *
 * <h2>Inbound</h2>
 * <pre>
 *   dispatch(message, source)
 *     ├─ unknown TYPE                → ignored (DEBUG)
 *     ├─ sender is us                → ignored (our own broadcast echo)
 *     ├─ addressed and TO is not us  → ignored
 *     └─ one handler per TYPE        → state change + {@link LsnpEvent}
 * </pre>
 *
 * <h2>Outbound</h2>
 * Every intent validates first and sends second, so a failing intent
 * ({@link RecipientUnknownException}, {@link PayloadTooLargeException}, ...)
 * leaves no packet on the wire.
 *
 * <p>Group and game traffic is delegated to {@link GroupCoordinator} and
 * {@link GameCoordinator}; presence traffic to {@link DiscoveryService}.</p>
 */
public final class MessageRouter implements PeerRegistryListener
{
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private static final String AVATAR_ENCODING_BASE64 = "base64";

    private final MessageFactory messages;
    private final PeerRegistry registry;
    private final DiscoveryService discovery;
    private final MessageSender sender;
    private final WallClock wallClock;
    private final PayloadLimits limits;
    private final Duration postTtl;
    private final Consumer<LsnpEvent> events;
    private final Consumer<String> revocations;

    private final SocialGraph socialGraph = new SocialGraph();
    private final LikeIndex likes = new LikeIndex();
    private final DirectMessageStore directMessages = new DirectMessageStore();
    private final PostFeed feed = new PostFeed();

    private final GroupCoordinator groups;
    private final GameCoordinator games;

    private volatile PeerProfile selfProfile;

    public MessageRouter(MessageFactory messages,
                         PeerRegistry registry,
                         DiscoveryService discovery,
                         MessageSender sender,
                         WallClock wallClock,
                         PayloadLimits limits,
                         Duration postTtl,
                         Consumer<LsnpEvent> events)
    {
        this(messages, registry, discovery, sender, wallClock, limits, postTtl, events,
                token -> log.debug("No revocation list; ignoring revoked token"));
    }

    /**
     * @param revocations receives every token revoked by its owner, ours included
     */
    public MessageRouter(MessageFactory messages,
                         PeerRegistry registry,
                         DiscoveryService discovery,
                         MessageSender sender,
                         WallClock wallClock,
                         PayloadLimits limits,
                         Duration postTtl,
                         Consumer<LsnpEvent> events,
                         Consumer<String> revocations)
    {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.postTtl = Objects.requireNonNull(postTtl, "postTtl");
        this.events = Objects.requireNonNull(events, "events");
        this.revocations = Objects.requireNonNull(revocations, "revocations");

        this.groups = new GroupCoordinator(messages, registry, sender, wallClock, events);
        this.games = new GameCoordinator(messages, registry, sender, events);
        this.selfProfile = PeerProfile.placeholder(messages.self());

        registry.addListener(this);
    }

    public UserId self() {
        return messages.self();
    }

    public GroupCoordinator groups() {
        return groups;
    }

    public GameCoordinator games() {
        return games;
    }

    // ---------------------------------------------------------------------
    // Inbound dispatch
    // ---------------------------------------------------------------------

    /**
     * Applies one inbound message.
     *
     * @throws com.questrail.lsnp.api.InvalidMessageFormatException if a field the
     *         handler needs is missing or malformed; no state has changed
     */
    public void dispatch(LsnpMessage message, InetSocketAddress source)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(source, "source");

        Optional<MessageType> type = message.type();
        if (type.isEmpty()) {
            log.debug("Ignoring message of unknown type {} from {}", message.typeName(), source);
            return;
        }

        UserId from = message.sender();
        if (from.equals(self())) {
            return;
        }
        if (type.get().isAddressed() && !message.recipient().equals(self())) {
            log.debug("Ignoring {} from {} addressed to {}", message.typeName(), from, message.recipient());
            return;
        }

        switch (type.get()) {
            case PEER_DISCOVERY -> discovery.onDiscovery(message, source);
            case PEER_LIST_REQUEST -> discovery.onPeerListRequest(message, source);
            case PEER_LIST_RESPONSE -> discovery.onPeerListResponse(message);
            case POST -> onPost(from, message);
            case DM -> onDirectMessage(from, message);
            case PROFILE -> onProfile(from, message, source);
            case FOLLOW -> onFollow(from, message, true);
            case UNFOLLOW -> onFollow(from, message, false);
            case LIKE -> onLike(from, message, true);
            case UNLIKE -> onLike(from, message, false);
            case GROUP_CREATE -> groups.onCreate(message);
            case GROUP_UPDATE -> groups.onUpdate(message);
            case GROUP_MESSAGE -> groups.onMessage(message);
            case TICTACTOE_INVITE -> games.onInvite(message);
            case TICTACTOE_MOVE -> games.onMove(message);
            case TICTACTOE_RESULT -> games.onResult(message);
            case REVOKE -> onRevoke(from, message);
        }
    }

    /**
     * Posts are kept only from authors we follow; others are dropped.
     */
    private void onPost(UserId from, LsnpMessage message)
    {
        String content = message.require(LsnpFields.CONTENT);
        if (!socialGraph.isFollowing(self(), from)) {
            log.debug("Dropping POST {} from {}: not followed", message.messageId(), from);
            return;
        }

        Duration ttl = message.has(LsnpFields.TTL)
                ? Duration.ofSeconds(Math.max(0, message.requireLong(LsnpFields.TTL)))
                : postTtl;

        feed.add(new Post(message.messageId(), from, content, timestampOf(message), ttl));
        events.accept(new LsnpEvent.MessageReceived(from, message));
    }

    private void onDirectMessage(UserId from, LsnpMessage message)
    {
        String content = message.require(LsnpFields.CONTENT);
        directMessages.append(from, new DmEntry(DmEntry.Direction.RECEIVED, timestampOf(message), content));
        events.accept(new LsnpEvent.MessageReceived(from, message));
    }

    private void onProfile(UserId from, LsnpMessage message, InetSocketAddress source)
    {
        String displayName = message.get(LsnpFields.DISPLAY_NAME).orElse(from.username());
        String status = message.get(LsnpFields.STATUS).orElse("");
        String avatarType = message.has(LsnpFields.AVATAR_DATA)
                ? message.get(LsnpFields.AVATAR_TYPE).orElse("application/octet-stream")
                : null;

        registry.upsert(from, source);
        registry.updateProfile(from, new PeerProfile(displayName, status, avatarType));
        events.accept(new LsnpEvent.MessageReceived(from, message));
    }

    private void onFollow(UserId from, LsnpMessage message, boolean follow)
    {
        boolean changed = follow ? socialGraph.follow(from, self()) : socialGraph.unfollow(from, self());
        if (changed) {
            log.info("{} {} us", from, follow ? "followed" : "unfollowed");
        }
        events.accept(new LsnpEvent.MessageReceived(from, message));
    }

    private void onLike(UserId from, LsnpMessage message, boolean like)
    {
        String postId = message.require(LsnpFields.POST_ID);
        if (like) {
            likes.like(postId, from);
        } else {
            likes.unlike(postId, from);
        }
        events.accept(new LsnpEvent.MessageReceived(from, message));
    }

    /**
     * A peer may only revoke its own tokens.
     */
    private void onRevoke(UserId from, LsnpMessage message)
    {
        String raw = message.require(LsnpFields.TOKEN);
        Token token = Token.parse(raw);
        if (!token.userId().equals(from)) {
            log.warn("Ignoring REVOKE from {} for a token owned by {}", from, token.userId());
            return;
        }
        revocations.accept(raw);
    }

    // ---------------------------------------------------------------------
    // Outbound intents
    // ---------------------------------------------------------------------

    /**
     * Sends a post to every known peer and records it in our own feed.
     */
    public Post post(String content)
    {
        Objects.requireNonNull(content, "content");

        LsnpMessage message = messages.begin(MessageType.POST)
                .put(LsnpFields.CONTENT, content)
                .put(LsnpFields.TTL, postTtl.toSeconds())
                .build();
        for (Peer peer : registry.snapshot()) {
            sender.sendTo(peer.address(), message);
        }

        Post post = new Post(message.messageId(), self(), content, Instant.ofEpochSecond(message.timestamp()), postTtl);
        feed.add(post);
        return post;
    }

    /**
     * @throws RecipientUnknownException if {@code to} is not a known peer; nothing is sent
     */
    public void sendDirectMessage(UserId to, String content)
    {
        Objects.requireNonNull(content, "content");
        Peer peer = requirePeer(to);

        LsnpMessage message = messages.beginTo(MessageType.DM, to)
                .put(LsnpFields.CONTENT, content)
                .build();
        sender.sendTo(peer.address(), message);
        directMessages.append(to, new DmEntry(DmEntry.Direction.SENT, Instant.ofEpochSecond(message.timestamp()), content));
    }

    /**
     * Publishes our profile to every known peer.
     *
     * @param avatar     raw image bytes, or {@code null} for no avatar
     * @param avatarMime MIME type of {@code avatar}; required when an avatar is given
     * @throws PayloadTooLargeException if the avatar exceeds the avatar limit
     */
    public PeerProfile updateProfile(String displayName, String status, byte[] avatar, String avatarMime)
    {
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(status, "status");
        if (avatar != null) {
            Objects.requireNonNull(avatarMime, "avatarMime");
            if (avatar.length > limits.avatarLimitBytes()) {
                throw new PayloadTooLargeException("Avatar", avatar.length, limits.avatarLimitBytes());
            }
        }

        LsnpMessage.Builder b = messages.begin(MessageType.PROFILE)
                .put(LsnpFields.DISPLAY_NAME, displayName)
                .put(LsnpFields.STATUS, status);
        if (avatar != null) {
            b.put(LsnpFields.AVATAR_TYPE, avatarMime)
             .put(LsnpFields.AVATAR_ENCODING, AVATAR_ENCODING_BASE64)
             .put(LsnpFields.AVATAR_DATA, Base64.getEncoder().encodeToString(avatar));
        }
        LsnpMessage message = b.build();

        for (Peer peer : registry.snapshot()) {
            sender.sendTo(peer.address(), message);
        }

        PeerProfile profile = new PeerProfile(displayName, status, avatar == null ? null : avatarMime);
        selfProfile = profile;
        return profile;
    }

    /**
     * Follows {@code target}. Following twice is a harmless no-op locally; the
     * message is still sent.
     *
     * @throws RecipientUnknownException if {@code target} is not a known peer
     */
    public void follow(UserId target)
    {
        sendFollow(target, MessageType.FOLLOW);
        socialGraph.follow(self(), target);
    }

    public void unfollow(UserId target)
    {
        sendFollow(target, MessageType.UNFOLLOW);
        socialGraph.unfollow(self(), target);
    }

    /**
     * Likes post {@code postId} written by {@code author}.
     *
     * @throws RecipientUnknownException if {@code author} is not a known peer
     */
    public void like(UserId author, String postId)
    {
        sendLike(author, postId, MessageType.LIKE);
        likes.like(postId, self());
    }

    public void unlike(UserId author, String postId)
    {
        sendLike(author, postId, MessageType.UNLIKE);
        likes.unlike(postId, self());
    }

    /**
     * Revokes one of our own tokens locally and tells every known peer.
     *
     * @throws IllegalArgumentException if the token is malformed or not ours
     */
    public void revokeToken(String token)
    {
        Objects.requireNonNull(token, "token");
        Token parsed;
        try {
            parsed = Token.parse(token);
        } catch (TokenRejectedException e) {
            throw new IllegalArgumentException("Not a token: " + token, e);
        }
        if (!parsed.userId().equals(self())) {
            throw new IllegalArgumentException("Token belongs to " + parsed.userId() + ", not " + self());
        }

        LsnpMessage message = messages.begin(MessageType.REVOKE)
                .put(LsnpFields.TOKEN, token)
                .build();
        for (Peer peer : registry.snapshot()) {
            sender.sendTo(peer.address(), message);
        }
        revocations.accept(token);
    }

    public void requestPeerList(UserId target)
    {
        discovery.requestPeerList(target);
    }

    private void sendFollow(UserId target, MessageType type)
    {
        Peer peer = requirePeer(target);
        sender.sendTo(peer.address(), messages.beginTo(type, target).build());
    }

    private void sendLike(UserId author, String postId, MessageType type)
    {
        Objects.requireNonNull(postId, "postId");
        Peer peer = requirePeer(author);
        sender.sendTo(peer.address(), messages.beginTo(type, author)
                .put(LsnpFields.POST_ID, postId)
                .build());
    }

    private Peer requirePeer(UserId user)
    {
        Objects.requireNonNull(user, "user");
        return registry.lookup(user).orElseThrow(() -> new RecipientUnknownException(user));
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public PeerProfile selfProfile() {
        return selfProfile;
    }

    public List<DmEntry> directMessages(UserId counterpart) {
        return directMessages.thread(counterpart);
    }

    public Set<UserId> likesOf(String postId) {
        return likes.likesOf(postId);
    }

    public Set<UserId> following() {
        return socialGraph.followingOf(self());
    }

    public Set<UserId> followers() {
        return socialGraph.followersOf(self());
    }

    public List<Post> feed() {
        return feed.all(wallClock.now());
    }

    public List<Post> feedOf(UserId author) {
        return feed.postsBy(author, wallClock.now());
    }

    // ---------------------------------------------------------------------
    // PeerRegistryListener
    // ---------------------------------------------------------------------

    @Override
    public void onPeerJoined(Peer peer) {
        events.accept(new LsnpEvent.PeerJoined(peer));
    }

    @Override
    public void onPeerLeft(Peer peer) {
        socialGraph.forget(peer.userId());
        events.accept(new LsnpEvent.PeerLeft(peer));
    }

    private Instant timestampOf(LsnpMessage message)
    {
        return message.has(LsnpFields.TIMESTAMP)
                ? Instant.ofEpochSecond(message.timestamp())
                : wallClock.now();
    }
}
