package com.questrail.lsnp.router;

import com.questrail.lsnp.api.GroupNotFoundException;
import com.questrail.lsnp.api.InvalidMessageFormatException;
import com.questrail.lsnp.api.LsnpEvent;
import com.questrail.lsnp.api.PermissionDeniedException;
import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.model.Group;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.MessageFactory;
import com.questrail.lsnp.model.MessageType;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.registry.PeerRegistry;
import com.questrail.lsnp.router.state.GroupTable;
import com.questrail.lsnp.transport.MessageSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * GroupCoordinator
 * =============================================================================
 * Named groups with a shared message log.
 *
 * <h2>Membership policy</h2>
 * Only the creator changes membership. A local attempt by anyone else throws
 * {@link PermissionDeniedException}; an inbound {@code GROUP_UPDATE} from
 * anyone else is dropped. The creator can never be removed.
 *
 * <h2>Fan-out</h2>
 * Group traffic is unicast to each member other than the sender. Members not
 * currently in the peer registry are skipped.
 */
public final class GroupCoordinator
{
    private static final Logger log = LoggerFactory.getLogger(GroupCoordinator.class);

    private final MessageFactory messages;
    private final PeerRegistry registry;
    private final MessageSender sender;
    private final WallClock wallClock;
    private final Consumer<LsnpEvent> events;

    private final GroupTable groups = new GroupTable();

    public GroupCoordinator(MessageFactory messages,
                            PeerRegistry registry,
                            MessageSender sender,
                            WallClock wallClock,
                            Consumer<LsnpEvent> events)
    {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.events = Objects.requireNonNull(events, "events");
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    /**
     * Creates a group owned by the local user and announces it to the members.
     *
     * @throws IllegalArgumentException if a group with this id already exists
     */
    public Group createGroup(String groupId, String name, Set<UserId> members)
    {
        Group group = Group.create(groupId, name, messages.self(), members);
        if (!groups.putIfAbsent(group)) {
            throw new IllegalArgumentException("Group " + groupId + " already exists");
        }

        LsnpMessage create = messages.begin(MessageType.GROUP_CREATE)
                .put(LsnpFields.GROUP_ID, groupId)
                .put(LsnpFields.GROUP_NAME, name)
                .put(LsnpFields.MEMBERS, join(group.members()))
                .build();
        fanOut(group.members(), create);
        return group;
    }

    /**
     * Adds and removes members. The update goes to everyone who was or now is
     * a member and carries the group name and full member list, so a member
     * added here can create the group on its side.
     *
     * @throws GroupNotFoundException   if the group is unknown
     * @throws PermissionDeniedException if the local user is not the creator
     */
    public Group updateGroup(String groupId, Set<UserId> add, Set<UserId> remove)
    {
        Objects.requireNonNull(add, "add");
        Objects.requireNonNull(remove, "remove");

        Group before = groups.get(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
        if (!before.creator().equals(messages.self())) {
            throw new PermissionDeniedException("Only " + before.creator() + " may change members of " + groupId);
        }

        Group after = groups.update(groupId, g -> g.withMembership(add, remove))
                .orElseThrow(() -> new GroupNotFoundException(groupId));

        Set<UserId> audience = new LinkedHashSet<>(before.members());
        audience.addAll(after.members());
        fanOut(audience, messages.begin(MessageType.GROUP_UPDATE)
                .put(LsnpFields.GROUP_ID, groupId)
                .put(LsnpFields.GROUP_NAME, after.name())
                .put(LsnpFields.ADD, join(add))
                .put(LsnpFields.REMOVE, join(remove))
                .put(LsnpFields.MEMBERS, join(after.members()))
                .build());
        return after;
    }

    /**
     * @throws GroupNotFoundException   if the group is unknown
     * @throws PermissionDeniedException if the local user is not a member
     */
    public Group sendGroupMessage(String groupId, String content)
    {
        Objects.requireNonNull(content, "content");

        Group group = groups.get(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
        if (!group.isMember(messages.self())) {
            throw new PermissionDeniedException("Not a member of " + groupId);
        }

        LsnpMessage message = messages.begin(MessageType.GROUP_MESSAGE)
                .put(LsnpFields.GROUP_ID, groupId)
                .put(LsnpFields.CONTENT, content)
                .build();
        fanOut(group.members(), message);

        Group.Entry entry = new Group.Entry(messages.self(), wallClock.now(), content);
        return groups.update(groupId, g -> g.withEntry(entry)).orElse(group);
    }

    public Optional<Group> group(String groupId)
    {
        return groups.get(groupId);
    }

    public List<Group> groups()
    {
        return groups.all();
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    public void onCreate(LsnpMessage message)
    {
        UserId creator = message.sender();
        String groupId = message.require(LsnpFields.GROUP_ID);
        Set<UserId> members = parseUsers(message, LsnpFields.MEMBERS);

        if (!members.contains(messages.self())) {
            log.debug("Ignoring GROUP_CREATE {} from {}: we are not a member", groupId, creator);
            return;
        }

        Optional<Group> existing = groups.get(groupId);
        if (existing.isPresent() && !existing.get().creator().equals(creator)) {
            log.warn("Ignoring GROUP_CREATE {} from {}: group already owned by {}",
                    groupId, creator, existing.get().creator());
            return;
        }

        String name = message.get(LsnpFields.GROUP_NAME).orElse(groupId);
        groups.put(Group.create(groupId, name, creator, members));
        events.accept(new LsnpEvent.MessageReceived(creator, message));
    }

    public void onUpdate(LsnpMessage message)
    {
        UserId from = message.sender();
        String groupId = message.require(LsnpFields.GROUP_ID);

        Optional<Group> existing = groups.get(groupId);
        if (existing.isEmpty()) {
            joinOnUpdate(from, groupId, message);
            return;
        }
        if (!existing.get().creator().equals(from)) {
            log.warn("Ignoring GROUP_UPDATE {} from {}: only {} may change members",
                    groupId, from, existing.get().creator());
            return;
        }

        Set<UserId> add = parseUsers(message, LsnpFields.ADD);
        Set<UserId> remove = parseUsers(message, LsnpFields.REMOVE);
        groups.update(groupId, g -> g.withMembership(add, remove));
        events.accept(new LsnpEvent.MessageReceived(from, message));
    }

    /**
     * An update for a group we do not know yet creates it when it adds us. The
     * sender becomes the creator; the member list is taken from {@code MEMBERS},
     * or from {@code ADD} when an older peer left it out.
     */
    private void joinOnUpdate(UserId from, String groupId, LsnpMessage message)
    {
        Set<UserId> add = parseUsers(message, LsnpFields.ADD);
        if (!add.contains(messages.self())) {
            log.debug("Ignoring GROUP_UPDATE for unknown group {} from {}", groupId, from);
            return;
        }

        Set<UserId> members = message.has(LsnpFields.MEMBERS)
                ? parseUsers(message, LsnpFields.MEMBERS)
                : add;
        members.add(messages.self());

        String name = message.get(LsnpFields.GROUP_NAME).orElse(groupId);
        if (groups.putIfAbsent(Group.create(groupId, name, from, members))) {
            log.info("Added to group {} by {}", groupId, from);
            events.accept(new LsnpEvent.MessageReceived(from, message));
        }
    }

    public void onMessage(LsnpMessage message)
    {
        UserId from = message.sender();
        String groupId = message.require(LsnpFields.GROUP_ID);
        String content = message.require(LsnpFields.CONTENT);

        Optional<Group> group = groups.get(groupId);
        if (group.isEmpty() || !group.get().isMember(from)) {
            log.warn("Ignoring GROUP_MESSAGE for {} from {}: unknown group or not a member", groupId, from);
            return;
        }

        Instant at = timestampOf(message);
        groups.update(groupId, g -> g.withEntry(new Group.Entry(from, at, content)));
        events.accept(new LsnpEvent.MessageReceived(from, message));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void fanOut(Collection<UserId> audience, LsnpMessage message)
    {
        for (UserId member : audience) {
            if (member.equals(messages.self())) {
                continue;
            }
            Optional<Peer> peer = registry.lookup(member);
            if (peer.isPresent()) {
                sender.sendTo(peer.get().address(), message);
            } else {
                log.debug("Group member {} is not reachable; skipping {}", member, message.typeName());
            }
        }
    }

    private Instant timestampOf(LsnpMessage message)
    {
        return message.has(LsnpFields.TIMESTAMP)
                ? Instant.ofEpochSecond(message.timestamp())
                : wallClock.now();
    }

    private static String join(Collection<UserId> users)
    {
        return users.stream().map(UserId::value).collect(Collectors.joining(","));
    }

    private static Set<UserId> parseUsers(LsnpMessage message, String field)
    {
        Set<UserId> users = new LinkedHashSet<>();
        for (String raw : message.get(field).orElse("").split(",")) {
            if (raw.isBlank()) {
                continue;
            }
            try {
                users.add(UserId.parse(raw.trim()));
            } catch (IllegalArgumentException e) {
                throw new InvalidMessageFormatException(field + " holds a malformed user id: '" + raw + "'", e);
            }
        }
        return users;
    }
}
