package com.questrail.lsnp.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a group: identity, creator, members and message log.
 *
 * <p>The member set always contains the creator. Mutating operations return a
 * new instance; the owning table swaps snapshots under its own lock.</p>
 */
public final class Group
{
    /**
     * One message posted to the group.
     */
    public record Entry(UserId from, Instant timestamp, String content) {
        public Entry {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(content, "content");
        }
    }

    private final String groupId;
    private final String name;
    private final UserId creator;
    private final Set<UserId> members;
    private final List<Entry> log;

    private Group(String groupId, String name, UserId creator, Set<UserId> members, List<Entry> log) {
        this.groupId = groupId;
        this.name = name;
        this.creator = creator;
        this.members = Collections.unmodifiableSet(members);
        this.log = Collections.unmodifiableList(log);
    }

    public static Group create(String groupId, String name, UserId creator, Set<UserId> members) {
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(members, "members");
        if (groupId.isEmpty()) {
            throw new IllegalArgumentException("groupId must not be empty");
        }
        Set<UserId> all = new LinkedHashSet<>();
        all.add(creator);
        all.addAll(members);
        return new Group(groupId, name, creator, all, new ArrayList<>());
    }

    public String groupId() {
        return groupId;
    }

    public String name() {
        return name;
    }

    public UserId creator() {
        return creator;
    }

    public Set<UserId> members() {
        return members;
    }

    public List<Entry> log() {
        return log;
    }

    public boolean isMember(UserId user) {
        return members.contains(user);
    }

    /**
     * Applies a membership change. The creator can never be removed.
     */
    public Group withMembership(Set<UserId> add, Set<UserId> remove) {
        Set<UserId> next = new LinkedHashSet<>(members);
        next.addAll(add);
        next.removeAll(remove);
        next.add(creator);
        return new Group(groupId, name, creator, next, new ArrayList<>(log));
    }

    public Group withEntry(Entry entry) {
        List<Entry> next = new ArrayList<>(log);
        next.add(Objects.requireNonNull(entry, "entry"));
        return new Group(groupId, name, creator, new LinkedHashSet<>(members), next);
    }

    @Override
    public String toString() {
        return "Group[" + groupId + " '" + name + "' creator=" + creator + " members=" + members.size() + "]";
    }
}
