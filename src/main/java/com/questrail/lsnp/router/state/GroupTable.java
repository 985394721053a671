package com.questrail.lsnp.router.state;

import com.questrail.lsnp.model.Group;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Groups known to this node, by group id. Holds immutable {@link Group}
 * snapshots and swaps them on change.
 */
public final class GroupTable
{
    private final Map<String, Group> groups = new TreeMap<>();

    /**
     * Stores {@code group}, replacing an existing group with the same id.
     */
    public synchronized void put(Group group)
    {
        Objects.requireNonNull(group, "group");
        groups.put(group.groupId(), group);
    }

    /**
     * @return {@code false} if a group with the same id is already stored
     */
    public synchronized boolean putIfAbsent(Group group)
    {
        Objects.requireNonNull(group, "group");
        return groups.putIfAbsent(group.groupId(), group) == null;
    }

    public synchronized Optional<Group> get(String groupId)
    {
        return Optional.ofNullable(groups.get(groupId));
    }

    /**
     * Applies {@code change} to the stored group atomically.
     *
     * @return the new snapshot, or empty if the group is unknown
     */
    public synchronized Optional<Group> update(String groupId, UnaryOperator<Group> change)
    {
        Group current = groups.get(groupId);
        if (current == null) {
            return Optional.empty();
        }
        Group next = Objects.requireNonNull(change.apply(current), "change returned null");
        groups.put(groupId, next);
        return Optional.of(next);
    }

    public synchronized List<Group> all()
    {
        return List.copyOf(groups.values());
    }
}
