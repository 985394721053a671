package com.questrail.lsnp.router.state;

import com.questrail.lsnp.model.UserId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Directed follow edges known to this node: who we follow, and who follows us.
 * Add and remove are idempotent.
 */
public final class SocialGraph
{
    private final Map<UserId, Set<UserId>> following = new HashMap<>();

    /**
     * @return {@code true} if the edge was new
     */
    public synchronized boolean follow(UserId follower, UserId followee)
    {
        Objects.requireNonNull(follower, "follower");
        Objects.requireNonNull(followee, "followee");
        return following.computeIfAbsent(follower, k -> new TreeSet<>()).add(followee);
    }

    /**
     * @return {@code true} if the edge existed
     */
    public synchronized boolean unfollow(UserId follower, UserId followee)
    {
        Set<UserId> edges = following.get(follower);
        if (edges == null || !edges.remove(followee)) {
            return false;
        }
        if (edges.isEmpty()) {
            following.remove(follower);
        }
        return true;
    }

    public synchronized boolean isFollowing(UserId follower, UserId followee)
    {
        Set<UserId> edges = following.get(follower);
        return edges != null && edges.contains(followee);
    }

    public synchronized Set<UserId> followingOf(UserId follower)
    {
        Set<UserId> edges = following.get(follower);
        return edges == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(edges));
    }

    public synchronized Set<UserId> followersOf(UserId followee)
    {
        Set<UserId> result = new TreeSet<>();
        following.forEach((follower, edges) -> {
            if (edges.contains(followee)) {
                result.add(follower);
            }
        });
        return Collections.unmodifiableSet(result);
    }

    /**
     * Drops every edge touching {@code user}, in either direction.
     */
    public synchronized void forget(UserId user)
    {
        following.remove(user);
        following.values().removeIf(edges -> edges.remove(user) && edges.isEmpty());
    }
}
