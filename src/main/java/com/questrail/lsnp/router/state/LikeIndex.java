package com.questrail.lsnp.router.state;

import com.questrail.lsnp.model.UserId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Post id to the set of users who like it.
 */
public final class LikeIndex
{
    private final Map<String, Set<UserId>> likes = new HashMap<>();

    /**
     * @return {@code true} if {@code liker} did not already like the post
     */
    public synchronized boolean like(String postId, UserId liker)
    {
        Objects.requireNonNull(postId, "postId");
        Objects.requireNonNull(liker, "liker");
        return likes.computeIfAbsent(postId, k -> new TreeSet<>()).add(liker);
    }

    /**
     * @return {@code true} if {@code liker} had liked the post
     */
    public synchronized boolean unlike(String postId, UserId liker)
    {
        Set<UserId> set = likes.get(postId);
        if (set == null || !set.remove(liker)) {
            return false;
        }
        if (set.isEmpty()) {
            likes.remove(postId);
        }
        return true;
    }

    public synchronized Set<UserId> likesOf(String postId)
    {
        Set<UserId> set = likes.get(postId);
        return set == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(set));
    }
}
