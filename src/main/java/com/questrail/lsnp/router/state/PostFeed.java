package com.questrail.lsnp.router.state;

import com.questrail.lsnp.model.Post;
import com.questrail.lsnp.model.UserId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Posts per author, oldest first. Expired posts are hidden from queries and
 * purged lazily.
 */
public final class PostFeed
{
    private final Map<UserId, List<Post>> byAuthor = new HashMap<>();

    public synchronized void add(Post post)
    {
        Objects.requireNonNull(post, "post");
        byAuthor.computeIfAbsent(post.author(), k -> new ArrayList<>()).add(post);
    }

    /**
     * Live posts of one author.
     */
    public synchronized List<Post> postsBy(UserId author, Instant now)
    {
        List<Post> posts = byAuthor.get(author);
        if (posts == null) {
            return List.of();
        }
        posts.removeIf(p -> p.isExpired(now));
        return List.copyOf(posts);
    }

    /**
     * Live posts of every author, oldest first.
     */
    public synchronized List<Post> all(Instant now)
    {
        byAuthor.values().forEach(posts -> posts.removeIf(p -> p.isExpired(now)));
        byAuthor.values().removeIf(List::isEmpty);
        return byAuthor.values().stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparing(Post::timestamp))
                .collect(Collectors.toUnmodifiableList());
    }
}
