package com.questrail.lsnp.router.state;

import com.questrail.lsnp.model.Post;
import com.questrail.lsnp.model.UserId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class PostFeedTest
{
    private static final UserId BOB = UserId.of("bob", "10.0.0.2");
    private static final UserId CAROL = UserId.of("carol", "10.0.0.3");
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final PostFeed feed = new PostFeed();

    @Test
    void postsAreGroupedByAuthor() {
        feed.add(new Post("a", BOB, "one", T0, Duration.ofHours(1)));
        feed.add(new Post("b", CAROL, "two", T0, Duration.ofHours(1)));
        feed.add(new Post("c", BOB, "three", T0.plusSeconds(1), Duration.ofHours(1)));

        assertEquals(List.of("one", "three"),
                feed.postsBy(BOB, T0.plusSeconds(2)).stream().map(Post::content).collect(Collectors.toList()));
        assertEquals(3, feed.all(T0.plusSeconds(2)).size());
    }

    @Test
    void expiredPostsAreHidden() {
        feed.add(new Post("a", BOB, "short", T0, Duration.ofSeconds(10)));
        feed.add(new Post("b", BOB, "long", T0, Duration.ofHours(1)));

        List<Post> later = feed.all(T0.plusSeconds(11));
        assertEquals(1, later.size());
        assertEquals("long", later.get(0).content());
    }
}
