package com.questrail.lsnp.router.state;

import com.questrail.lsnp.model.UserId;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class LikeIndexTest
{
    private static final UserId BOB = UserId.of("bob", "10.0.0.2");
    private static final UserId CAROL = UserId.of("carol", "10.0.0.3");

    private final LikeIndex likes = new LikeIndex();

    @Test
    void likingTwiceKeepsOneLike() {
        assertTrue(likes.like("p1", BOB));
        assertFalse(likes.like("p1", BOB));

        assertEquals(Set.of(BOB), likes.likesOf("p1"));
    }

    @Test
    void unlikeRemovesOnlyThatLiker() {
        likes.like("p1", BOB);
        likes.like("p1", CAROL);

        assertTrue(likes.unlike("p1", BOB));
        assertFalse(likes.unlike("p1", BOB));
        assertEquals(Set.of(CAROL), likes.likesOf("p1"));
    }

    @Test
    void unknownPostHasNoLikes() {
        assertTrue(likes.likesOf("nope").isEmpty());
        assertFalse(likes.unlike("nope", BOB));
    }
}
