package com.questrail.lsnp.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A broadcast post as stored in a feed.
 *
 * @param postId    the post's MESSAGE_ID, which LIKE/UNLIKE reference
 * @param author    posting user
 * @param content   text
 * @param timestamp author's timestamp
 * @param ttl       lifetime after {@code timestamp}
 */
public record Post(String postId, UserId author, String content, Instant timestamp, Duration ttl)
{
    public Post {
        Objects.requireNonNull(postId, "postId");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(ttl, "ttl");
    }

    public boolean isExpired(Instant now) {
        return !timestamp.plus(ttl).isAfter(now);
    }
}
