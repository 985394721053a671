package com.questrail.lsnp.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Presentation data a peer publishes about itself through PROFILE messages.
 *
 * <p>Only the presence and MIME type of an avatar are retained; the image
 * bytes are passed through to listeners and not stored.</p>
 *
 * @param displayName   human readable name, never {@code null}
 * @param status        free-text status line, never {@code null}
 * @param avatarType    avatar MIME type, or {@code null} when the peer has no avatar
 */
public record PeerProfile(String displayName, String status, String avatarType)
{
    public PeerProfile {
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(status, "status");
    }

    /**
     * Profile used until a PROFILE message arrives: the user id stands in for
     * the display name.
     */
    public static PeerProfile placeholder(UserId userId) {
        return new PeerProfile(userId.value(), "", null);
    }

    public boolean hasAvatar() {
        return avatarType != null;
    }

    public Optional<String> avatar() {
        return Optional.ofNullable(avatarType);
    }
}
