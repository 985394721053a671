package com.questrail.lsnp.api;

import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.router.game.GameSession;

import java.util.Objects;

/**
 * Inbound event stream delivered to {@link LsnpEventListener}s.
 */
public sealed interface LsnpEvent
{
    record PeerJoined(Peer peer) implements LsnpEvent {
        public PeerJoined {
            Objects.requireNonNull(peer, "peer");
        }
    }

    record PeerLeft(Peer peer) implements LsnpEvent {
        public PeerLeft {
            Objects.requireNonNull(peer, "peer");
        }
    }

    /**
     * A user-visible message (post, DM, profile, follow, group, like) was
     * accepted and applied to local state.
     */
    record MessageReceived(UserId from, LsnpMessage message) implements LsnpEvent {
        public MessageReceived {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * A game changed: created, moved, or completed. A completed session has
     * already been removed from the active game table.
     */
    record GameUpdated(GameSession session) implements LsnpEvent {
        public GameUpdated {
            Objects.requireNonNull(session, "session");
        }
    }
}
