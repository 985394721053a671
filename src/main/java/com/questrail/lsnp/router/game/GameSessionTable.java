package com.questrail.lsnp.router.game;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Active game sessions by game id. Completed sessions are removed.
 */
public final class GameSessionTable
{
    private final Map<String, GameSession> sessions = new TreeMap<>();

    public synchronized Optional<GameSession> get(String gameId)
    {
        return Optional.ofNullable(sessions.get(gameId));
    }

    public synchronized boolean contains(String gameId)
    {
        return sessions.containsKey(gameId);
    }

    /**
     * Stores the session, or removes it if it is completed.
     */
    public synchronized void store(GameSession session)
    {
        Objects.requireNonNull(session, "session");
        if (session.isCompleted()) {
            sessions.remove(session.gameId());
        } else {
            sessions.put(session.gameId(), session);
        }
    }

    public synchronized Optional<GameSession> remove(String gameId)
    {
        return Optional.ofNullable(sessions.remove(gameId));
    }

    public synchronized List<GameSession> all()
    {
        return List.copyOf(sessions.values());
    }
}
