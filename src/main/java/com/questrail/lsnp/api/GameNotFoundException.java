package com.questrail.lsnp.api;

/**
 * Raised when a move references a game id with no active session, including
 * sessions that already completed and were purged.
 */
public final class GameNotFoundException extends LsnpException
{
    private final String gameId;

    public GameNotFoundException(String gameId) {
        super("No active game: " + gameId);
        this.gameId = gameId;
    }

    public String gameId() {
        return gameId;
    }
}
