package com.questrail.lsnp.router.game;

/**
 * Lifecycle of a game session.
 *
 * <pre>
 *   INVITED ──first move──▶ IN_PROGRESS ──win/draw──▶ COMPLETED
 * </pre>
 *
 * <p>Invitations are accepted implicitly, so {@code INVITED} only means no
 * move has been made yet.</p>
 */
public enum GameState
{
    INVITED,
    IN_PROGRESS,
    COMPLETED
}
