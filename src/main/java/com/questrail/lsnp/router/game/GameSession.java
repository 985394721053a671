package com.questrail.lsnp.router.game;

import com.questrail.lsnp.model.UserId;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one tic-tac-toe game as seen by the local node.
 *
 * @param gameId     {@code g0}..{@code g255}
 * @param playerX    user playing X
 * @param playerO    user playing O
 * @param board      current board
 * @param turn       symbol expected to move next
 * @param turnNumber number of moves made so far
 * @param state      lifecycle state
 * @param outcome    set once {@code state} is {@link GameState#COMPLETED}, otherwise {@code null}
 */
public record GameSession(String gameId,
                          UserId playerX,
                          UserId playerO,
                          TicTacToeBoard board,
                          Symbol turn,
                          int turnNumber,
                          GameState state,
                          GameOutcome outcome)
{
    public GameSession {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(playerX, "playerX");
        Objects.requireNonNull(playerO, "playerO");
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(turn, "turn");
        Objects.requireNonNull(state, "state");
        if (playerX.equals(playerO)) {
            throw new IllegalArgumentException("A game needs two distinct players");
        }
        if ((state == GameState.COMPLETED) != (outcome != null)) {
            throw new IllegalArgumentException("outcome must be present exactly when COMPLETED");
        }
    }

    /**
     * New session right after the invitation: empty board, X to move.
     */
    public static GameSession invited(String gameId, UserId inviter, Symbol inviterSymbol, UserId invitee) {
        UserId x = inviterSymbol == Symbol.X ? inviter : invitee;
        UserId o = inviterSymbol == Symbol.X ? invitee : inviter;
        return new GameSession(gameId, x, o, TicTacToeBoard.empty(), Symbol.X, 0, GameState.INVITED, null);
    }

    public UserId playerFor(Symbol symbol) {
        return symbol == Symbol.X ? playerX : playerO;
    }

    public Optional<Symbol> symbolOf(UserId user) {
        if (playerX.equals(user)) {
            return Optional.of(Symbol.X);
        }
        if (playerO.equals(user)) {
            return Optional.of(Symbol.O);
        }
        return Optional.empty();
    }

    public boolean isParticipant(UserId user) {
        return symbolOf(user).isPresent();
    }

    /**
     * The other participant.
     *
     * @throws IllegalArgumentException if {@code user} does not play in this game
     */
    public UserId opponentOf(UserId user) {
        Symbol s = symbolOf(user)
                .orElseThrow(() -> new IllegalArgumentException(user + " does not play in " + gameId));
        return playerFor(s.opponent());
    }

    public boolean isCompleted() {
        return state == GameState.COMPLETED;
    }

    public Optional<GameOutcome> result() {
        return Optional.ofNullable(outcome);
    }

    GameSession after(TicTacToeBoard nextBoard, Symbol nextTurn, GameOutcome nextOutcome) {
        GameState nextState = nextOutcome != null ? GameState.COMPLETED : GameState.IN_PROGRESS;
        return new GameSession(gameId, playerX, playerO, nextBoard, nextTurn, turnNumber + 1, nextState, nextOutcome);
    }

    /**
     * Same session marked completed with an outcome reported by the peer.
     */
    public GameSession completedWith(GameOutcome reported) {
        return new GameSession(gameId, playerX, playerO, board, turn, turnNumber, GameState.COMPLETED,
                Objects.requireNonNull(reported, "reported"));
    }
}
