package com.questrail.lsnp.router.game;

import com.questrail.lsnp.api.InvalidMoveException;
import com.questrail.lsnp.api.InvalidMoveException.Reason;

import java.util.Objects;
import java.util.Optional;

/**
 * TicTacToeReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic move engine for a {@link GameSession}.
 *
 * <p>Given a session and a move, the reducer either returns the next session
 * or throws {@link InvalidMoveException} and leaves nothing changed. It does no
 * I/O and knows nothing about the wire; sending the move and the result is the
 * caller's job.</p>
 *
 * <p>Checks, in order: game not completed, symbol matches the turn, position
 * in 1..9, cell free.</p>
 */
public final class TicTacToeReducer
{
    /**
     * Result of applying a move.
     *
     * @param newSession the session after the move
     * @param outcome    present if the move ended the game
     */
    public record Result(GameSession newSession, Optional<GameOutcome> outcome)
    {
        public boolean completed() {
            return outcome.isPresent();
        }
    }

    public Result apply(GameSession session, Symbol symbol, int position)
    {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(symbol, "symbol");

        if (session.isCompleted()) {
            throw new InvalidMoveException(Reason.NOT_IN_PROGRESS,
                    "Game " + session.gameId() + " is already completed");
        }
        if (symbol != session.turn()) {
            throw new InvalidMoveException(Reason.WRONG_TURN,
                    "It is " + session.turn() + "'s turn in " + session.gameId());
        }
        if (!TicTacToeBoard.inRange(position)) {
            throw new InvalidMoveException(Reason.POSITION_OUT_OF_RANGE,
                    "Position must be 1..9, got " + position);
        }
        if (!session.board().isFree(position)) {
            throw new InvalidMoveException(Reason.CELL_OCCUPIED,
                    "Cell " + position + " is already taken in " + session.gameId());
        }

        TicTacToeBoard board = session.board().place(position, symbol);
        Optional<GameOutcome> outcome = board.evaluate();
        GameSession next = session.after(board, symbol.opponent(), outcome.orElse(null));
        return new Result(next, outcome);
    }
}
