package com.questrail.lsnp.router.game;

import com.questrail.lsnp.api.InvalidMoveException;
import com.questrail.lsnp.model.UserId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class TicTacToeReducerTest
{
    private static final UserId ALICE = UserId.of("alice", "10.0.0.1");
    private static final UserId BOB = UserId.of("bob", "10.0.0.2");

    private final TicTacToeReducer reducer = new TicTacToeReducer();

    private GameSession fresh() {
        return GameSession.invited("g0", ALICE, Symbol.X, BOB);
    }

    private GameSession play(GameSession s, int... positions) {
        for (int p : positions) {
            s = reducer.apply(s, s.turn(), p).newSession();
        }
        return s;
    }

    @Test
    void invitationStartsWithXToMove() {
        GameSession s = fresh();
        assertEquals(GameState.INVITED, s.state());
        assertEquals(Symbol.X, s.turn());
        assertEquals(ALICE, s.playerX());
        assertEquals(BOB, s.playerO());
    }

    @Test
    void inviterPlayingOIsAssignedO() {
        GameSession s = GameSession.invited("g1", ALICE, Symbol.O, BOB);
        assertEquals(BOB, s.playerX());
        assertEquals(Optional.of(Symbol.O), s.symbolOf(ALICE));
        assertEquals(BOB, s.opponentOf(ALICE));
    }

    @Test
    void legalMoveFlipsTurnAndCountsIt() {
        TicTacToeReducer.Result r = reducer.apply(fresh(), Symbol.X, 5);

        assertFalse(r.completed());
        assertEquals(GameState.IN_PROGRESS, r.newSession().state());
        assertEquals(Symbol.O, r.newSession().turn());
        assertEquals(1, r.newSession().turnNumber());
        assertEquals(Optional.of(Symbol.X), r.newSession().board().at(5));
    }

    @Test
    void wrongTurnIsRejected() {
        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> reducer.apply(fresh(), Symbol.O, 1));
        assertEquals(InvalidMoveException.Reason.WRONG_TURN, e.reason());
    }

    @Test
    void occupiedCellIsRejectedAndSessionUnchanged() {
        GameSession s = play(fresh(), 1);

        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> reducer.apply(s, Symbol.O, 1));
        assertEquals(InvalidMoveException.Reason.CELL_OCCUPIED, e.reason());
        assertEquals("X........", s.board().toString());
        assertEquals(Symbol.O, s.turn());
    }

    @Test
    void outOfRangeIsRejected() {
        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> reducer.apply(fresh(), Symbol.X, 0));
        assertEquals(InvalidMoveException.Reason.POSITION_OUT_OF_RANGE, e.reason());
    }

    @Test
    void winningMoveCompletesTheGame() {
        // X: 1, 2, 3   O: 4, 5
        GameSession s = play(fresh(), 1, 4, 2, 5);
        TicTacToeReducer.Result r = reducer.apply(s, Symbol.X, 3);

        assertTrue(r.completed());
        assertEquals(Optional.of(new GameOutcome.Win(Symbol.X, List.of(1, 2, 3))), r.outcome());
        assertTrue(r.newSession().isCompleted());
        assertEquals(r.outcome(), r.newSession().result());
    }

    @Test
    void ninthMoveWithoutLineIsDraw() {
        // X O X / X O O / O X X
        GameSession s = play(fresh(), 1, 2, 3, 5, 4, 6, 8, 7);
        TicTacToeReducer.Result r = reducer.apply(s, Symbol.X, 9);

        assertEquals(Optional.of(new GameOutcome.Draw()), r.outcome());
    }

    @Test
    void noMoveAfterCompletion() {
        GameSession done = play(fresh(), 1, 4, 2, 5, 3);

        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> reducer.apply(done, Symbol.O, 9));
        assertEquals(InvalidMoveException.Reason.NOT_IN_PROGRESS, e.reason());
    }
}
