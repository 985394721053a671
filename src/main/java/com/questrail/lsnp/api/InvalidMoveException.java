package com.questrail.lsnp.api;

/**
 * Raised when a tic-tac-toe move violates a precondition of the game session.
 * The session is left untouched.
 */
public final class InvalidMoveException extends LsnpException
{
    /**
     * Why the move was refused.
     */
    public enum Reason {
        NOT_IN_PROGRESS,
        WRONG_TURN,
        NOT_A_PARTICIPANT,
        POSITION_OUT_OF_RANGE,
        CELL_OCCUPIED
    }

    private final Reason reason;

    public InvalidMoveException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
