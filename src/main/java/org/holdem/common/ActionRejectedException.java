package org.holdem.common;

import lombok.Getter;

/**
 * A player action that failed validation. Nothing was mutated and the table
 * version did not move; the error goes back to the originating session only.
 */
@Getter
public class ActionRejectedException extends IllegalStateException {

    public enum Reason {
        WRONG_PHASE,
        NOT_SEATED,
        OUT_OF_TURN,
        ILLEGAL_ACTION,
        INVALID_AMOUNT,
        INSUFFICIENT_STACK,
        TABLE_HALTED
    }

    private final Reason reason;

    public ActionRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
