package org.holdem.model.poker;

public enum PlayerStatus {
    ACTIVE,
    FOLDED,
    ALL_IN,
    SITTING_OUT,
    DISCONNECTED;

    /** Still holding cards in the current hand. */
    public boolean isInHand() { return this == ACTIVE || this == ALL_IN; }
}
