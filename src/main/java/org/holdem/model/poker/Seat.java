package org.holdem.model.poker;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Seat {
    private int position;
    private String playerId;
    private String displayName;
    private long stack;
    private final List<Card> holeCards = new ArrayList<>();
    private long roundContribution;
    private long handContribution;
    private PlayerStatus status = PlayerStatus.SITTING_OUT;
    private boolean hasActed;
    // short all-in did not re-open the betting for this seat
    private boolean raiseLocked;
    private boolean connected = true;
    private String aiStrategy;
    // left mid-hand, removed once the hand is paid out
    private boolean leaving;

    public Seat(int position, String playerId, String displayName, long stack) {
        this.position = position;
        this.playerId = playerId;
        this.displayName = displayName;
        this.stack = stack;
    }

    public boolean isAi() { return aiStrategy != null; }

    /** Holds cards and still has chips to wager. */
    public boolean canAct() { return status == PlayerStatus.ACTIVE && stack > 0; }

    /** Moves chips from the stack into the pot contributions. */
    public void commit(long amount) {
        stack -= amount;
        roundContribution += amount;
        handContribution += amount;
        if (stack == 0 && status == PlayerStatus.ACTIVE) status = PlayerStatus.ALL_IN;
    }

    public void resetForRound() {
        roundContribution = 0;
        hasActed = false;
        raiseLocked = false;
    }

    public void resetForNextHand() {
        holeCards.clear();
        roundContribution = 0;
        handContribution = 0;
        hasActed = false;
        raiseLocked = false;
        if (!connected) status = PlayerStatus.DISCONNECTED;
        else status = stack > 0 ? PlayerStatus.ACTIVE : PlayerStatus.SITTING_OUT;
    }
}
