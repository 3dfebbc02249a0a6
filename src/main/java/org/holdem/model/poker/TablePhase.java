package org.holdem.model.poker;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Phases of a table. The hand cycle is a transition table rather than a call
 * chain: PAYOUT always loops back through WAITING_FOR_PLAYERS, and the next
 * hand starts from there as a task of its own.
 */
public enum TablePhase {
    WAITING_FOR_PLAYERS(0),
    PRE_FLOP(0),
    FLOP(3),
    TURN(1),
    RIVER(1),
    SHOWDOWN(0),
    PAYOUT(0);

    private static final Map<TablePhase, Set<TablePhase>> TRANSITIONS = new EnumMap<>(TablePhase.class);
    static {
        TRANSITIONS.put(WAITING_FOR_PLAYERS, EnumSet.of(PRE_FLOP));
        TRANSITIONS.put(PRE_FLOP, EnumSet.of(FLOP, PAYOUT));
        TRANSITIONS.put(FLOP, EnumSet.of(TURN, PAYOUT));
        TRANSITIONS.put(TURN, EnumSet.of(RIVER, PAYOUT));
        TRANSITIONS.put(RIVER, EnumSet.of(SHOWDOWN, PAYOUT));
        TRANSITIONS.put(SHOWDOWN, EnumSet.of(PAYOUT));
        TRANSITIONS.put(PAYOUT, EnumSet.of(WAITING_FOR_PLAYERS));
    }

    /** Community cards dealt when entering this phase. */
    private final int cardsOnEntry;

    TablePhase(int cardsOnEntry) { this.cardsOnEntry = cardsOnEntry; }

    public int cardsOnEntry() { return cardsOnEntry; }

    public boolean isBetting() {
        return this == PRE_FLOP || this == FLOP || this == TURN || this == RIVER;
    }

    public boolean isHandInProgress() {
        return this != WAITING_FOR_PLAYERS;
    }

    /** Next street after a completed betting round (RIVER -> SHOWDOWN). */
    public TablePhase nextStreet() {
        return switch (this) {
            case PRE_FLOP -> FLOP;
            case FLOP -> TURN;
            case TURN -> RIVER;
            case RIVER -> SHOWDOWN;
            default -> throw new IllegalStateException("No street after " + this);
        };
    }

    public boolean canTransitionTo(TablePhase target) {
        return TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
    }
}
