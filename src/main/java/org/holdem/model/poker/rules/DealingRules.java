package org.holdem.model.poker.rules;

import org.holdem.model.poker.PlayerStatus;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.Seat;
import org.holdem.model.poker.TablePhase;

import java.util.function.Predicate;

/**
 * Button, blinds and dealing. Cards go out one at a time clockwise starting
 * left of the dealer; no burn cards.
 */
public final class DealingRules {
    private DealingRules(){}

    private static final Predicate<Seat> DEALT_IN = s -> s.getStatus() == PlayerStatus.ACTIVE;

    /** Seats that would be dealt into a hand starting now. */
    public static long eligibleCount(PokerTable t) {
        return t.occupied()
                .filter(s -> s.getStack() > 0 && s.isConnected() && !s.isLeaving())
                .count();
    }

    public static void moveButton(PokerTable t) {
        int dealer = t.nextSeat(t.getDealerIndex(), DEALT_IN);
        if (dealer < 0) throw new IllegalStateException("Nobody to deal to");
        t.setDealerIndex(dealer);
    }

    /**
     * Posts both blinds and opens pre-flop betting. Heads-up the dealer posts
     * the small blind. A blind larger than the stack puts the seat all-in.
     */
    public static void postBlinds(PokerTable t) {
        int dealer = t.getDealerIndex();
        boolean headsUp = t.occupied().filter(DEALT_IN).count() == 2;
        int sb = headsUp ? dealer : t.nextSeat(dealer, DEALT_IN);
        int bb = t.nextSeat(sb, DEALT_IN);
        t.setSmallBlindIndex(sb);
        t.setBigBlindIndex(bb);

        post(t.seatAt(sb), t.getSmallBlind());
        post(t.seatAt(bb), t.getBigBlind());
        t.setBetToCall(t.getBigBlind());
        t.setMinRaise(t.getBigBlind());
    }

    private static void post(Seat s, long blind) {
        s.commit(Math.min(blind, s.getStack()));
    }

    public static void dealHoleCards(PokerTable t) {
        for (int round = 0; round < 2; round++) {
            int i = t.getDealerIndex();
            for (int k = 0; k < t.getMaxSeats(); k++) {
                i = Math.floorMod(i + 1, t.getMaxSeats());
                Seat s = t.seatAt(i);
                if (s != null && s.getStatus().isInHand()) s.getHoleCards().add(t.getDeck().draw());
            }
        }
    }

    /** Deals the community cards for the street being entered. */
    public static void dealStreet(PokerTable t, TablePhase street) {
        for (int i = 0; i < street.cardsOnEntry(); i++) t.getCommunityCards().add(t.getDeck().draw());
    }

    /**
     * Seat the action starts after: the big blind pre-flop (heads-up the
     * dealer then acts first), the dealer on later streets.
     */
    public static int actionStartsAfter(PokerTable t) {
        return t.getPhase() == TablePhase.PRE_FLOP ? t.getBigBlindIndex() : t.getDealerIndex();
    }
}
