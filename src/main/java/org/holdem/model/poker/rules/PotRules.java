package org.holdem.model.poker.rules;

import org.holdem.common.InvariantViolationException;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.PotLayer;
import org.holdem.model.poker.Seat;

import java.util.*;

public final class PotRules {
    private PotRules(){}

    /**
     * Splits the hand contributions into the main pot (index 0) and side pots.
     * Every distinct contribution level bounds a layer; folded chips stay in
     * the layers but folded players are never eligible. Layers with the same
     * eligible set are merged, a layer nobody can win joins the one below.
     */
    public static List<PotLayer> layers(Collection<Seat> seats) {
        List<Seat> ordered = seats.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(Seat::getPosition))
                .toList();
        long[] levels = ordered.stream()
                .mapToLong(Seat::getHandContribution)
                .filter(c -> c > 0)
                .distinct()
                .sorted()
                .toArray();

        List<PotLayer> out = new ArrayList<>();
        long prev = 0, carry = 0;
        for (long level : levels) {
            long amount = carry;
            List<String> eligible = new ArrayList<>();
            for (Seat s : ordered) {
                long c = s.getHandContribution();
                amount += Math.min(c, level) - Math.min(c, prev);
                if (c >= level && s.getStatus().isInHand()) eligible.add(s.getPlayerId());
            }
            carry = 0;
            PotLayer last = out.isEmpty() ? null : out.get(out.size() - 1);
            if (eligible.isEmpty()) {
                if (last == null) carry = amount;
                else out.set(out.size() - 1, new PotLayer(last.amount() + amount, last.cap(), last.eligiblePlayerIds()));
            } else if (last != null && last.eligiblePlayerIds().equals(eligible)) {
                out.set(out.size() - 1, new PotLayer(last.amount() + amount, level, eligible));
            } else {
                out.add(new PotLayer(amount, level, eligible));
            }
            prev = level;
        }
        if (carry > 0) throw new InvariantViolationException("Pot of " + carry + " has no eligible player");
        return out;
    }

    /** Checks the pot against the contributions it was built from. */
    public static void verify(PokerTable t) {
        long contributed = t.occupied().mapToLong(Seat::getHandContribution).sum();
        long inPots = 0;
        for (PotLayer p : t.getPots()) {
            if (p.amount() < 0) throw new InvariantViolationException("Negative pot " + p);
            inPots += p.amount();
        }
        if (inPots != contributed)
            throw new InvariantViolationException("Pots hold " + inPots + " but players contributed " + contributed);
        t.occupied().forEach(s -> {
            if (s.getStack() < 0) throw new InvariantViolationException("Negative stack for " + s.getPlayerId());
        });
        if (t.chipsInPlay() != t.getChipsAtHandStart())
            throw new InvariantViolationException("Chips in play " + t.chipsInPlay() + " != " + t.getChipsAtHandStart());
    }

    /**
     * Seats in payout order: clockwise starting left of the dealer. Leftover
     * units of a split pot go one by one in this order.
     */
    public static List<Seat> payOrder(PokerTable t, Collection<Seat> seats) {
        int n = t.getMaxSeats();
        int dealer = t.getDealerIndex();
        return seats.stream()
                .sorted(Comparator.comparingInt(s -> Math.floorMod(s.getPosition() - dealer - 1, n)))
                .toList();
    }

    /** Even split; the first {@code amount % n} winners get one more unit. */
    public static long[] split(long amount, int winners) {
        long[] out = new long[winners];
        long share = amount / winners;
        long remainder = amount % winners;
        for (int i = 0; i < winners; i++) out[i] = share + (i < remainder ? 1 : 0);
        return out;
    }
}
