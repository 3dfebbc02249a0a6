package org.holdem.model.poker.rules;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Totally ordered strength of a best-five hand, packed in one int:
 * {@code category << 20 | k1 << 16 | k2 << 12 | k3 << 8 | k4 << 4 | k5}.
 * Two hands tie exactly when their values are equal.
 */
public final class HandRank implements Comparable<HandRank> {
    private final int value;

    public HandRank(int value) { this.value = value; }

    static int pack(HandCategory category, int... kickers) {
        int v = category.ordinal();
        for (int i = 0; i < 5; i++) {
            v = (v << 4) | (i < kickers.length ? kickers[i] : 0);
        }
        return v;
    }

    @JsonValue
    public int value() { return value; }

    public HandCategory category() { return HandCategory.values()[value >>> 20]; }

    /** Tie-break ranks (2..14) in significance order, zeros trimmed. */
    public List<Integer> kickers() {
        List<Integer> out = new ArrayList<>(5);
        for (int shift = 16; shift >= 0; shift -= 4) {
            int k = (value >>> shift) & 0xF;
            if (k != 0) out.add(k);
        }
        return out;
    }

    public String describe() {
        List<Integer> k = kickers();
        return switch (category()) {
            case HIGH_CARD -> name(k.get(0)) + " high";
            case ONE_PAIR -> "Pair of " + plural(k.get(0));
            case TWO_PAIR -> "Two Pair, " + plural(k.get(0)) + " and " + plural(k.get(1));
            case THREE_OF_A_KIND -> "Three " + plural(k.get(0));
            case STRAIGHT -> "Straight, " + name(k.get(0)) + " high";
            case FLUSH -> "Flush, " + name(k.get(0)) + " high";
            case FULL_HOUSE -> "Full House, " + plural(k.get(0)) + " over " + plural(k.get(1));
            case FOUR_OF_A_KIND -> "Four " + plural(k.get(0));
            case STRAIGHT_FLUSH -> k.get(0) == 14 ? "Royal Flush" : "Straight Flush, " + name(k.get(0)) + " high";
        };
    }

    private static final String[] NAMES = {"", "", "Two", "Three", "Four", "Five", "Six", "Seven",
            "Eight", "Nine", "Ten", "Jack", "Queen", "King", "Ace"};

    private static String name(int rank) { return NAMES[rank]; }

    private static String plural(int rank) { return rank == 6 ? "Sixes" : NAMES[rank] + "s"; }

    @Override
    public int compareTo(HandRank o) { return Integer.compare(value, o.value); }

    @Override
    public boolean equals(Object o) { return o instanceof HandRank h && h.value == value; }

    @Override
    public int hashCode() { return value; }

    @Override
    public String toString() { return category() + kickers().toString(); }
}
