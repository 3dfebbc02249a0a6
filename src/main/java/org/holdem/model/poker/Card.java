package org.holdem.model.poker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable playing card. Ordering (rank, then suit) is for display only,
 * hand strength comes from {@link org.holdem.model.poker.rules.HandEvaluator}.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor
public final class Card implements Comparable<Card> {
    private final Rank rank;
    private final Suit suit;

    public int value() { return rank.getValue(); }

    @Override
    public int compareTo(Card o) {
        int c = Integer.compare(rank.getValue(), o.rank.getValue());
        return c != 0 ? c : suit.compareTo(o.suit);
    }

    @JsonValue
    @Override
    public String toString() { return "" + rank.getSymbol() + suit.getSymbol(); }

    /** "As", "Td", "2c"... */
    @JsonCreator
    public static Card of(String text) {
        if (text == null || text.length() != 2) throw new IllegalArgumentException("Invalid card: " + text);
        return new Card(Rank.fromSymbol(text.charAt(0)), Suit.fromSymbol(text.charAt(1)));
    }

    /** "As Kd 7h" -> three cards. */
    public static List<Card> parse(String cards) {
        List<Card> out = new ArrayList<>();
        for (String s : cards.trim().split("\\s+")) {
            if (!s.isEmpty()) out.add(of(s));
        }
        return out;
    }

    @Getter
    @AllArgsConstructor
    public enum Suit {
        CLUBS('c'), DIAMONDS('d'), HEARTS('h'), SPADES('s');

        private final char symbol;

        public static Suit fromSymbol(char c) {
            for (Suit s : values()) if (s.symbol == Character.toLowerCase(c)) return s;
            throw new IllegalArgumentException("Invalid suit: " + c);
        }
    }

    @Getter
    @AllArgsConstructor
    public enum Rank {
        TWO(2, '2'), THREE(3, '3'), FOUR(4, '4'), FIVE(5, '5'), SIX(6, '6'),
        SEVEN(7, '7'), EIGHT(8, '8'), NINE(9, '9'), TEN(10, 'T'),
        JACK(11, 'J'), QUEEN(12, 'Q'), KING(13, 'K'), ACE(14, 'A');

        private final int value;
        private final char symbol;

        public static Rank fromSymbol(char c) {
            char u = Character.toUpperCase(c);
            for (Rank r : values()) if (r.symbol == u) return r;
            throw new IllegalArgumentException("Invalid rank: " + c);
        }
    }
}
