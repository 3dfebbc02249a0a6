package org.holdem.model.poker;

import org.holdem.common.InvariantViolationException;

import java.security.SecureRandom;
import java.util.*;

/**
 * One 52-card deck, owned by a single table for a single hand.
 * Cards leave the deck monotonically; a new hand gets a new deck.
 */
public class Deck {
    private final Deque<Card> cards = new ArrayDeque<>();

    /** Live play: shuffled with a {@link SecureRandom}. */
    public Deck() {
        this(new SecureRandom());
    }

    /** Seeded shuffle, for test fixtures only. */
    public Deck(Random rnd) {
        List<Card> tmp = fullDeck();
        Collections.shuffle(tmp, rnd);
        cards.addAll(tmp);
    }

    private Deck(List<Card> ordered) {
        cards.addAll(ordered);
    }

    /**
     * Deck whose first cards are exactly {@code top}, in that order, followed by
     * the remaining cards in natural order.
     */
    public static Deck stacked(List<Card> top) {
        Set<Card> seen = new HashSet<>(top);
        if (seen.size() != top.size()) throw new IllegalArgumentException("Duplicate card in stacked deck");
        List<Card> ordered = new ArrayList<>(top);
        for (Card c : fullDeck()) if (!seen.contains(c)) ordered.add(c);
        return new Deck(ordered);
    }

    public Card draw() {
        Card c = cards.pollFirst();
        if (c == null) throw new InvariantViolationException("Deck exhausted");
        return c;
    }

    public int remaining() { return cards.size(); }

    private static List<Card> fullDeck() {
        List<Card> tmp = new ArrayList<>(52);
        for (Card.Suit s : Card.Suit.values()) {
            for (Card.Rank r : Card.Rank.values()) tmp.add(new Card(r, s));
        }
        return tmp;
    }
}
