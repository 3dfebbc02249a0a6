package org.holdem.service.poker.engine;

import org.holdem.model.poker.Deck;
import org.springframework.stereotype.Component;

/** Fresh shuffled deck per hand; replaced in tests to fix the deal. */
@Component
public class DeckFactory {
    public Deck newDeck() { return new Deck(); }
}
