package org.holdem.dto.poker;

import org.holdem.model.poker.Card;
import org.holdem.model.poker.LegalActions;

import java.util.List;

/** Snapshot plus what only the viewer may see. */
public record PlayerView(TableSnapshot table,
                         String playerId,
                         Integer seat,
                         List<Card> holeCards,
                         LegalActions legal) {
}
