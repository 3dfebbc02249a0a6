package org.holdem.dto.poker;

import org.holdem.model.poker.Card;
import org.holdem.model.poker.PlayerStatus;

import java.util.List;

/** A seat as everyone sees it; {@code holeCards} is empty unless shown down. */
public record SeatView(int position,
                       String playerId,
                       String displayName,
                       long stack,
                       long roundContribution,
                       long handContribution,
                       PlayerStatus status,
                       boolean hasActed,
                       boolean connected,
                       boolean ai,
                       String aiStrategy,
                       int cardCount,
                       List<Card> holeCards) {
}
