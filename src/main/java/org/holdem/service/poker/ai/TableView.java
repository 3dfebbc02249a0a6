package org.holdem.service.poker.ai;

import org.holdem.dto.poker.TableSnapshot;
import org.holdem.model.poker.Card;

import java.util.List;

/** What a bot may look at: the public table plus its own cards. */
public record TableView(TableSnapshot table, int seat, String playerId, List<Card> holeCards) {
}
