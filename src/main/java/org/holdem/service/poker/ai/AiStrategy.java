package org.holdem.service.poker.ai;

import org.holdem.model.poker.LegalActions;
import org.holdem.model.poker.PlayerAction;

/**
 * Decision maker for a bot seat. Implementations are Spring beans; the bean
 * name is the strategy name stored on the seat. The returned action goes
 * through the same validation as a human's.
 */
public interface AiStrategy {
    PlayerAction decide(TableView view, LegalActions legal);
}
