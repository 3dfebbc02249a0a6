package org.holdem.events;

import org.holdem.dto.poker.TableSnapshot;
import org.holdem.model.poker.ActionLogEntry;
import org.holdem.model.poker.Award;
import org.holdem.model.poker.Card;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Published once per finished hand. Immutable copy, safe to hand to another
 * thread.
 */
public record HandCompleted(Long tableId,
                            String handId,
                            long handNumber,
                            TableSnapshot finalState,
                            List<ActionLogEntry> actionLog,
                            List<Award> awards,
                            Map<String, List<Card>> holeCards,
                            Instant completedAt) {
}
