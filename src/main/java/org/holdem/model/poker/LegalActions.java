package org.holdem.model.poker;

import java.util.List;

/**
 * What the current actor may do right now. Amount bounds follow the
 * {@link PlayerAction} conventions (bet size, raise-to total).
 */
public record LegalActions(List<ActionType> types,
                           long callAmount,
                           long minBet,
                           long minRaiseTo,
                           long maxRaiseTo) {

    public static final LegalActions NONE = new LegalActions(List.of(), 0, 0, 0, 0);

    public boolean allows(ActionType type) { return types.contains(type); }
}
