package org.holdem.service.poker.ai;

import org.holdem.model.poker.ActionType;
import org.holdem.model.poker.LegalActions;
import org.holdem.model.poker.PlayerAction;
import org.springframework.stereotype.Component;

/** Never bets, never folds when it can check or call. */
@Component(CheckCallStrategy.NAME)
public class CheckCallStrategy implements AiStrategy {
    public static final String NAME = "check-call";

    @Override
    public PlayerAction decide(TableView view, LegalActions legal) {
        String me = view.playerId();
        if (legal.allows(ActionType.CHECK)) return PlayerAction.check(me);
        if (legal.allows(ActionType.CALL)) return PlayerAction.call(me);
        if (legal.allows(ActionType.ALL_IN)) return PlayerAction.allIn(me);
        return PlayerAction.fold(me);
    }
}
