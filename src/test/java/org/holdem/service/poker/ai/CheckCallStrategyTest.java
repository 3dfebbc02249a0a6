package org.holdem.service.poker.ai;

import org.holdem.model.poker.ActionType;
import org.holdem.model.poker.LegalActions;
import org.holdem.model.poker.PlayerAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CheckCallStrategyTest {

    CheckCallStrategy strategy = new CheckCallStrategy();
    TableView view = new TableView(null, 0, "bot-1", List.of());

    private LegalActions legal(ActionType... types) {
        return new LegalActions(List.of(types), 0, 0, 0, 0);
    }

    @Test
    void decide_checksWhenFree() {
        assertThat(strategy.decide(view, legal(ActionType.FOLD, ActionType.CHECK, ActionType.BET)))
                .isEqualTo(PlayerAction.check("bot-1"));
    }

    @Test
    void decide_callsFacingBet() {
        assertThat(strategy.decide(view, legal(ActionType.FOLD, ActionType.CALL, ActionType.RAISE)))
                .isEqualTo(PlayerAction.call("bot-1"));
    }

    @Test
    void decide_neverRaises() {
        PlayerAction a = strategy.decide(view, legal(ActionType.FOLD, ActionType.CALL, ActionType.RAISE, ActionType.ALL_IN));
        assertThat(a.type()).isNotIn(ActionType.RAISE, ActionType.BET);
    }

    @Test
    void decide_nothingElse_folds() {
        assertThat(strategy.decide(view, legal(ActionType.FOLD)).type()).isEqualTo(ActionType.FOLD);
    }
}
