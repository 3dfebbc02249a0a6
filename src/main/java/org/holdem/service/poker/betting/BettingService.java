package org.holdem.service.poker.betting;

import lombok.extern.slf4j.Slf4j;
import org.holdem.model.poker.*;
import org.holdem.model.poker.rules.BettingRules;
import org.holdem.model.poker.rules.BettingRules.Move;
import org.holdem.model.poker.rules.PotRules;
import org.springframework.stereotype.Service;

/**
 * Applies validated betting actions to a table. Validation happens entirely
 * before the first mutation, so a rejected action leaves the table untouched.
 */
@Slf4j
@Service
public class BettingService {

    public Move apply(PokerTable t, PlayerAction action) {
        Move m = BettingRules.resolve(t, action);
        Seat seat = m.seat();

        if (m.type() == ActionType.FOLD) {
            seat.setStatus(PlayerStatus.FOLDED);
        } else if (m.chips() > 0) {
            seat.commit(m.chips());
        }
        seat.setHasActed(true);

        if (m.newTotal() > t.getBetToCall()) raise(t, seat, m);

        t.setPots(PotRules.layers(t.getSeats()));
        t.getActionLog().add(new ActionLogEntry(t.getVersion() + 1, t.getPhase(), seat.getPlayerId(),
                m.type(), m.chips(), action.synthetic(), System.currentTimeMillis()));
        log.debug("table={} seat={} {} {} -> betToCall={} pot={}", t.getId(), seat.getPosition(), m.type(),
                m.chips(), t.getBetToCall(), t.potTotal());
        return m;
    }

    /** Forced fold of a seat that is not the actor (left the table mid-hand). */
    public void foldOutOfTurn(PokerTable t, Seat seat) {
        seat.setStatus(PlayerStatus.FOLDED);
        t.setPots(PotRules.layers(t.getSeats()));
        t.getActionLog().add(new ActionLogEntry(t.getVersion() + 1, t.getPhase(), seat.getPlayerId(),
                ActionType.FOLD, 0, true, System.currentTimeMillis()));
    }

    private void raise(PokerTable t, Seat raiser, Move m) {
        long size = m.newTotal() - t.getBetToCall();
        if (m.kind() == BettingRules.Kind.FULL_RAISE) {
            t.setMinRaise(Math.max(size, t.getBigBlind()));
            t.occupied().filter(s -> s != raiser).forEach(s -> {
                s.setHasActed(false);
                s.setRaiseLocked(false);
            });
        } else {
            // short all-in: seats that already acted may only call or fold
            t.occupied().filter(s -> s != raiser).forEach(s -> {
                if (s.isHasActed()) s.setRaiseLocked(true);
                s.setHasActed(false);
            });
        }
        t.setBetToCall(m.newTotal());
    }
}
