package org.holdem.service.poker.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.common.InvariantViolationException;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.Seat;
import org.holdem.service.poker.sync.DeltaRecorder;
import org.holdem.service.poker.util.Payloads;
import org.holdem.service.poker.util.Timeouts;
import org.springframework.stereotype.Component;

/**
 * Stops a table whose state broke an invariant. Other tables keep running.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableHalter {
    private final Timeouts timeouts;
    private final DeltaRecorder deltas;
    private final Payloads payloads;
    private final ObjectMapper mapper;

    public void halt(PokerTable t, InvariantViolationException cause) {
        timeouts.cancelAllOf(t.getId());
        log.error("Halting table {}: {}\nstate={}", t.getId(), cause.getMessage(), dump(t), cause);
        t.setHalted(true);
        t.setCurrentActorIndex(null);
        t.setTurnDeadlineEpochMs(0);
        t.setTurnToken(t.getTurnToken() + 1);
        deltas.commit(t, "TABLE_HALTED");
    }

    /** Everything, hole cards and deck included. */
    String dump(PokerTable t) {
        ObjectNode root = mapper.valueToTree(payloads.snapshot(t));
        ObjectNode hidden = root.putObject("hidden");
        for (Seat s : t.getSeats()) {
            if (s != null) hidden.put(s.getPlayerId(), s.getHoleCards().toString());
        }
        hidden.put("deckRemaining", t.getDeck() == null ? 0 : t.getDeck().remaining());
        hidden.put("chipsAtHandStart", t.getChipsAtHandStart());
        hidden.put("chipsInPlay", t.chipsInPlay());
        return root.toString();
    }
}
