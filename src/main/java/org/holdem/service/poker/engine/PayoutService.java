package org.holdem.service.poker.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.common.InvariantViolationException;
import org.holdem.events.HandCompleted;
import org.holdem.model.poker.*;
import org.holdem.model.poker.rules.HandEvaluator;
import org.holdem.model.poker.rules.HandRank;
import org.holdem.model.poker.rules.PotRules;
import org.holdem.service.poker.util.Payloads;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutService {
    private final ApplicationEventPublisher events;
    private final Payloads payloads;

    /**
     * Pays every pot layer to its best eligible hand and zeroes the
     * contributions. Chips are conserved or the table halts.
     */
    public List<Award> distribute(PokerTable t) {
        List<PotLayer> pots = PotRules.layers(t.getSeats());
        t.setPots(pots);
        PotRules.verify(t);

        List<Seat> live = t.inHand();
        if (live.isEmpty()) throw new InvariantViolationException("Pot with no player left in the hand");

        Map<String, HandRank> ranks = new HashMap<>();
        if (live.size() > 1) {
            for (Seat s : live) ranks.put(s.getPlayerId(), HandEvaluator.evaluate(s.getHoleCards(), t.getCommunityCards()));
        }

        List<Award> awards = new ArrayList<>();
        for (int i = 0; i < pots.size(); i++) {
            PotLayer pot = pots.get(i);
            List<Seat> winners = winners(t, pot, ranks);
            long[] shares = PotRules.split(pot.amount(), winners.size());
            for (int w = 0; w < winners.size(); w++) {
                Seat s = winners.get(w);
                s.setStack(s.getStack() + shares[w]);
                HandRank r = ranks.get(s.getPlayerId());
                awards.add(new Award(s.getPlayerId(), s.getPosition(), i, shares[w], r == null ? null : r.describe()));
            }
        }

        t.occupied().forEach(s -> {
            s.setHandContribution(0);
            s.setRoundContribution(0);
        });
        t.setPots(new ArrayList<>());
        t.setLastAwards(awards);

        if (t.chipsInPlay() != t.getChipsAtHandStart()) {
            throw new InvariantViolationException("Chip conservation broken: " + t.chipsInPlay()
                    + " after payout, " + t.getChipsAtHandStart() + " at hand start");
        }
        log.info("table={} hand #{} paid {}", t.getId(), t.getHandNumber(), awards);
        return awards;
    }

    /** Seats sharing the pot, in payout order (left of the dealer first). */
    private List<Seat> winners(PokerTable t, PotLayer pot, Map<String, HandRank> ranks) {
        List<Seat> eligible = pot.eligiblePlayerIds().stream()
                .map(id -> t.seatOf(id).orElseThrow(() -> new InvariantViolationException("Eligible player gone: " + id)))
                .filter(s -> s.getStatus().isInHand())
                .toList();
        if (eligible.isEmpty()) throw new InvariantViolationException("Pot without eligible player: " + pot);
        if (ranks.isEmpty()) return eligible;

        HandRank best = eligible.stream().map(s -> ranks.get(s.getPlayerId())).max(Comparator.naturalOrder()).orElseThrow();
        List<Seat> tied = eligible.stream().filter(s -> ranks.get(s.getPlayerId()).equals(best)).toList();
        return PotRules.payOrder(t, tied);
    }

    public void publishCompleted(PokerTable t) {
        Map<String, List<Card>> hole = new LinkedHashMap<>();
        t.occupied().filter(s -> !s.getHoleCards().isEmpty())
                .forEach(s -> hole.put(s.getPlayerId(), List.copyOf(s.getHoleCards())));
        events.publishEvent(new HandCompleted(
                t.getId(),
                t.getHandId(),
                t.getHandNumber(),
                payloads.snapshot(t),
                List.copyOf(t.getActionLog()),
                List.copyOf(t.getLastAwards()),
                hole,
                Instant.now()));
    }
}
