package org.holdem.service.poker.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.common.InvariantViolationException;
import org.holdem.config.PokerSettings;
import org.holdem.model.poker.*;
import org.holdem.model.poker.rules.BettingRules;
import org.holdem.model.poker.rules.BettingRules.Move;
import org.holdem.model.poker.rules.DealingRules;
import org.holdem.model.poker.rules.PotRules;
import org.holdem.service.poker.betting.BettingService;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.sync.DeltaRecorder;
import org.holdem.service.poker.sync.TableWorkers;
import org.holdem.service.poker.util.Timeouts;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Objects;
import java.util.UUID;

/**
 * Drives a table through the hand cycle. Every method runs on the table's
 * worker; timers only enqueue work. Each phase transition commits exactly one
 * delta, and a task that ends a hand walks SHOWDOWN, PAYOUT and back to
 * WAITING_FOR_PLAYERS in one go.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HandEngine {
    static final String TURN_TIMER = "turn";
    static final String NEXT_HAND_TIMER = "next-hand";

    private final BettingService betting;
    private final PayoutService payouts;
    private final DeltaRecorder deltas;
    private final DeckFactory decks;
    private final Timeouts timeouts;
    private final TableWorkers workers;
    private final TableRegistry registry;
    private final PokerSettings settings;

    /** Starts a hand when the table is idle and at least two seats can play. */
    public boolean startHandIfReady(PokerTable t) {
        if (t.isHalted() || t.isClosed() || t.isPendingClose()) return false;
        if (t.getPhase() != TablePhase.WAITING_FOR_PLAYERS) return false;
        if (DealingRules.eligibleCount(t) < 2) return false;
        startHand(t);
        return true;
    }

    private void startHand(PokerTable t) {
        timeouts.cancel(t.getId(), NEXT_HAND_TIMER);
        transition(t, TablePhase.PRE_FLOP);
        t.occupied().forEach(Seat::resetForNextHand);
        t.getCommunityCards().clear();
        t.getActionLog().clear();
        t.setLastAwards(new ArrayList<>());
        t.setShowdownReached(false);
        t.setHandNumber(t.getHandNumber() + 1);
        t.setHandId(UUID.randomUUID().toString());
        t.setDeck(decks.newDeck());

        DealingRules.moveButton(t);
        DealingRules.postBlinds(t);
        DealingRules.dealHoleCards(t);
        t.setChipsAtHandStart(t.chipsInPlay());
        t.setPots(PotRules.layers(t.getSeats()));
        t.setLastActiveAt(Instant.now());
        t.occupied()
                .filter(s -> !s.getHoleCards().isEmpty() && !s.isAi())
                .forEach(s -> t.getPrivateDirty().add(s.getPlayerId()));

        log.info("table={} hand #{} started, dealer={} sb={} bb={}", t.getId(), t.getHandNumber(),
                t.getDealerIndex(), t.getSmallBlindIndex(), t.getBigBlindIndex());
        advance(t, "HAND_STARTED", DealingRules.actionStartsAfter(t));
    }

    /** Applies a player's action; returns the table version once the action is settled. */
    public long onAction(PokerTable t, PlayerAction action) {
        Move m = betting.apply(t, action);
        t.setLastActiveAt(Instant.now());
        advance(t, "ACTION", m.seat().getPosition());
        return t.getVersion();
    }

    /** Turn timer expiry: check when free, fold otherwise. Stale timers do nothing. */
    public void onTurnTimeout(PokerTable t, long turnToken) {
        Seat actor = t.currentActor();
        if (t.isHalted() || !t.getPhase().isBetting() || actor == null || t.getTurnToken() != turnToken) {
            log.warn("table={} stale turn timer {} ignored", t.getId(), turnToken);
            return;
        }
        PlayerAction auto = actor.getRoundContribution() >= t.getBetToCall()
                ? PlayerAction.check(actor.getPlayerId())
                : PlayerAction.fold(actor.getPlayerId());
        log.info("table={} seat={} timed out, auto {}", t.getId(), actor.getPosition(), auto.type());
        onAction(t, auto.asSynthetic());
    }

    /**
     * A seated player goes away. Seats holding cards of the current hand stay
     * until payout so their chips remain accounted for: folded, or still live
     * when already all-in.
     */
    public void playerLeft(PokerTable t, Seat seat) {
        boolean dealtIn = t.getPhase().isHandInProgress() && !seat.getHoleCards().isEmpty();
        if (!dealtIn) {
            removeSeat(t, seat);
            deltas.commit(t, "LEFT");
            return;
        }
        seat.setLeaving(true);
        // an all-in seat keeps its pots through showdown
        if (!seat.getStatus().isInHand() || seat.getStatus() == PlayerStatus.ALL_IN) {
            deltas.commit(t, "LEFT");
            return;
        }
        if (Objects.equals(t.getCurrentActorIndex(), seat.getPosition())) {
            onAction(t, PlayerAction.fold(seat.getPlayerId()).asSynthetic());
            return;
        }
        betting.foldOutOfTurn(t, seat);
        if (t.inHand().size() <= 1 || BettingRules.isRoundComplete(t)) {
            advance(t, "LEFT", seat.getPosition());
        } else {
            deltas.commit(t, "LEFT");
        }
    }

    /** Closes now when idle, after the payout otherwise. */
    public void requestClose(PokerTable t) {
        if (t.isClosed()) return;
        if (t.getPhase().isHandInProgress() && !t.isHalted()) {
            t.setPendingClose(true);
            log.info("table={} will close after hand #{}", t.getId(), t.getHandNumber());
            return;
        }
        close(t);
    }

    // ------------------------------------------------------------------

    private void advance(PokerTable t, String cause, int from) {
        if (t.inHand().size() <= 1) {
            clearActor(t);
            deltas.commit(t, cause);
            payout(t);
            return;
        }
        if (!BettingRules.isRoundComplete(t)) {
            setActor(t, BettingRules.nextToAct(t, from));
            deltas.commit(t, cause);
            return;
        }
        clearActor(t);
        deltas.commit(t, cause);

        // deal streets until someone has a decision to make
        while (true) {
            endRound(t);
            TablePhase next = t.getPhase().nextStreet();
            transition(t, next);
            if (next == TablePhase.SHOWDOWN) {
                showdown(t);
                return;
            }
            DealingRules.dealStreet(t, next);
            if (!BettingRules.isRoundComplete(t)) {
                setActor(t, BettingRules.nextToAct(t, DealingRules.actionStartsAfter(t)));
                deltas.commit(t, next.name());
                return;
            }
            deltas.commit(t, next.name());
        }
    }

    private void endRound(PokerTable t) {
        t.occupied().forEach(Seat::resetForRound);
        t.setBetToCall(0);
        t.setMinRaise(t.getBigBlind());
        t.setPots(PotRules.layers(t.getSeats()));
    }

    private void showdown(PokerTable t) {
        t.setShowdownReached(true);
        deltas.commit(t, "SHOWDOWN");
        payout(t);
    }

    private void payout(PokerTable t) {
        transition(t, TablePhase.PAYOUT);
        payouts.distribute(t);
        deltas.commit(t, "PAYOUT");
        payouts.publishCompleted(t);
        log.info("table={} hand #{} completed, awards={}", t.getId(), t.getHandNumber(), t.getLastAwards().size());

        for (Seat s : new ArrayList<>(t.getSeats())) {
            if (s != null && (s.isLeaving() || s.getStack() == 0)) removeSeat(t, s);
        }
        transition(t, TablePhase.WAITING_FOR_PLAYERS);
        t.setBetToCall(0);
        deltas.commit(t, "WAITING");

        if (t.isPendingClose()) {
            close(t);
            return;
        }
        scheduleNextHand(t);
    }

    private void scheduleNextHand(PokerTable t) {
        if (!t.isAutoContinue() || DealingRules.eligibleCount(t) < 2) return;
        Long id = t.getId();
        long delay = settings.getNextHandDelayMs();
        if (delay <= 0) {
            // through the queue so hands never nest
            workers.execute(id, this::startHandIfReady);
        } else {
            timeouts.schedule(id, NEXT_HAND_TIMER, delay, () -> workers.execute(id, this::startHandIfReady));
        }
    }

    private void close(PokerTable t) {
        timeouts.cancelAllOf(t.getId());
        clearActor(t);
        t.setClosed(true);
        t.occupied().forEach(s -> registry.unbind(s.getPlayerId(), t.getId()));
        deltas.commit(t, "TABLE_CLOSED");
        log.info("table={} closed", t.getId());
    }

    private void removeSeat(PokerTable t, Seat s) {
        t.getSeats().set(s.getPosition(), null);
        registry.unbind(s.getPlayerId(), t.getId());
        timeouts.cancel(t.getId(), graceTimer(s.getPlayerId()));
        log.info("table={} seat {} freed ({})", t.getId(), s.getPosition(), s.getPlayerId());
    }

    private void setActor(PokerTable t, int idx) {
        if (idx < 0) throw new InvariantViolationException("Betting open but no seat can act");
        Long id = t.getId();
        long token = t.getTurnToken() + 1;
        long timeout = settings.getTurnTimeoutMs();
        t.setCurrentActorIndex(idx);
        t.setTurnToken(token);
        t.setTurnDeadlineEpochMs(System.currentTimeMillis() + timeout);
        timeouts.schedule(id, TURN_TIMER, timeout, () -> workers.execute(id, tt -> onTurnTimeout(tt, token)));
        Seat s = t.seatAt(idx);
        if (!s.isAi()) t.getPrivateDirty().add(s.getPlayerId());
    }

    private void clearActor(PokerTable t) {
        if (t.getCurrentActorIndex() != null) t.setTurnToken(t.getTurnToken() + 1);
        t.setCurrentActorIndex(null);
        t.setTurnDeadlineEpochMs(0);
        timeouts.cancel(t.getId(), TURN_TIMER);
    }

    private void transition(PokerTable t, TablePhase next) {
        if (!t.getPhase().canTransitionTo(next)) {
            throw new InvariantViolationException("Illegal transition " + t.getPhase() + " -> " + next);
        }
        t.setPhase(next);
    }

    public static String graceTimer(String playerId) { return "grace:" + playerId; }
}
