package org.holdem.service.poker.entry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.common.ActionRejectedException;
import org.holdem.common.ActionRejectedException.Reason;
import org.holdem.common.TableFullException;
import org.holdem.config.PokerSettings;
import org.holdem.model.poker.PlayerStatus;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.Seat;
import org.holdem.service.poker.engine.HandEngine;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.sync.DeltaRecorder;
import org.holdem.service.poker.sync.TableWorkers;
import org.holdem.service.poker.util.Timeouts;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Seating, leaving and connection tracking. Runs on the table's worker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryService {
    private final TableRegistry registry;
    private final HandEngine engine;
    private final DeltaRecorder deltas;
    private final Timeouts timeouts;
    private final TableWorkers workers;
    private final PokerSettings settings;

    /**
     * Seats the player at the first free position. Sitting again at the same
     * table is a no-op (or a reconnect when the seat was disconnected).
     */
    public Seat sit(PokerTable t, String playerId, String displayName, long buyIn, String aiStrategy) {
        if (t.isHalted()) throw new ActionRejectedException(Reason.TABLE_HALTED, "Table is halted");
        if (t.isClosed() || t.isPendingClose()) throw new IllegalStateException("Table is closing");
        if (playerId == null || playerId.isBlank()) throw new IllegalArgumentException("Missing player id");

        Seat existing = t.seatOf(playerId).orElse(null);
        if (existing != null) {
            if (!existing.isConnected()) reconnect(t, existing);
            return existing;
        }
        if (buyIn < t.getMinBuyIn() || buyIn > t.getMaxBuyIn()) {
            throw new IllegalArgumentException("Buy-in must be between " + t.getMinBuyIn() + " and " + t.getMaxBuyIn());
        }
        int position = t.firstEmpty().orElseThrow(() -> new TableFullException(t.getId()));
        if (!registry.bind(playerId, t.getId())) {
            throw new IllegalStateException("Already seated at another table");
        }

        String name = displayName == null || displayName.isBlank() ? playerId : displayName.trim();
        if (name.length() > 20) name = name.substring(0, 20);
        Seat seat = new Seat(position, playerId, name, buyIn);
        seat.setAiStrategy(aiStrategy);
        t.getSeats().set(position, seat);
        t.setLastActiveAt(Instant.now());
        log.info("table={} {} sits at seat {} with {}", t.getId(), playerId, position, buyIn);

        deltas.commit(t, "SEATED");
        if (t.isAutoContinue()) engine.startHandIfReady(t);
        return seat;
    }

    public void leave(PokerTable t, String playerId) {
        Seat seat = t.seatOf(playerId).orElseThrow(() -> new IllegalArgumentException("Not seated at this table"));
        if (seat.isLeaving()) return;
        log.info("table={} {} leaves seat {}", t.getId(), playerId, seat.getPosition());
        t.setLastActiveAt(Instant.now());
        engine.playerLeft(t, seat);
    }

    /** Connection dropped: keep the seat for the grace period, turn timers keep acting for it. */
    public void markDisconnected(PokerTable t, String playerId) {
        Seat seat = t.seatOf(playerId).orElse(null);
        if (seat == null || !seat.isConnected()) return;
        seat.setConnected(false);
        deltas.commit(t, "CONNECTION");

        Long id = t.getId();
        timeouts.schedule(id, HandEngine.graceTimer(playerId), settings.getDisconnectGraceMs(),
                () -> workers.execute(id, tt -> onGraceExpired(tt, playerId)));
    }

    public void markReconnected(PokerTable t, String playerId) {
        Seat seat = t.seatOf(playerId).orElse(null);
        if (seat == null || seat.isConnected()) return;
        reconnect(t, seat);
    }

    void onGraceExpired(PokerTable t, String playerId) {
        Seat seat = t.seatOf(playerId).orElse(null);
        if (seat == null || seat.isConnected() || seat.isLeaving()) return;
        log.info("table={} {} did not come back, freeing seat {}", t.getId(), playerId, seat.getPosition());
        engine.playerLeft(t, seat);
    }

    private void reconnect(PokerTable t, Seat seat) {
        timeouts.cancel(t.getId(), HandEngine.graceTimer(seat.getPlayerId()));
        seat.setConnected(true);
        if (seat.getStatus() == PlayerStatus.DISCONNECTED) seat.setStatus(PlayerStatus.SITTING_OUT);
        t.getPrivateDirty().add(seat.getPlayerId());
        deltas.commit(t, "CONNECTION");
        if (t.isAutoContinue()) engine.startHandIfReady(t);
    }
}
