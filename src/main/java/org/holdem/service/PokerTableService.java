package org.holdem.service;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.common.StateConflictException;
import org.holdem.config.PokerSettings;
import org.holdem.dto.poker.CreateTableRequest;
import org.holdem.dto.poker.PlayerView;
import org.holdem.dto.poker.TableSnapshot;
import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.model.poker.PlayerAction;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.PokerTableEntity;
import org.holdem.model.poker.StateDelta;
import org.holdem.service.poker.ai.AiStrategy;
import org.holdem.service.poker.ai.CheckCallStrategy;
import org.holdem.service.poker.engine.HandEngine;
import org.holdem.service.poker.entry.EntryService;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.sync.BroadcastService;
import org.holdem.service.poker.sync.Subscription;
import org.holdem.service.poker.sync.TableWorkers;
import org.holdem.service.poker.util.Payloads;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Entry point for transports. Every call touching a table is queued on that
 * table's worker and answered through a future.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PokerTableService {
    private static final long IDLE_CLOSE_MS = 600_000;

    private final TableRegistry registry;
    private final TableWorkers workers;
    private final HandEngine engine;
    private final EntryService entry;
    private final BroadcastService broadcast;
    private final Payloads payloads;
    private final PokerSettings settings;
    private final Map<String, AiStrategy> strategies;

    private final AtomicLong botSeq = new AtomicLong();

    @PostConstruct
    void publishRestoredTables() {
        for (PokerTable t : registry.all()) registry.updateSummary(payloads.summary(t));
    }

    // ---- lobby ----

    public TableSummaryDTO createTable(String creator, CreateTableRequest req) {
        long bigBlind = Optional.ofNullable(req.getBigBlind()).orElse(20L);
        long smallBlind = Optional.ofNullable(req.getSmallBlind()).orElse(Math.max(1, bigBlind / 2));
        if (smallBlind <= 0 || bigBlind < smallBlind) throw new IllegalArgumentException("Invalid blinds");
        int maxSeats = Optional.ofNullable(req.getMaxSeats()).orElse(6);
        if (maxSeats < 2 || maxSeats > 10) throw new IllegalArgumentException("maxSeats must be between 2 and 10");
        long minBuyIn = Optional.ofNullable(req.getMinBuyIn()).orElse(bigBlind * 20);
        long maxBuyIn = Optional.ofNullable(req.getMaxBuyIn()).orElse(bigBlind * 200);
        if (minBuyIn <= 0 || maxBuyIn < minBuyIn) throw new IllegalArgumentException("Invalid buy-in range");

        String name = req.getName() == null ? "" : req.getName().trim();
        if (name.isBlank()) name = "Hold'em " + smallBlind + "/" + bigBlind;
        if (name.length() > 20) name = name.substring(0, 20);

        PokerTableEntity ent = new PokerTableEntity();
        ent.setName(name);
        ent.setMaxSeats(maxSeats);
        ent.setSmallBlind(smallBlind);
        ent.setBigBlind(bigBlind);
        ent.setMinBuyIn(minBuyIn);
        ent.setMaxBuyIn(maxBuyIn);
        ent.setAutoContinue(Optional.ofNullable(req.getAutoContinue()).orElse(settings.isAutoContinue()));
        ent.setCreatedBy(creator);
        ent.setCreatedAt(Instant.now());

        PokerTable t = registry.createAndPersist(ent);
        TableSummaryDTO summary = payloads.summary(t);
        registry.updateSummary(summary);
        broadcast.lobby(registry.summaries());
        log.info("table={} created by {} ({} seats, blinds {}/{})", t.getId(), creator, maxSeats, smallBlind, bigBlind);
        return summary;
    }

    public List<TableSummaryDTO> listTables() { return registry.summaries(); }

    public CompletableFuture<Void> closeTable(Long tableId, String requester) {
        return workers.submit(tableId, t -> {
            if (t.getCreatedBy() != null && !t.getCreatedBy().equals(requester)) {
                throw new IllegalStateException("Only the table creator can close it");
            }
            engine.requestClose(t);
            return null;
        });
    }

    public CompletableFuture<Boolean> startHand(Long tableId) {
        return workers.submit(tableId, engine::startHandIfReady);
    }

    // ---- play ----

    /**
     * Queues an action for the player. Completes with the table version after
     * the action, or exceptionally with the rejection.
     */
    public CompletableFuture<Long> submitAction(Long tableId, String playerId, PlayerAction action) {
        PlayerAction own = new PlayerAction(playerId, action.type(), action.amount(), false);
        return workers.submit(tableId, t -> engine.onAction(t, own));
    }

    public CompletableFuture<TableSnapshot> snapshot(Long tableId) {
        return workers.submit(tableId, payloads::snapshot);
    }

    /** Snapshot only if the table is still at {@code expectedVersion}. */
    public CompletableFuture<TableSnapshot> snapshot(Long tableId, long expectedVersion) {
        return workers.submit(tableId, t -> {
            if (t.getVersion() != expectedVersion) throw new StateConflictException(expectedVersion, t.getVersion());
            return payloads.snapshot(t);
        });
    }

    public CompletableFuture<PlayerView> playerView(Long tableId, String playerId) {
        return workers.submit(tableId, t -> payloads.playerView(t, playerId));
    }

    public Subscription subscribe(Long tableId, Consumer<StateDelta> listener) {
        registry.get(tableId);
        return broadcast.subscribe(tableId, listener);
    }

    // ---- seating ----

    public CompletableFuture<Integer> sit(Long tableId, String playerId, String displayName, Long buyIn) {
        return workers.submit(tableId, t ->
                entry.sit(t, playerId, displayName, buyInOrDefault(t, buyIn), null).getPosition());
    }

    /** Seats a bot; completes with its player id. */
    public CompletableFuture<String> addAiPlayer(Long tableId, String strategy, Long buyIn) {
        String name = strategy == null || strategy.isBlank() ? CheckCallStrategy.NAME : strategy;
        if (!strategies.containsKey(name)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown AI strategy " + name));
        }
        long n = botSeq.incrementAndGet();
        return workers.submit(tableId, t ->
                entry.sit(t, "bot-" + n, name + " #" + n, buyInOrDefault(t, buyIn), name).getPlayerId());
    }

    public CompletableFuture<Void> leave(Long tableId, String playerId) {
        return workers.submit(tableId, t -> { entry.leave(t, playerId); return null; });
    }

    public void markDisconnected(String playerId) {
        registry.tableOf(playerId).ifPresent(id -> workers.execute(id, t -> entry.markDisconnected(t, playerId)));
    }

    public void markReconnected(String playerId) {
        registry.tableOf(playerId).ifPresent(id -> workers.execute(id, t -> entry.markReconnected(t, playerId)));
    }

    @Scheduled(fixedRate = 600_000)
    public void closeIdleTables() {
        Instant now = Instant.now();
        for (PokerTable table : new ArrayList<>(registry.all())) {
            workers.execute(table.getId(), t -> {
                boolean empty = t.occupied().findAny().isEmpty();
                if (empty && Duration.between(t.getLastActiveAt(), now).toMillis() > IDLE_CLOSE_MS) {
                    log.info("table={} idle, closing", t.getId());
                    engine.requestClose(t);
                }
            });
        }
    }

    private long buyInOrDefault(PokerTable t, Long buyIn) {
        if (buyIn != null) return buyIn;
        return Math.max(t.getMinBuyIn(), Math.min(t.getMaxBuyIn(), settings.getDefaultBuyIn()));
    }
}
