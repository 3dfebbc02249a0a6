package org.holdem.service.poker.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.holdem.dto.poker.PlayerView;
import org.holdem.model.poker.PlayerAction;
import org.holdem.model.poker.StateDelta;
import org.holdem.service.PokerTableService;
import org.holdem.service.poker.sync.BroadcastService;
import org.holdem.service.poker.sync.Subscription;
import org.holdem.service.poker.sync.TableObserver;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Plays the bot seats. Mirrors every table from its deltas like a remote
 * client would, and when the turn lands on a bot asks its strategy and submits
 * the answer through the regular action path.
 */
@Slf4j
@Component
public class AiPlayerDriver {
    private final BroadcastService broadcast;
    private final PokerTableService tables;
    private final Map<String, AiStrategy> strategies;
    private final ObjectMapper mapper;

    private final Map<Long, TableObserver> mirrors = new ConcurrentHashMap<>();
    private Subscription subscription;

    public AiPlayerDriver(BroadcastService broadcast, PokerTableService tables,
                          Map<String, AiStrategy> strategies, ObjectMapper mapper) {
        this.broadcast = broadcast;
        this.tables = tables;
        this.strategies = strategies;
        this.mapper = mapper;
    }

    @PostConstruct
    public void start() {
        subscription = broadcast.subscribeAll(this::onDelta);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) subscription.close();
    }

    void onDelta(StateDelta d) {
        if ("TABLE_CLOSED".equals(d.type())) {
            mirrors.remove(d.tableId());
            return;
        }
        TableObserver mirror = mirrors.computeIfAbsent(d.tableId(),
                id -> new TableObserver(id, mapper, () -> resync(id)));
        if (mirror.apply(d) != TableObserver.Result.APPLIED || !d.patch().has("turn")) return;
        actIfBotTurn(d.tableId(), mirror.state());
    }

    private void actIfBotTurn(Long tableId, JsonNode state) {
        JsonNode actor = state.path("currentActorIndex");
        if (!actor.isInt()) return;
        JsonNode seat = state.path("seats").path(actor.asInt());
        if (!seat.path("ai").asBoolean(false)) return;

        String playerId = seat.path("playerId").asText();
        String strategy = seat.path("aiStrategy").asText(CheckCallStrategy.NAME);
        long turn = state.path("turn").asLong();
        // never join here: this runs on the table's worker
        tables.playerView(tableId, playerId)
                .thenAccept(view -> play(tableId, view, strategy, turn))
                .exceptionally(ex -> {
                    log.warn("table={} bot {} could not read its view: {}", tableId, playerId, ex.getMessage());
                    return null;
                });
    }

    private void play(Long tableId, PlayerView view, String strategyName, long turn) {
        if (view.seat() == null || view.table().getTurn() != turn || view.legal().types().isEmpty()) return;
        AiStrategy strategy = strategies.getOrDefault(strategyName, strategies.get(CheckCallStrategy.NAME));
        PlayerAction action = strategy.decide(
                new TableView(view.table(), view.seat(), view.playerId(), view.holeCards()), view.legal());
        log.debug("table={} bot {} plays {}", tableId, view.playerId(), action);
        tables.submitAction(tableId, view.playerId(), action)
                .exceptionally(ex -> {
                    log.warn("table={} bot {} action refused: {}", tableId, view.playerId(), ex.getMessage());
                    return null;
                });
    }

    private void resync(Long tableId) {
        tables.snapshot(tableId)
                .thenAccept(s -> {
                    TableObserver m = mirrors.get(tableId);
                    if (m == null) return;
                    m.reset(s);
                    // the turn delta may be the one that went missing
                    actIfBotTurn(tableId, m.state());
                })
                .exceptionally(ex -> {
                    log.warn("table={} resync failed: {}", tableId, ex.getMessage());
                    return null;
                });
    }
}
