package org.holdem.service.poker.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.dto.poker.PokerError;
import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.model.poker.StateDelta;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of table deltas: the STOMP topic of the table, plus in-process
 * listeners (AI driver, tests). Delivery happens on the table's worker, in
 * version order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastService {
    private final SimpMessagingTemplate broker;

    private final Map<Long, List<Consumer<StateDelta>>> listeners = new ConcurrentHashMap<>();
    private final List<Consumer<StateDelta>> global = new CopyOnWriteArrayList<>();

    public static String tableTopic(Long tableId) { return "/topic/poker/table/" + tableId; }
    public static String privateQueue(Long tableId) { return "/queue/poker/table/" + tableId; }
    public static final String ERRORS_QUEUE = "/queue/poker/errors";
    public static final String LOBBY_TOPIC = "/topic/poker/lobby";

    public void publish(StateDelta d) {
        send(() -> broker.convertAndSend(tableTopic(d.tableId()), d));
        deliver(global, d);
        List<Consumer<StateDelta>> ls = listeners.get(d.tableId());
        if (ls != null) deliver(ls, d);
    }

    public void sendPrivate(String playerId, Long tableId, Object payload) {
        send(() -> broker.convertAndSendToUser(playerId, privateQueue(tableId), payload));
    }

    public void sendError(String playerId, PokerError error) {
        send(() -> broker.convertAndSendToUser(playerId, ERRORS_QUEUE, error));
    }

    public void lobby(List<TableSummaryDTO> tables) {
        send(() -> broker.convertAndSend(LOBBY_TOPIC, tables));
    }

    public Subscription subscribe(Long tableId, Consumer<StateDelta> listener) {
        List<Consumer<StateDelta>> ls = listeners.computeIfAbsent(tableId, k -> new CopyOnWriteArrayList<>());
        ls.add(listener);
        return () -> ls.remove(listener);
    }

    /** Deltas of every table. */
    public Subscription subscribeAll(Consumer<StateDelta> listener) {
        global.add(listener);
        return () -> global.remove(listener);
    }

    public void dropTable(Long tableId) {
        listeners.remove(tableId);
    }

    private void deliver(List<Consumer<StateDelta>> ls, StateDelta d) {
        for (Consumer<StateDelta> l : ls) {
            try {
                l.accept(d);
            } catch (RuntimeException e) {
                log.warn("Delta listener failed on table {} v{}", d.tableId(), d.version(), e);
            }
        }
    }

    private void send(Runnable r) {
        try {
            r.run();
        } catch (MessagingException e) {
            log.warn("STOMP send failed: {}", e.getMessage());
        }
    }
}
