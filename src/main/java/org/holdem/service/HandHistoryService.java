package org.holdem.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.events.HandCompleted;
import org.holdem.model.HandHistoryEntity;
import org.holdem.repo.HandHistoryRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Stores finished hands off the table workers. A failed write is logged and
 * dropped, the game never waits for it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HandHistoryService {
    private static final int MAX_LIMIT = 100;

    private final HandHistoryRepository repo;
    private final ObjectMapper objectMapper;

    public static class HandRecord {
        public Long tableId;
        public String handId;
        public long handNumber;
        public String completedAt;
        public JsonNode finalState;
        public JsonNode actionLog;
        public JsonNode awards;

        public HandRecord(Long tableId, String handId, long handNumber, String completedAt,
                          JsonNode finalState, JsonNode actionLog, JsonNode awards) {
            this.tableId = tableId;
            this.handId = handId;
            this.handNumber = handNumber;
            this.completedAt = completedAt;
            this.finalState = finalState;
            this.actionLog = actionLog;
            this.awards = awards;
        }
    }

    @Async
    @EventListener
    @Transactional
    public void onHandCompleted(HandCompleted e) {
        try {
            HandHistoryEntity h = new HandHistoryEntity();
            h.setTableId(e.tableId());
            h.setHandId(e.handId());
            h.setHandNumber(e.handNumber());
            h.setFinalStateJson(objectMapper.writeValueAsString(e.finalState()));
            h.setActionLogJson(objectMapper.writeValueAsString(e.actionLog()));
            h.setAwardsJson(objectMapper.writeValueAsString(e.awards()));
            h.setHoleCardsJson(objectMapper.writeValueAsString(e.holeCards()));
            h.setCompletedAt(e.completedAt());
            repo.save(h);
            log.debug("Stored hand {} of table {}", e.handId(), e.tableId());
        } catch (JsonProcessingException ex) {
            log.error("Could not serialise hand {} of table {}", e.handId(), e.tableId(), ex);
        }
    }

    /** Most recent hands of a table, newest first. Hole cards are not exposed. */
    public List<HandRecord> recentForTable(Long tableId, int limit) {
        if (limit <= 0) limit = 20;
        limit = Math.min(limit, MAX_LIMIT);
        return repo.findByTableIdOrderByHandNumberDesc(tableId, PageRequest.of(0, limit)).stream()
                .map(h -> new HandRecord(
                        h.getTableId(),
                        h.getHandId(),
                        h.getHandNumber(),
                        h.getCompletedAt().toString(),
                        read(h.getFinalStateJson()),
                        read(h.getActionLogJson()),
                        read(h.getAwardsJson())))
                .toList();
    }

    private JsonNode read(String json) {
        if (json == null || json.isBlank()) return objectMapper.nullNode();
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            log.warn("Corrupt hand history json: {}", ex.getOriginalMessage());
            return objectMapper.nullNode();
        }
    }
}
