package org.holdem.service.poker.registry;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.PokerTableEntity;
import org.holdem.repo.PokerTableRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live tables by id. Table configuration is persisted so tables survive a
 * restart; game state is not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableRegistry {
    private final PokerTableRepository repo;
    private final Map<Long, PokerTable> tables = new ConcurrentHashMap<>();
    // lobby rows, written by each table's worker
    private final Map<Long, TableSummaryDTO> summaries = new ConcurrentHashMap<>();
    // a player sits at one table at a time
    private final Map<String, Long> playerTable = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadFromDb() {
        for (PokerTableEntity e : repo.findAll()) {
            put(fromEntity(e));
        }
        log.info("Restored {} poker tables", tables.size());
    }

    public Collection<PokerTable> all() { return tables.values(); }

    public PokerTable get(Long id) {
        PokerTable t = id == null ? null : tables.get(id);
        if (t == null) throw new IllegalArgumentException("Unknown table " + id);
        return t;
    }

    public Optional<PokerTable> find(Long id) { return Optional.ofNullable(id == null ? null : tables.get(id)); }

    public void put(PokerTable t) { tables.put(t.getId(), t); }

    public void remove(Long id) {
        tables.remove(id);
        summaries.remove(id);
        playerTable.values().removeIf(id::equals);
    }

    public PokerTable createAndPersist(PokerTableEntity ent) {
        PokerTable t = fromEntity(repo.save(ent));
        put(t);
        return t;
    }

    public void deleteFromDb(Long id) {
        try {
            repo.deleteById(id);
        } catch (DataAccessException e) {
            log.warn("Could not delete poker table {}: {}", id, e.getMessage());
        }
    }

    // ---- lobby ----

    /** @return true when the row changed */
    public boolean updateSummary(TableSummaryDTO s) {
        return !s.equals(summaries.put(s.getId(), s));
    }

    public List<TableSummaryDTO> summaries() {
        return summaries.values().stream()
                .sorted(Comparator.comparing(TableSummaryDTO::getId))
                .toList();
    }

    // ---- seating index ----

    public Optional<Long> tableOf(String playerId) {
        return Optional.ofNullable(playerId == null ? null : playerTable.get(playerId));
    }

    /** Binds the player to the table; false when seated at another one. */
    public boolean bind(String playerId, Long tableId) {
        Long prev = playerTable.putIfAbsent(playerId, tableId);
        return prev == null || prev.equals(tableId);
    }

    public void unbind(String playerId, Long tableId) {
        playerTable.remove(playerId, tableId);
    }

    private PokerTable fromEntity(PokerTableEntity e) {
        int seats = Math.max(2, Math.min(10, Optional.ofNullable(e.getMaxSeats()).orElse(6)));
        PokerTable t = new PokerTable(e.getId(), seats, e.getSmallBlind(), e.getBigBlind());
        t.setName(e.getName());
        if (e.getMinBuyIn() != null) t.setMinBuyIn(e.getMinBuyIn());
        if (e.getMaxBuyIn() != null) t.setMaxBuyIn(e.getMaxBuyIn());
        t.setAutoContinue(e.isAutoContinue());
        t.setCreatedBy(e.getCreatedBy());
        if (e.getCreatedAt() != null) t.setCreatedAt(e.getCreatedAt());
        t.setLastActiveAt(Instant.now());
        return t;
    }
}
