package org.holdem.service.poker.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.holdem.dto.poker.TableSnapshot;
import org.holdem.model.poker.StateDelta;

/**
 * Receiver-side mirror of one table built from deltas. Deltas must arrive
 * gap-free: a repeated or older version is dropped, a skipped version stops
 * the mirror until {@link #reset} is fed a fresh snapshot.
 */
@Slf4j
public class TableObserver {

    public enum Result { APPLIED, DUPLICATE, GAP }

    private final Long tableId;
    private final ObjectMapper mapper;
    private final Runnable resync;

    private ObjectNode state;
    private long version;
    private boolean awaitingSnapshot;

    public TableObserver(Long tableId, ObjectMapper mapper, Runnable resync) {
        this.tableId = tableId;
        this.mapper = mapper;
        this.resync = resync;
        this.state = mapper.createObjectNode();
    }

    public synchronized Result apply(StateDelta d) {
        if (d.version() <= version) return Result.DUPLICATE;
        if (awaitingSnapshot || d.version() != version + 1) {
            if (!awaitingSnapshot) {
                awaitingSnapshot = true;
                log.warn("table={} gap: at v{}, got v{}, requesting snapshot", tableId, version, d.version());
                resync.run();
            }
            return Result.GAP;
        }
        state.setAll(d.patch());
        version = d.version();
        return Result.APPLIED;
    }

    public synchronized void reset(TableSnapshot snapshot) {
        if (snapshot.getVersion() < version) return;
        state = mapper.valueToTree(snapshot);
        version = snapshot.getVersion();
        awaitingSnapshot = false;
    }

    public synchronized long version() { return version; }

    public synchronized boolean isAwaitingSnapshot() { return awaitingSnapshot; }

    public synchronized ObjectNode state() { return state.deepCopy(); }

    public Long tableId() { return tableId; }
}
