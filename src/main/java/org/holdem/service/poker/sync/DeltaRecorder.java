package org.holdem.service.poker.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.StateDelta;
import org.holdem.service.poker.util.Payloads;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Turns state changes into versioned deltas. Each commit bumps the table
 * version and records the top-level snapshot fields that differ from the
 * previous commit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeltaRecorder {
    private final ObjectMapper mapper;
    private final Payloads payloads;

    public StateDelta commit(PokerTable t, String type) {
        t.setVersion(t.getVersion() + 1);
        ObjectNode now = mapper.valueToTree(payloads.snapshot(t));
        ObjectNode patch = diff(t.getLastPublished(), now);
        t.setLastPublished(now);

        StateDelta d = new StateDelta(t.getId(), t.getVersion(), type, patch, System.currentTimeMillis());
        t.getOutbox().add(d);
        log.debug("table={} v{} {} {}", t.getId(), d.version(), type, patch.fieldNames().hasNext() ? patch : "{}");
        return d;
    }

    ObjectNode diff(ObjectNode before, ObjectNode after) {
        ObjectNode patch = mapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> it = after.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (before == null || !e.getValue().equals(before.get(e.getKey()))) patch.set(e.getKey(), e.getValue());
        }
        if (before != null) {
            before.fieldNames().forEachRemaining(k -> { if (!after.has(k)) patch.putNull(k); });
        }
        return patch;
    }
}
