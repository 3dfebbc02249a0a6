package org.holdem.service.poker.util;

import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;

/**
 * Named one-shot timers grouped by table. Timer bodies must not touch table
 * state themselves, they enqueue work on the table's worker.
 */
@Component
public class Timeouts {
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, r -> {
        Thread th = new Thread(r, "poker-timer");
        th.setDaemon(true);
        return th;
    });
    // key = tableId:name
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public void schedule(Long tableId, String name, long delayMs, Runnable task) {
        cancel(tableId, name);
        tasks.put(key(tableId, name), scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS));
    }

    public void cancel(Long tableId, String name) {
        ScheduledFuture<?> f = tasks.remove(key(tableId, name));
        if (f != null) f.cancel(false);
    }

    public void cancelAllOf(Long tableId) {
        String prefix = tableId + ":";
        tasks.entrySet().removeIf(e -> {
            if (!e.getKey().startsWith(prefix)) return false;
            e.getValue().cancel(false);
            return true;
        });
    }

    public boolean isScheduled(Long tableId, String name) {
        ScheduledFuture<?> f = tasks.get(key(tableId, name));
        return f != null && !f.isDone();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private String key(Long tableId, String name) { return tableId + ":" + name; }
}
