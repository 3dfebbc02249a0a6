package org.holdem.service.poker.sync;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.holdem.common.ActionRejectedException;
import org.holdem.common.InvariantViolationException;
import org.holdem.config.PokerSettings;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.StateDelta;
import org.holdem.service.poker.engine.TableHalter;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.util.Payloads;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One ordered command queue per table, drained by at most one thread at a
 * time from a shared pool. Every read or write of a {@link PokerTable} goes
 * through here; deltas a command produced are broadcast right after it, before
 * the next command of that table runs.
 * <p>
 * Callbacks attached to the returned futures run on the worker. They may
 * submit more work but must never block on it.
 */
@Slf4j
@Component
public class TableWorkers {
    private final Executor pool;
    private final ExecutorService owned;
    private final TableRegistry registry;
    private final BroadcastService broadcast;
    private final Payloads payloads;
    private final TableHalter halter;

    private final Map<Long, Worker> workers = new ConcurrentHashMap<>();

    @Autowired
    public TableWorkers(PokerSettings settings, TableRegistry registry, BroadcastService broadcast,
                        Payloads payloads, TableHalter halter) {
        AtomicInteger n = new AtomicInteger();
        this.owned = Executors.newFixedThreadPool(settings.getWorkerThreads(),
                r -> new Thread(r, "poker-worker-" + n.incrementAndGet()));
        this.pool = owned;
        this.registry = registry;
        this.broadcast = broadcast;
        this.payloads = payloads;
        this.halter = halter;
    }

    /** Runs commands on the given executor; {@code Runnable::run} makes everything synchronous. */
    public TableWorkers(Executor pool, TableRegistry registry, BroadcastService broadcast,
                        Payloads payloads, TableHalter halter) {
        this.owned = null;
        this.pool = pool;
        this.registry = registry;
        this.broadcast = broadcast;
        this.payloads = payloads;
        this.halter = halter;
    }

    /**
     * Queues a command for the table. The future completes with the command's
     * result, or exceptionally with whatever it threw (unknown table included).
     */
    public <T> CompletableFuture<T> submit(Long tableId, Function<PokerTable, T> command) {
        if (tableId == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown table null"));
        }
        CompletableFuture<T> f = new CompletableFuture<>();
        workers.computeIfAbsent(tableId, Worker::new).enqueue(() -> runCommand(tableId, command, f));
        return f;
    }

    /** Fire-and-forget variant for timers and internal follow-ups. */
    public void execute(Long tableId, Consumer<PokerTable> command) {
        submit(tableId, t -> { command.accept(t); return null; });
    }

    private <T> void runCommand(Long tableId, Function<PokerTable, T> command, CompletableFuture<T> f) {
        PokerTable t = registry.find(tableId).orElse(null);
        if (t == null) {
            f.completeExceptionally(new IllegalArgumentException("Unknown table " + tableId));
            return;
        }
        T result;
        try {
            result = command.apply(t);
        } catch (InvariantViolationException e) {
            halter.halt(t, e);
            flush(t);
            f.completeExceptionally(e);
            return;
        } catch (ActionRejectedException e) {
            log.warn("table={} rejected: {} ({})", tableId, e.getMessage(), e.getReason());
            flush(t);
            f.completeExceptionally(e);
            return;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("table={} command refused: {}", tableId, e.getMessage());
            flush(t);
            f.completeExceptionally(e);
            return;
        } catch (RuntimeException e) {
            log.error("table={} command failed", tableId, e);
            flush(t);
            f.completeExceptionally(e);
            return;
        }
        flush(t);
        f.complete(result);
    }

    private void flush(PokerTable t) {
        for (StateDelta d : t.drainOutbox()) broadcast.publish(d);
        for (String playerId : t.drainPrivateDirty()) {
            if (t.seatOf(playerId).isPresent()) broadcast.sendPrivate(playerId, t.getId(), payloads.playerView(t, playerId));
        }
        if (t.isClosed()) {
            registry.remove(t.getId());
            registry.deleteFromDb(t.getId());
            broadcast.dropTable(t.getId());
            workers.remove(t.getId());
            broadcast.lobby(registry.summaries());
        } else if (registry.updateSummary(payloads.summary(t))) {
            broadcast.lobby(registry.summaries());
        }
    }

    @PreDestroy
    public void shutdown() {
        if (owned != null) owned.shutdown();
    }

    private final class Worker {
        private final Long tableId;
        private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean();

        Worker(Long tableId) { this.tableId = tableId; }

        void enqueue(Runnable r) {
            queue.add(r);
            schedule();
        }

        private void schedule() {
            if (!draining.compareAndSet(false, true)) return;
            try {
                pool.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.error("table={} worker rejected by pool", tableId, e);
            }
        }

        private void drain() {
            try {
                Runnable r;
                while ((r = queue.poll()) != null) {
                    try {
                        r.run();
                    } catch (RuntimeException e) {
                        log.error("table={} worker task crashed", tableId, e);
                    }
                }
            } finally {
                draining.set(false);
            }
            if (!queue.isEmpty()) schedule();
        }
    }
}
