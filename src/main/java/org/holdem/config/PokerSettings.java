package org.holdem.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Table timing and defaults, from application.properties.
 */
@Getter
@Component
public class PokerSettings {

    private final long turnTimeoutMs;
    private final long nextHandDelayMs;
    private final long disconnectGraceMs;
    private final long defaultBuyIn;
    private final int workerThreads;
    private final boolean autoContinue;

    @Autowired
    public PokerSettings(@Value("${poker.turn-timeout-ms:30000}") long turnTimeoutMs,
                         @Value("${poker.next-hand-delay-ms:5000}") long nextHandDelayMs,
                         @Value("${poker.disconnect-grace-ms:120000}") long disconnectGraceMs,
                         @Value("${poker.default-buy-in:1000}") long defaultBuyIn,
                         @Value("${poker.worker-threads:4}") int workerThreads,
                         @Value("${poker.auto-continue:true}") boolean autoContinue) {
        this.turnTimeoutMs = turnTimeoutMs;
        this.nextHandDelayMs = nextHandDelayMs;
        this.disconnectGraceMs = disconnectGraceMs;
        this.defaultBuyIn = defaultBuyIn;
        this.workerThreads = Math.max(1, workerThreads);
        this.autoContinue = autoContinue;
    }

    /** Defaults, for tests. */
    public PokerSettings() {
        this(30_000, 5_000, 120_000, 1_000, 4, true);
    }
}
