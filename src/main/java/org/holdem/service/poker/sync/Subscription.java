package org.holdem.service.poker.sync;

/** Handle returned by {@link BroadcastService#subscribe}; closing it stops delivery. */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
