package org.holdem.common;

import lombok.Getter;

/** Snapshot requested for a version the table is no longer (or not yet) at. */
@Getter
public class StateConflictException extends IllegalStateException {
    private final long expectedVersion;
    private final long actualVersion;

    public StateConflictException(long expectedVersion, long actualVersion) {
        super("Version conflict: expected " + expectedVersion + ", table is at " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
