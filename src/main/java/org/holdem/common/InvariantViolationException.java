package org.holdem.common;

/**
 * Internal consistency broken (negative pot, chips created or lost...).
 * Fatal for the table it happened on, never for the process.
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
