package org.holdem.common;

public class TableFullException extends IllegalStateException {
    public TableFullException(Long tableId) {
        super("Table " + tableId + " is full");
    }
}
