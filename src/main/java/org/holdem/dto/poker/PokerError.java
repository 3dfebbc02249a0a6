package org.holdem.dto.poker;

import lombok.Builder;
import lombok.Data;

/** Sent to the originating session only. */
@Data
@Builder
public class PokerError {
    private Long tableId;
    private String reason;
    private String error;
    // fresh state when the client was out of sync
    private TableSnapshot snapshot;
}
