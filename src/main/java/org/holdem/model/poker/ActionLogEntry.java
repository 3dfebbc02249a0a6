package org.holdem.model.poker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionLogEntry {
    private long version;
    private TablePhase phase;
    private String playerId;
    private ActionType type;
    // chips moved by the action
    private long amount;
    private boolean synthetic;
    private long at;
}
