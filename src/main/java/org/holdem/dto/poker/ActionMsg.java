package org.holdem.dto.poker;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.holdem.model.poker.ActionType;

@Data
public class ActionMsg {
    // taken from the path on the REST side
    private Long tableId;
    @NotNull
    private ActionType type;
    // BET: bet size, RAISE: total to raise to, ignored otherwise
    @PositiveOrZero
    private long amount;
}
