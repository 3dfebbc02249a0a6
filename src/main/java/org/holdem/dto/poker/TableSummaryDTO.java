package org.holdem.dto.poker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TableSummaryDTO {
    private Long id;
    private String name;
    private int maxSeats;
    private int seated;
    private long smallBlind;
    private long bigBlind;
    private long minBuyIn;
    private long maxBuyIn;
    private String phase;
    private boolean halted;
}
