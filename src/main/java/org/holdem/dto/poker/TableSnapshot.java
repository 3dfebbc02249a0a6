package org.holdem.dto.poker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.holdem.model.poker.*;

import java.util.List;

/**
 * Public view of a table at one version. Every field is top-level so a
 * delta patch can replace it wholesale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableSnapshot {
    private Long tableId;
    private String name;
    private long version;
    private TablePhase phase;
    private long handNumber;
    private String handId;
    private int maxSeats;
    private long smallBlind;
    private long bigBlind;
    private long minBuyIn;
    private long maxBuyIn;
    private int dealerIndex;
    private int smallBlindIndex;
    private int bigBlindIndex;
    private Integer currentActorIndex;
    // bumped every time the action moves, even back to the same seat
    private long turn;
    private long turnDeadline;
    private long betToCall;
    private long minRaise;
    private List<Card> communityCards;
    private List<PotLayer> pots;
    private long potTotal;
    private List<SeatView> seats;
    private ActionLogEntry lastAction;
    private List<Award> lastAwards;
    private boolean closed;
    private boolean halted;
}
