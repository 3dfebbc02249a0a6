package org.holdem.service.poker.util;

import org.holdem.dto.poker.PlayerView;
import org.holdem.dto.poker.SeatView;
import org.holdem.dto.poker.TableSnapshot;
import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.model.poker.*;
import org.holdem.model.poker.rules.BettingRules;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class Payloads {

    public TableSnapshot snapshot(PokerTable t) {
        List<SeatView> seats = new ArrayList<>(t.getMaxSeats());
        for (Seat s : t.getSeats()) seats.add(s == null ? null : seatView(t, s));
        List<ActionLogEntry> log = t.getActionLog();

        return TableSnapshot.builder()
                .tableId(t.getId())
                .name(t.getName())
                .version(t.getVersion())
                .phase(t.getPhase())
                .handNumber(t.getHandNumber())
                .handId(t.getHandId())
                .maxSeats(t.getMaxSeats())
                .smallBlind(t.getSmallBlind())
                .bigBlind(t.getBigBlind())
                .minBuyIn(t.getMinBuyIn())
                .maxBuyIn(t.getMaxBuyIn())
                .dealerIndex(t.getDealerIndex())
                .smallBlindIndex(t.getSmallBlindIndex())
                .bigBlindIndex(t.getBigBlindIndex())
                .currentActorIndex(t.getCurrentActorIndex())
                .turn(t.getTurnToken())
                .turnDeadline(t.getTurnDeadlineEpochMs())
                .betToCall(t.getBetToCall())
                .minRaise(t.getMinRaise())
                .communityCards(List.copyOf(t.getCommunityCards()))
                .pots(List.copyOf(t.getPots()))
                .potTotal(t.potTotal())
                .seats(seats)
                .lastAction(log.isEmpty() ? null : log.get(log.size() - 1))
                .lastAwards(List.copyOf(t.getLastAwards()))
                .closed(t.isClosed())
                .halted(t.isHalted())
                .build();
    }

    public SeatView seatView(PokerTable t, Seat s) {
        boolean shown = t.isShowdownReached()
                && (t.getPhase() == TablePhase.SHOWDOWN || t.getPhase() == TablePhase.PAYOUT)
                && s.getStatus().isInHand();
        return new SeatView(
                s.getPosition(),
                s.getPlayerId(),
                s.getDisplayName(),
                s.getStack(),
                s.getRoundContribution(),
                s.getHandContribution(),
                s.getStatus(),
                s.isHasActed(),
                s.isConnected(),
                s.isAi(),
                s.getAiStrategy(),
                s.getHoleCards().size(),
                shown ? List.copyOf(s.getHoleCards()) : List.of());
    }

    public PlayerView playerView(PokerTable t, String playerId) {
        Seat seat = t.seatOf(playerId).orElse(null);
        return new PlayerView(
                snapshot(t),
                playerId,
                seat == null ? null : seat.getPosition(),
                seat == null ? List.of() : List.copyOf(seat.getHoleCards()),
                BettingRules.legalActions(t, seat));
    }

    public TableSummaryDTO summary(PokerTable t) {
        return new TableSummaryDTO(
                t.getId(),
                t.getName(),
                t.getMaxSeats(),
                (int) t.occupied().count(),
                t.getSmallBlind(),
                t.getBigBlind(),
                t.getMinBuyIn(),
                t.getMaxBuyIn(),
                t.getPhase().name(),
                t.isHalted());
    }
}
