package org.holdem.model.poker.rules;

import org.holdem.common.ActionRejectedException;
import org.holdem.common.ActionRejectedException.Reason;
import org.holdem.model.poker.*;

import java.util.ArrayList;
import java.util.List;

/**
 * No-limit betting rules. {@link #resolve} validates one action against the
 * table without touching it; the first failing rule wins.
 */
public final class BettingRules {
    private BettingRules(){}

    public enum Kind { PASSIVE, FULL_RAISE, SHORT_RAISE }

    /** A validated action: chips to move and how it affects the betting level. */
    public record Move(Seat seat, ActionType type, long chips, long newTotal, Kind kind) {}

    public static Move resolve(PokerTable t, PlayerAction a) {
        if (t.isHalted()) throw new ActionRejectedException(Reason.TABLE_HALTED, "Table is halted");
        if (t.isClosed() || !t.getPhase().isBetting() || t.getCurrentActorIndex() == null)
            throw new ActionRejectedException(Reason.WRONG_PHASE, "No betting in phase " + t.getPhase());
        if (a == null || a.type() == null) throw new ActionRejectedException(Reason.ILLEGAL_ACTION, "Missing action");

        Seat seat = t.seatOf(a.playerId())
                .orElseThrow(() -> new ActionRejectedException(Reason.NOT_SEATED, "Not seated at this table"));
        if (seat.getPosition() != t.getCurrentActorIndex())
            throw new ActionRejectedException(Reason.OUT_OF_TURN, "Not your turn");

        long rc = seat.getRoundContribution();
        long stack = seat.getStack();
        long betToCall = t.getBetToCall();
        long toCall = betToCall - rc;

        return switch (a.type()) {
            case FOLD -> new Move(seat, ActionType.FOLD, 0, rc, Kind.PASSIVE);
            case CHECK -> {
                if (toCall != 0) throw illegal("Cannot check facing " + toCall);
                yield new Move(seat, ActionType.CHECK, 0, rc, Kind.PASSIVE);
            }
            case CALL -> {
                if (toCall <= 0) throw illegal("Nothing to call");
                long chips = Math.min(toCall, stack);
                yield new Move(seat, ActionType.CALL, chips, rc + chips, Kind.PASSIVE);
            }
            case BET -> {
                if (betToCall != 0) throw illegal("There is already a bet, raise instead");
                long amount = a.amount();
                if (amount > stack) throw insufficient(amount, stack);
                if (amount < t.getBigBlind())
                    throw new ActionRejectedException(Reason.INVALID_AMOUNT, "Minimum bet is " + t.getBigBlind());
                ActionType recorded = amount == stack ? ActionType.ALL_IN : ActionType.BET;
                yield new Move(seat, recorded, amount, rc + amount, Kind.FULL_RAISE);
            }
            case RAISE -> {
                if (betToCall == 0) throw illegal("Nothing to raise, bet instead");
                if (seat.isRaiseLocked()) throw illegal("Betting was not reopened");
                long target = a.amount();
                long max = rc + stack;
                if (target > max) throw insufficient(target - rc, stack);
                if (target <= betToCall)
                    throw new ActionRejectedException(Reason.INVALID_AMOUNT, "Raise must exceed " + betToCall);
                long minTarget = betToCall + t.getMinRaise();
                if (target < minTarget && target != max)
                    throw new ActionRejectedException(Reason.INVALID_AMOUNT, "Minimum raise is to " + minTarget);
                Kind kind = target >= minTarget ? Kind.FULL_RAISE : Kind.SHORT_RAISE;
                ActionType recorded = target == max ? ActionType.ALL_IN : ActionType.RAISE;
                yield new Move(seat, recorded, target - rc, target, kind);
            }
            case ALL_IN -> {
                if (stack <= 0) throw illegal("No chips left");
                long target = rc + stack;
                if (target <= betToCall) {
                    yield new Move(seat, ActionType.ALL_IN, stack, target, Kind.PASSIVE);
                }
                if (betToCall == 0) {
                    yield new Move(seat, ActionType.ALL_IN, stack, target, Kind.FULL_RAISE);
                }
                if (seat.isRaiseLocked()) throw illegal("Betting was not reopened, call or fold");
                Kind kind = target - betToCall >= t.getMinRaise() ? Kind.FULL_RAISE : Kind.SHORT_RAISE;
                yield new Move(seat, ActionType.ALL_IN, stack, target, kind);
            }
        };
    }

    /**
     * Betting round is over: fewer than two players hold cards, or every seat
     * able to act has acted since the last raise and matched the bet.
     */
    public static boolean isRoundComplete(PokerTable t) {
        if (t.inHand().size() <= 1) return true;
        List<Seat> canAct = t.occupied().filter(Seat::canAct).toList();
        if (canAct.isEmpty()) return true;
        if (canAct.size() == 1 && canAct.get(0).getRoundContribution() >= t.getBetToCall()) return true;
        return canAct.stream().allMatch(s -> s.isHasActed() && s.getRoundContribution() == t.getBetToCall());
    }

    /** Still owes an action in the current round. */
    public static boolean needsAction(PokerTable t, Seat s) {
        return s.canAct() && (!s.isHasActed() || s.getRoundContribution() < t.getBetToCall());
    }

    /** Next seat clockwise after {@code from} that owes an action, or -1. */
    public static int nextToAct(PokerTable t, int from) {
        return t.nextSeat(from, s -> needsAction(t, s));
    }

    public static LegalActions legalActions(PokerTable t, Seat seat) {
        if (seat == null || t.isHalted() || !t.getPhase().isBetting()
                || t.getCurrentActorIndex() == null || seat.getPosition() != t.getCurrentActorIndex()) {
            return LegalActions.NONE;
        }
        long rc = seat.getRoundContribution();
        long stack = seat.getStack();
        long betToCall = t.getBetToCall();
        long toCall = betToCall - rc;
        long max = rc + stack;

        List<ActionType> types = new ArrayList<>();
        types.add(ActionType.FOLD);
        if (toCall == 0) types.add(ActionType.CHECK);
        if (toCall > 0) types.add(ActionType.CALL);
        if (betToCall == 0 && stack >= t.getBigBlind()) types.add(ActionType.BET);
        boolean canRaise = betToCall > 0 && !seat.isRaiseLocked() && max > betToCall;
        if (canRaise) types.add(ActionType.RAISE);
        if (stack > 0 && !(seat.isRaiseLocked() && max > betToCall)) types.add(ActionType.ALL_IN);

        return new LegalActions(
                List.copyOf(types),
                Math.max(0, Math.min(toCall, stack)),
                betToCall == 0 ? t.getBigBlind() : 0,
                canRaise ? Math.min(betToCall + t.getMinRaise(), max) : 0,
                canRaise ? max : 0);
    }

    private static ActionRejectedException illegal(String msg) {
        return new ActionRejectedException(Reason.ILLEGAL_ACTION, msg);
    }

    private static ActionRejectedException insufficient(long needed, long available) {
        return new ActionRejectedException(Reason.INSUFFICIENT_STACK,
                "Insufficient chips: needed " + needed + ", available " + available);
    }
}
