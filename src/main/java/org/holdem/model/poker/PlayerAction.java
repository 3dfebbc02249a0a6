package org.holdem.model.poker;

/**
 * Normalised player intent, independent of the transport it arrived on.
 * BET carries the bet size; RAISE carries the new round total ("raise to").
 */
public record PlayerAction(String playerId, ActionType type, long amount, boolean synthetic) {

    public static PlayerAction fold(String playerId)  { return new PlayerAction(playerId, ActionType.FOLD, 0, false); }
    public static PlayerAction check(String playerId) { return new PlayerAction(playerId, ActionType.CHECK, 0, false); }
    public static PlayerAction call(String playerId)  { return new PlayerAction(playerId, ActionType.CALL, 0, false); }
    public static PlayerAction bet(String playerId, long amount)  { return new PlayerAction(playerId, ActionType.BET, amount, false); }
    public static PlayerAction raiseTo(String playerId, long total) { return new PlayerAction(playerId, ActionType.RAISE, total, false); }
    public static PlayerAction allIn(String playerId) { return new PlayerAction(playerId, ActionType.ALL_IN, 0, false); }

    /** Same action, marked as injected by the turn timer. */
    public PlayerAction asSynthetic() { return new PlayerAction(playerId, type, amount, true); }
}
