package org.holdem.model.poker;

public enum ActionType { FOLD, CHECK, CALL, BET, RAISE, ALL_IN }
