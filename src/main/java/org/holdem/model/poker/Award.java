package org.holdem.model.poker;

/** Chips paid from one pot layer to one player. */
public record Award(String playerId, int seat, int potIndex, long amount, String hand) {}
