package org.holdem.model.poker;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One versioned change of a table's public state. {@code patch} holds every
 * top-level snapshot field that changed since the previous version.
 */
public record StateDelta(long tableId, long version, String type, ObjectNode patch, long ts) {}
