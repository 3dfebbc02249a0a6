package org.holdem.model.poker;

import java.util.List;

/** A contribution-capped slice of the pot with its own set of eligible winners. */
public record PotLayer(long amount, long cap, List<String> eligiblePlayerIds) {
    public PotLayer {
        eligiblePlayerIds = List.copyOf(eligiblePlayerIds);
    }
}
