package com.ainp.api.negotiation;

import java.util.UUID;

public class MaxRoundsExceededException extends RuntimeException {

    private final int maxRounds;

    public MaxRoundsExceededException(UUID negotiationId, int maxRounds) {
        super("Negotiation " + negotiationId + " reached its limit of " + maxRounds + " rounds");
        this.maxRounds = maxRounds;
    }

    public int getMaxRounds() { return maxRounds; }
}
