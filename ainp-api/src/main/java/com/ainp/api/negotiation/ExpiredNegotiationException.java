package com.ainp.api.negotiation;

import java.time.Instant;
import java.util.UUID;

public class ExpiredNegotiationException extends RuntimeException {

    private final Instant expiresAt;

    public ExpiredNegotiationException(UUID negotiationId, Instant expiresAt) {
        super("Negotiation " + negotiationId + " expired at " + expiresAt);
        this.expiresAt = expiresAt;
    }

    public Instant getExpiresAt() { return expiresAt; }
}
