package com.ainp.api.negotiation;

import java.util.UUID;

public class NegotiationNotFoundException extends RuntimeException {

    public NegotiationNotFoundException(UUID negotiationId) {
        super("Negotiation not found: " + negotiationId);
    }
}
