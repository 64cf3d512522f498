package com.ainp.api.negotiation;

import com.ainp.core.domain.NegotiationSession.NegotiationState;

/**
 * Exception thrown when an action is not allowed from the session's current state.
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final NegotiationState currentState;
    private final String action;

    public InvalidStateTransitionException(NegotiationState currentState, String action) {
        super("Cannot " + action + " negotiation in state " + currentState.wireName());
        this.currentState = currentState;
        this.action = action;
    }

    public NegotiationState getCurrentState() { return currentState; }
    public String getAction() { return action; }
}
