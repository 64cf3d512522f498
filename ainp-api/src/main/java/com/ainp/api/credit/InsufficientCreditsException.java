package com.ainp.api.credit;

/**
 * Exception thrown when available credits (balance minus reserved) cannot cover an amount.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final long needed;
    private final long available;

    public InsufficientCreditsException(String agentDid, long needed, long available) {
        super("Insufficient credits for " + agentDid + ": needed " + needed + ", available " + available);
        this.needed = needed;
        this.available = available;
    }

    public long getNeeded() { return needed; }
    public long getAvailable() { return available; }
}
