package com.ainp.api.credit;

/**
 * Exception thrown when an agent has no credit account.
 */
public class AccountNotFoundException extends RuntimeException {

    private final String agentDid;

    public AccountNotFoundException(String agentDid) {
        super("Credit account not found: " + agentDid);
        this.agentDid = agentDid;
    }

    public String getAgentDid() { return agentDid; }
}
