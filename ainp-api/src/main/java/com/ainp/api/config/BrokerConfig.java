package com.ainp.api.config;

import com.ainp.core.domain.NegotiationSession;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Feature switches and ledger constants for the broker. Round limits are checked at
 * startup and can never exceed what a negotiation row can store.
 */
@Configuration
@ConfigurationProperties(prefix = "ainp.broker")
@Validated
public class BrokerConfig {

    private boolean negotiationEnabled = true;
    private boolean creditLedgerEnabled = true;
    @Min(1)
    private long atomicUnitScale = 1000L; // atomic units per credit
    @Min(1)
    @Max(NegotiationSession.MAX_ROUNDS_CEILING)
    private int maxRoundsLimit = NegotiationSession.MAX_ROUNDS_CEILING;
    @Min(1)
    @Max(NegotiationSession.MAX_ROUNDS_CEILING)
    private int defaultMaxRounds = 10;
    @Min(1)
    private int defaultTtlMinutes = 60;
    private String brokerDid = "did:ainp:broker";

    public boolean isNegotiationEnabled() { return negotiationEnabled; }
    public void setNegotiationEnabled(boolean enabled) { this.negotiationEnabled = enabled; }
    public boolean isCreditLedgerEnabled() { return creditLedgerEnabled; }
    public void setCreditLedgerEnabled(boolean enabled) { this.creditLedgerEnabled = enabled; }
    public long getAtomicUnitScale() { return atomicUnitScale; }
    public void setAtomicUnitScale(long atomicUnitScale) { this.atomicUnitScale = atomicUnitScale; }
    public int getMaxRoundsLimit() { return maxRoundsLimit; }
    public void setMaxRoundsLimit(int maxRoundsLimit) { this.maxRoundsLimit = maxRoundsLimit; }
    public int getDefaultMaxRounds() { return defaultMaxRounds; }
    public void setDefaultMaxRounds(int defaultMaxRounds) { this.defaultMaxRounds = defaultMaxRounds; }
    public int getDefaultTtlMinutes() { return defaultTtlMinutes; }
    public void setDefaultTtlMinutes(int defaultTtlMinutes) { this.defaultTtlMinutes = defaultTtlMinutes; }
    public String getBrokerDid() { return brokerDid; }
    public void setBrokerDid(String brokerDid) { this.brokerDid = brokerDid; }
}
