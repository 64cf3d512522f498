package com.ainp.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable marker written when a reservation has been released for a negotiation.
 * Stays in PENDING_DISTRIBUTION until incentive distribution has credited the recipients,
 * so a crash between release and distribution can be reconciled.
 */
@Entity
@Table(name = "settlements", indexes = {
    @Index(name = "idx_settlements_negotiation", columnList = "negotiation_id", unique = true),
    @Index(name = "idx_settlements_status", columnList = "status")
})
public class SettlementRecord {

    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "negotiation_id", nullable = false, unique = true, updatable = false)
    private UUID negotiationId;

    @NotNull
    @Column(name = "intent_id", nullable = false, updatable = false)
    private String intentId;

    @NotNull
    @Column(name = "payer_did", nullable = false, updatable = false)
    private String payerDid;

    @NotNull
    @Column(name = "agent_did", nullable = false, updatable = false)
    private String agentDid;

    @Column(name = "broker_did", updatable = false)
    private String brokerDid;

    @Column(name = "validator_did", updatable = false)
    private String validatorDid;

    @Column(name = "usefulness_proof_id", updatable = false)
    private String usefulnessProofId;

    @PositiveOrZero
    @Column(name = "total_amount", nullable = false, updatable = false)
    private long totalAmount;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "incentive_split", nullable = false, updatable = false)
    private IncentiveSplit incentiveSplit;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SettlementStatus status;

    @Column(name = "agent_amount", nullable = false)
    private long agentAmount;

    @Column(name = "broker_amount", nullable = false)
    private long brokerAmount;

    @Column(name = "validator_amount", nullable = false)
    private long validatorAmount;

    @Column(name = "pool_amount", nullable = false)
    private long poolAmount;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "distributed_at")
    private Instant distributedAt;

    @Version
    private Long version;

    protected SettlementRecord() {}

    public static SettlementRecord pending(
            UUID negotiationId,
            String intentId,
            String payerDid,
            String agentDid,
            String brokerDid,
            String validatorDid,
            String usefulnessProofId,
            long totalAmount,
            IncentiveSplit incentiveSplit,
            Instant now) {

        if (totalAmount <= 0) {
            throw new IllegalArgumentException("Settled amount must be positive");
        }

        var record = new SettlementRecord();
        record.negotiationId = negotiationId;
        record.intentId = intentId;
        record.payerDid = payerDid;
        record.agentDid = agentDid;
        record.brokerDid = brokerDid;
        record.validatorDid = validatorDid;
        record.usefulnessProofId = usefulnessProofId;
        record.totalAmount = totalAmount;
        record.incentiveSplit = incentiveSplit;
        record.status = SettlementStatus.PENDING_DISTRIBUTION;
        record.attempts = 0;
        record.createdAt = now;
        return record;
    }

    public boolean isPending() {
        return status == SettlementStatus.PENDING_DISTRIBUTION;
    }

    public void complete(long agentAmount, long brokerAmount, long validatorAmount, long poolAmount, Instant now) {
        if (!isPending()) {
            throw new IllegalStateException("Settlement " + id + " is already completed");
        }
        if (agentAmount + brokerAmount + validatorAmount + poolAmount != totalAmount) {
            throw new IllegalArgumentException("Distributed amounts must add up to " + totalAmount);
        }
        this.agentAmount = agentAmount;
        this.brokerAmount = brokerAmount;
        this.validatorAmount = validatorAmount;
        this.poolAmount = poolAmount;
        this.attempts++;
        this.lastError = null;
        this.status = SettlementStatus.COMPLETED;
        this.distributedAt = now;
    }

    public void recordFailure(String error) {
        this.attempts++;
        this.lastError = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH)
                : error;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getNegotiationId() { return negotiationId; }
    public String getIntentId() { return intentId; }
    public String getPayerDid() { return payerDid; }
    public String getAgentDid() { return agentDid; }
    public String getBrokerDid() { return brokerDid; }
    public String getValidatorDid() { return validatorDid; }
    public String getUsefulnessProofId() { return usefulnessProofId; }
    public long getTotalAmount() { return totalAmount; }
    public IncentiveSplit getIncentiveSplit() { return incentiveSplit; }
    public SettlementStatus getStatus() { return status; }
    public long getAgentAmount() { return agentAmount; }
    public long getBrokerAmount() { return brokerAmount; }
    public long getValidatorAmount() { return validatorAmount; }
    public long getPoolAmount() { return poolAmount; }
    public int getAttempts() { return attempts; }
    public String getLastError() { return lastError; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getDistributedAt() { return distributedAt; }

    public enum SettlementStatus {
        PENDING_DISTRIBUTION, COMPLETED
    }
}
