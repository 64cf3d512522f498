package com.ainp.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Append-only ledger entry. Immutable once created.
 */
@Entity
@Table(name = "credit_transactions", indexes = {
    @Index(name = "idx_credit_tx_agent", columnList = "agent_did, created_at"),
    @Index(name = "idx_credit_tx_intent", columnList = "intent_id"),
    @Index(name = "idx_credit_tx_type", columnList = "tx_type")
})
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "agent_did", nullable = false, updatable = false)
    private String agentDid;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "tx_type", nullable = false, updatable = false, length = 32)
    private TransactionType txType;

    @PositiveOrZero
    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(name = "intent_id", updatable = false)
    private String intentId;

    @Column(name = "usefulness_proof_id", updatable = false)
    private String usefulnessProofId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(updatable = false)
    private Map<String, Object> metadata;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected CreditTransaction() {}

    public static CreditTransaction create(
            String agentDid,
            TransactionType txType,
            long amount,
            String intentId,
            String usefulnessProofId,
            Map<String, Object> metadata,
            Instant createdAt) {

        if (amount < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }

        var tx = new CreditTransaction();
        tx.agentDid = agentDid;
        tx.txType = txType;
        tx.amount = amount;
        tx.intentId = intentId;
        tx.usefulnessProofId = usefulnessProofId;
        tx.metadata = metadata == null || metadata.isEmpty() ? null : new LinkedHashMap<>(metadata);
        tx.createdAt = createdAt;
        return tx;
    }

    // Getters (immutable - no setters)
    public Long getId() { return id; }
    public String getAgentDid() { return agentDid; }
    public TransactionType getTxType() { return txType; }
    public long getAmount() { return amount; }
    public String getIntentId() { return intentId; }
    public String getUsefulnessProofId() { return usefulnessProofId; }
    public Map<String, Object> getMetadata() {
        return metadata == null ? Map.of() : Collections.unmodifiableMap(metadata);
    }
    public Instant getCreatedAt() { return createdAt; }

    public enum TransactionType {
        DEPOSIT, EARN, RESERVE, RELEASE, SPEND,
        POU_COMPUTE, POU_MEMORY, POU_ROUTING, POU_VALIDATION, POU_POOL_DISTRIBUTION;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
