package com.ainp.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Cached usefulness score per agent, read by usefulness reward distribution.
 */
@Entity
@Table(name = "agent_usefulness", indexes = {
    @Index(name = "idx_agent_usefulness_score", columnList = "usefulness_score_cached")
})
public class AgentUsefulness {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    @Id
    @Column(name = "agent_did", nullable = false, updatable = false)
    private String agentDid;

    @Min(0)
    @Max(100)
    @Column(name = "usefulness_score_cached", nullable = false)
    private double usefulnessScoreCached;

    @Column(name = "total_proofs", nullable = false)
    private long totalProofs;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected AgentUsefulness() {}

    public static AgentUsefulness create(String agentDid, Instant now) {
        var usefulness = new AgentUsefulness();
        usefulness.agentDid = agentDid;
        usefulness.usefulnessScoreCached = MIN_SCORE;
        usefulness.totalProofs = 0;
        usefulness.updatedAt = now;
        return usefulness;
    }

    /**
     * Stores a new score clamped to [0, 100] and counts the proof behind it.
     */
    public void recordScore(double score, Instant now) {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("Score must be a number");
        }
        this.usefulnessScoreCached = clamp(score);
        this.totalProofs++;
        this.updatedAt = now;
    }

    public static double clamp(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public String getAgentDid() { return agentDid; }
    public double getUsefulnessScoreCached() { return usefulnessScoreCached; }
    public long getTotalProofs() { return totalProofs; }
    public Instant getUpdatedAt() { return updatedAt; }
}
