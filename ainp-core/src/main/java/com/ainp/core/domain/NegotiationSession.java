package com.ainp.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Multi-round negotiation between two agents on behalf of an intent.
 * Once the state is terminal (accepted, rejected, expired) the session is immutable.
 */
@Entity
@Table(name = "negotiations", indexes = {
    @Index(name = "idx_negotiations_intent", columnList = "intent_id"),
    @Index(name = "idx_negotiations_initiator", columnList = "initiator_did, created_at"),
    @Index(name = "idx_negotiations_responder", columnList = "responder_did, created_at"),
    @Index(name = "idx_negotiations_state_expires", columnList = "state, expires_at")
})
public class NegotiationSession {

    /** Hard upper bound on max_rounds, matching the database check. */
    public static final int MAX_ROUNDS_CEILING = 20;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "intent_id", nullable = false)
    private String intentId;

    @NotNull
    @Column(name = "initiator_did", nullable = false)
    private String initiatorDid;

    @NotNull
    @Column(name = "responder_did", nullable = false)
    private String responderDid;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private NegotiationState state;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<NegotiationRound> rounds;

    @Column(name = "convergence_score", nullable = false)
    private double convergenceScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "current_proposal")
    private ProposalTerms currentProposal;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "final_proposal")
    private ProposalTerms finalProposal;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "incentive_split", nullable = false)
    private IncentiveSplit incentiveSplit;

    @Min(1)
    @Max(MAX_ROUNDS_CEILING)
    @Column(name = "max_rounds", nullable = false)
    private int maxRounds;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected NegotiationSession() {}

    /**
     * Opens a session seeded with the initiator's proposal as round 1.
     * A null proposal yields a session with no rounds and no current proposal.
     */
    public static NegotiationSession create(
            String intentId,
            String initiatorDid,
            String responderDid,
            ProposalTerms initialProposal,
            IncentiveSplit incentiveSplit,
            int maxRounds,
            Instant createdAt,
            Instant expiresAt) {

        if (initiatorDid.equals(responderDid)) {
            throw new IllegalArgumentException("Initiator and responder must be different agents");
        }
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expires_at must be after created_at");
        }

        var session = new NegotiationSession();
        session.intentId = intentId;
        session.initiatorDid = initiatorDid;
        session.responderDid = responderDid;
        session.state = NegotiationState.INITIATED;
        session.rounds = new ArrayList<>();
        if (initialProposal != null) {
            session.rounds.add(new NegotiationRound(1, initiatorDid, initialProposal, createdAt.toEpochMilli(), null));
        }
        session.convergenceScore = 0.0;
        session.currentProposal = initialProposal;
        session.incentiveSplit = incentiveSplit != null ? incentiveSplit : IncentiveSplit.DEFAULT;
        session.maxRounds = maxRounds;
        session.createdAt = createdAt;
        session.expiresAt = expiresAt;
        session.updatedAt = createdAt;
        return session;
    }

    public boolean isParticipant(String did) {
        return initiatorDid.equals(did) || responderDid.equals(did);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Number of proposal rounds, excluding the rejection marker.
     */
    public int proposalRoundCount() {
        return (int) rounds.stream().filter(r -> !r.isRejection()).count();
    }

    public void appendProposal(NegotiationRound round, double newConvergenceScore, NegotiationState nextState, Instant now) {
        requireOpen();
        if (proposalRoundCount() + 1 > maxRounds) {
            throw new IllegalStateException("Round limit reached: " + maxRounds);
        }
        List<NegotiationRound> updated = new ArrayList<>(rounds);
        updated.add(round);
        this.rounds = updated;
        this.convergenceScore = newConvergenceScore;
        this.currentProposal = round.proposal();
        this.state = nextState;
        this.updatedAt = now;
    }

    public void accept(ProposalTerms stampedCurrent, IncentiveSplit agreedSplit, Instant now) {
        requireOpen();
        this.finalProposal = this.currentProposal;
        this.currentProposal = stampedCurrent;
        if (agreedSplit != null) {
            this.incentiveSplit = agreedSplit;
        }
        this.state = NegotiationState.ACCEPTED;
        this.updatedAt = now;
    }

    public void reject(NegotiationRound rejectionRound, Instant now) {
        requireOpen();
        List<NegotiationRound> updated = new ArrayList<>(rounds);
        updated.add(rejectionRound);
        this.rounds = updated;
        this.state = NegotiationState.REJECTED;
        this.updatedAt = now;
    }

    /**
     * Moves the reservation stamp to {@code settled_credits} so the reservation cannot be settled twice.
     */
    public void markSettled(long settledAmount, Instant now) {
        if (state != NegotiationState.ACCEPTED) {
            throw new IllegalStateException("Only accepted negotiations can be settled");
        }
        this.currentProposal = currentProposal
                .withoutCustomTerm(ProposalTerms.RESERVED_CREDITS)
                .withCustomTerm(ProposalTerms.SETTLED_CREDITS, Long.toString(settledAmount));
        this.updatedAt = now;
    }

    private void requireOpen() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Negotiation " + id + " is already " + state.wireName());
        }
    }

    // Getters
    public UUID getId() { return id; }
    public String getIntentId() { return intentId; }
    public String getInitiatorDid() { return initiatorDid; }
    public String getResponderDid() { return responderDid; }
    public NegotiationState getState() { return state; }
    public List<NegotiationRound> getRounds() { return Collections.unmodifiableList(rounds); }
    public double getConvergenceScore() { return convergenceScore; }
    public ProposalTerms getCurrentProposal() { return currentProposal; }
    public ProposalTerms getFinalProposal() { return finalProposal; }
    public IncentiveSplit getIncentiveSplit() { return incentiveSplit; }
    public int getMaxRounds() { return maxRounds; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public enum NegotiationState {
        INITIATED, PROPOSED, COUNTER_PROPOSED, ACCEPTED, REJECTED, EXPIRED;

        public boolean isTerminal() {
            return this == ACCEPTED || this == REJECTED || this == EXPIRED;
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
