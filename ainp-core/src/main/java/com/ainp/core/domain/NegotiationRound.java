package com.ainp.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One proposal submitted by one party. Timestamps are epoch milliseconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NegotiationRound(
        @JsonProperty("round_number") int roundNumber,
        @JsonProperty("proposer_did") String proposerDid,
        @JsonProperty("proposal") ProposalTerms proposal,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("convergence_delta") Double convergenceDelta
) {

    /**
     * True for the terminal pseudo-round appended on rejection.
     */
    @JsonIgnore
    public boolean isRejection() {
        return proposal != null && Boolean.TRUE.equals(proposal.customTerms().get(ProposalTerms.REJECTED));
    }
}
