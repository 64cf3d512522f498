package com.ainp.api.negotiation;

import com.ainp.api.common.ValidationException;
import com.ainp.api.config.BrokerConfig;
import com.ainp.api.credit.CreditLedgerService;
import com.ainp.api.settlement.SettlementService;
import com.ainp.core.domain.IncentiveSplit;
import com.ainp.core.domain.NegotiationRound;
import com.ainp.core.domain.NegotiationSession;
import com.ainp.core.domain.NegotiationSession.NegotiationState;
import com.ainp.core.domain.ProposalTerms;
import com.ainp.core.repository.NegotiationSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Multi-round negotiation state machine.
 *
 * initiated -> proposed -> counter_proposed (repeatable) -> accepted | rejected | expired
 *
 * Accepting reserves the agreed price from the initiator's credit account in the same
 * transaction; settlement after validated work is delegated to {@link SettlementService}.
 */
@Service
public class NegotiationService {

    private static final Logger log = LoggerFactory.getLogger(NegotiationService.class);

    private static final Set<NegotiationState> OPEN_STATES =
            EnumSet.of(NegotiationState.INITIATED, NegotiationState.PROPOSED, NegotiationState.COUNTER_PROPOSED);
    private static final Set<NegotiationState> ACCEPTABLE_STATES =
            EnumSet.of(NegotiationState.PROPOSED, NegotiationState.COUNTER_PROPOSED);

    private final NegotiationSessionRepository negotiationRepository;
    private final CreditLedgerService creditLedgerService;
    private final SettlementService settlementService;
    private final ConvergenceCalculator convergenceCalculator;
    private final BrokerConfig brokerConfig;
    private final Clock clock;

    public NegotiationService(
            NegotiationSessionRepository negotiationRepository,
            CreditLedgerService creditLedgerService,
            SettlementService settlementService,
            ConvergenceCalculator convergenceCalculator,
            BrokerConfig brokerConfig,
            Clock clock) {
        this.negotiationRepository = negotiationRepository;
        this.creditLedgerService = creditLedgerService;
        this.settlementService = settlementService;
        this.convergenceCalculator = convergenceCalculator;
        this.brokerConfig = brokerConfig;
        this.clock = clock;
    }

    /**
     * Opens a session with the initiator's proposal as round 1.
     *
     * @param maxRounds proposal round limit, defaults to {@code ainp.broker.default-max-rounds} when null
     * @param ttlMinutes lifetime, defaults to {@code ainp.broker.default-ttl-minutes} when null
     */
    @Transactional
    public NegotiationDto initiate(
            String intentId,
            String initiatorDid,
            String responderDid,
            ProposalTerms initialProposal,
            Integer maxRounds,
            Integer ttlMinutes) {

        if (!brokerConfig.isNegotiationEnabled()) {
            throw new ValidationException("Negotiation protocol is disabled");
        }
        requireText(intentId, "intent_id");
        requireText(initiatorDid, "initiator_did");
        requireText(responderDid, "responder_did");
        if (initiatorDid.equals(responderDid)) {
            throw new ValidationException("Initiator and responder must be different agents");
        }

        int rounds = maxRounds != null ? maxRounds : brokerConfig.getDefaultMaxRounds();
        if (rounds < 1 || rounds > brokerConfig.getMaxRoundsLimit()) {
            throw new ValidationException("max_rounds must be between 1 and " + brokerConfig.getMaxRoundsLimit());
        }
        int ttl = ttlMinutes != null ? ttlMinutes : brokerConfig.getDefaultTtlMinutes();
        if (ttl <= 0) {
            throw new ValidationException("ttl_minutes must be positive");
        }
        if (initialProposal == null) {
            throw new ValidationException("initial_proposal is required");
        }
        validateProposal(initialProposal);

        Instant now = Instant.now(clock);
        NegotiationSession session = NegotiationSession.create(
                intentId,
                initiatorDid,
                responderDid,
                initialProposal,
                initialProposal.incentiveSplit(),
                rounds,
                now,
                now.plus(Duration.ofMinutes(ttl)));
        NegotiationSession saved = negotiationRepository.save(session);

        log.info("Negotiation {} initiated for intent {} between {} and {} (max {} rounds, ttl {} min)",
                saved.getId(), intentId, initiatorDid, responderDid, rounds, ttl);
        return NegotiationDto.from(saved);
    }

    @Transactional
    public NegotiationDto propose(UUID negotiationId, String proposerDid, ProposalTerms proposal) {
        NegotiationSession session = lockSession(negotiationId);
        Instant now = Instant.now(clock);

        if (session.isExpiredAt(now)) {
            throw new ExpiredNegotiationException(negotiationId, session.getExpiresAt());
        }
        if (!OPEN_STATES.contains(session.getState())) {
            throw new InvalidStateTransitionException(session.getState(), "propose");
        }
        if (session.proposalRoundCount() + 1 > session.getMaxRounds()) {
            throw new MaxRoundsExceededException(negotiationId, session.getMaxRounds());
        }
        requireParticipant(session, proposerDid, "Proposer");
        if (proposal == null) {
            throw new ValidationException("proposal is required");
        }
        validateProposal(proposal);

        double delta = session.getCurrentProposal() == null
                ? 0.0
                : convergenceCalculator.similarity(session.getCurrentProposal(), proposal);
        int roundNumber = session.getRounds().size() + 1;
        NegotiationRound round = new NegotiationRound(roundNumber, proposerDid, proposal, now.toEpochMilli(), delta);

        List<NegotiationRound> withNewRound = new ArrayList<>(session.getRounds());
        withNewRound.add(round);
        double score = convergenceCalculator.sessionScore(withNewRound);

        NegotiationState nextState = session.getState() == NegotiationState.INITIATED
                ? NegotiationState.PROPOSED
                : NegotiationState.COUNTER_PROPOSED;
        session.appendProposal(round, score, nextState, now);
        NegotiationSession saved = negotiationRepository.save(session);

        log.info("Negotiation {} round {} proposed by {} (state {}, convergence {})",
                negotiationId, roundNumber, proposerDid, nextState.wireName(), score);
        return NegotiationDto.from(saved);
    }

    /**
     * Accepts the current proposal. A positive price is reserved from the initiator first;
     * a failed reservation leaves the session unchanged.
     */
    @Transactional
    public NegotiationDto accept(UUID negotiationId, String acceptorDid) {
        NegotiationSession session = lockSession(negotiationId);
        Instant now = Instant.now(clock);

        if (session.isExpiredAt(now)) {
            throw new ExpiredNegotiationException(negotiationId, session.getExpiresAt());
        }
        ProposalTerms current = session.getCurrentProposal();
        if (current == null) {
            throw new ValidationException("No current proposal to accept");
        }
        if (!ACCEPTABLE_STATES.contains(session.getState())) {
            throw new InvalidStateTransitionException(session.getState(), "accept");
        }
        requireParticipant(session, acceptorDid, "Acceptor");

        long reserved = 0L;
        if (brokerConfig.isCreditLedgerEnabled() && current.price() != null && current.price() > 0) {
            reserved = toAtomicUnits(current.price());
            if (reserved > 0) {
                creditLedgerService.reserve(session.getInitiatorDid(), reserved, session.getIntentId());
                log.info("Reserved {} units from {} for negotiation {}",
                        reserved, session.getInitiatorDid(), negotiationId);
            }
        }

        ProposalTerms stamped = reserved > 0
                ? current.withCustomTerm(ProposalTerms.RESERVED_CREDITS, Long.toString(reserved))
                : current;
        session.accept(stamped, current.incentiveSplit(), now);
        NegotiationSession saved = negotiationRepository.save(session);

        log.info("Negotiation {} accepted by {} after {} rounds", negotiationId, acceptorDid, saved.getRounds().size());
        return NegotiationDto.from(saved);
    }

    @Transactional
    public NegotiationDto reject(UUID negotiationId, String rejectorDid, String reason) {
        NegotiationSession session = lockSession(negotiationId);
        requireParticipant(session, rejectorDid, "Rejector");
        if (session.isTerminal()) {
            throw new InvalidStateTransitionException(session.getState(), "reject");
        }

        Instant now = Instant.now(clock);
        NegotiationRound rejection = new NegotiationRound(
                session.getRounds().size() + 1,
                rejectorDid,
                ProposalTerms.rejection(reason),
                now.toEpochMilli(),
                null);
        session.reject(rejection, now);
        NegotiationSession saved = negotiationRepository.save(session);

        log.info("Negotiation {} rejected by {}: {}", negotiationId, rejectorDid, reason);
        return NegotiationDto.from(saved);
    }

    /**
     * Releases the reservation of an accepted negotiation and distributes it.
     */
    public SettlementService.SettlementResult settle(UUID negotiationId, String validatorDid, String usefulnessProofId) {
        return settlementService.settle(negotiationId, validatorDid, usefulnessProofId);
    }

    @Transactional(readOnly = true)
    public Optional<NegotiationDto> getSession(UUID negotiationId) {
        return negotiationRepository.findById(negotiationId).map(NegotiationDto::from);
    }

    /**
     * Sessions where the agent is initiator or responder, newest first.
     */
    @Transactional(readOnly = true)
    public List<NegotiationDto> getSessionsByAgent(String agentDid, NegotiationState state) {
        List<NegotiationSession> sessions = state == null
                ? negotiationRepository.findByParticipant(agentDid)
                : negotiationRepository.findByParticipantAndState(agentDid, state);
        return sessions.stream().map(NegotiationDto::from).toList();
    }

    /**
     * Moves every open session past its expiry to EXPIRED.
     */
    @Transactional
    @Scheduled(fixedDelayString = "${ainp.negotiation.expiry-sweep-interval-ms:60000}")
    public int expireStaleNegotiations() {
        int expired = negotiationRepository.markExpired(NegotiationState.EXPIRED, OPEN_STATES, Instant.now(clock));
        if (expired > 0) {
            log.info("Expired {} stale negotiations", expired);
        }
        return expired;
    }

    /**
     * floor(price * atomic-unit-scale), computed on the decimal form of the price.
     */
    private boolean exceedsLedgerRange(double price) {
        return BigDecimal.valueOf(price)
                .multiply(BigDecimal.valueOf(brokerConfig.getAtomicUnitScale()))
                .compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0;
    }

    long toAtomicUnits(double price) {
        return BigDecimal.valueOf(price)
                .multiply(BigDecimal.valueOf(brokerConfig.getAtomicUnitScale()))
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
    }

    private NegotiationSession lockSession(UUID negotiationId) {
        return negotiationRepository.findByIdForUpdate(negotiationId)
                .orElseThrow(() -> new NegotiationNotFoundException(negotiationId));
    }

    private static void requireParticipant(NegotiationSession session, String did, String role) {
        if (did == null || !session.isParticipant(did)) {
            throw new ValidationException(role + " " + did + " is not a participant in this negotiation");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private void validateProposal(ProposalTerms proposal) {
        if (proposal.price() != null && (proposal.price() < 0 || proposal.price().isNaN() || proposal.price().isInfinite())) {
            throw new ValidationException("price must be a non-negative number");
        }
        if (proposal.price() != null && exceedsLedgerRange(proposal.price())) {
            throw new ValidationException("price exceeds the largest amount the credit ledger can hold");
        }
        if (proposal.deliveryTime() != null && (proposal.deliveryTime() < 0 || proposal.deliveryTime().isNaN())) {
            throw new ValidationException("delivery_time must be non-negative");
        }
        if (proposal.qualitySla() != null && !(proposal.qualitySla() >= 0 && proposal.qualitySla() <= 1)) {
            throw new ValidationException("quality_sla must be between 0 and 1");
        }
        if (proposal.incentiveSplit() != null && !proposal.incentiveSplit().isValid()) {
            throw new ValidationException("Invalid incentive split: fractions must be non-negative and sum to 1.0");
        }
    }

    public record NegotiationDto(
            UUID id,
            String intentId,
            String initiatorDid,
            String responderDid,
            NegotiationState state,
            List<NegotiationRound> rounds,
            double convergenceScore,
            ProposalTerms currentProposal,
            ProposalTerms finalProposal,
            IncentiveSplit incentiveSplit,
            int maxRounds,
            Instant createdAt,
            Instant expiresAt,
            Instant updatedAt
    ) {
        static NegotiationDto from(NegotiationSession session) {
            return new NegotiationDto(
                    session.getId(),
                    session.getIntentId(),
                    session.getInitiatorDid(),
                    session.getResponderDid(),
                    session.getState(),
                    List.copyOf(session.getRounds()),
                    session.getConvergenceScore(),
                    session.getCurrentProposal(),
                    session.getFinalProposal(),
                    session.getIncentiveSplit(),
                    session.getMaxRounds(),
                    session.getCreatedAt(),
                    session.getExpiresAt(),
                    session.getUpdatedAt()
            );
        }
    }
}
