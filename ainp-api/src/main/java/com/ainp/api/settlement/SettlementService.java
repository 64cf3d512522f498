package com.ainp.api.settlement;

import com.ainp.api.config.BrokerConfig;
import com.ainp.api.credit.CreditLedgerService;
import com.ainp.api.incentive.IncentiveDistributionService;
import com.ainp.api.incentive.IncentiveDistributionService.DistributionParams;
import com.ainp.api.incentive.IncentiveDistributionService.DistributionResult;
import com.ainp.api.negotiation.InvalidStateTransitionException;
import com.ainp.api.negotiation.NegotiationNotFoundException;
import com.ainp.core.domain.NegotiationSession;
import com.ainp.core.domain.NegotiationSession.NegotiationState;
import com.ainp.core.domain.SettlementRecord;
import com.ainp.core.domain.SettlementRecord.SettlementStatus;
import com.ainp.core.repository.NegotiationSessionRepository;
import com.ainp.core.repository.SettlementRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Settles accepted negotiations after their work has been validated.
 *
 * Phase one releases the initiator's reservation as spent, moves the reservation stamp
 * and writes a PENDING_DISTRIBUTION record, all in one transaction. Phase two distributes
 * the released amount in its own transaction and completes the record. A record left pending
 * by a failed phase two is retried by {@link #reconcilePendingDistributions()}.
 */
@Service
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final NegotiationSessionRepository negotiationRepository;
    private final SettlementRecordRepository settlementRepository;
    private final CreditLedgerService creditLedgerService;
    private final IncentiveDistributionService distributionService;
    private final BrokerConfig brokerConfig;
    private final Clock clock;
    private final TransactionTemplate txTemplate;

    public SettlementService(
            NegotiationSessionRepository negotiationRepository,
            SettlementRecordRepository settlementRepository,
            CreditLedgerService creditLedgerService,
            IncentiveDistributionService distributionService,
            BrokerConfig brokerConfig,
            Clock clock,
            PlatformTransactionManager txManager) {
        this.negotiationRepository = negotiationRepository;
        this.settlementRepository = settlementRepository;
        this.creditLedgerService = creditLedgerService;
        this.distributionService = distributionService;
        this.brokerConfig = brokerConfig;
        this.clock = clock;
        this.txTemplate = new TransactionTemplate(txManager);
    }

    /**
     * Settles an accepted negotiation.
     *
     * @param validatorDid optional validator receiving the validator share
     * @param usefulnessProofId optional proof attached to the agent's earn entry
     * @return SKIPPED when the credit ledger is disabled, otherwise the completed settlement
     * @throws SettlementException when nothing is reserved, or when distribution fails after release
     */
    public SettlementResult settle(UUID negotiationId, String validatorDid, String usefulnessProofId) {
        UUID settlementId = txTemplate.execute(status -> releaseReservation(negotiationId, validatorDid, usefulnessProofId));
        if (settlementId == null) {
            return SettlementResult.skipped(negotiationId);
        }
        return distributePending(settlementId);
    }

    /**
     * Retries distribution for every pending settlement. Returns the number completed.
     */
    @Scheduled(
            fixedDelayString = "${ainp.settlement.reconcile-interval-ms:300000}",
            initialDelayString = "${ainp.settlement.reconcile-interval-ms:300000}")
    public int reconcilePendingDistributions() {
        List<UUID> pending = settlementRepository.findIdsByStatus(SettlementStatus.PENDING_DISTRIBUTION);
        if (pending.isEmpty()) {
            return 0;
        }

        int completed = 0;
        for (UUID settlementId : pending) {
            try {
                SettlementResult result = distributePending(settlementId);
                if (result.status() == SettlementResult.Status.COMPLETED) {
                    completed++;
                }
            } catch (SettlementException e) {
                log.warn("Reconciliation of settlement {} failed, will retry: {}", settlementId, e.getMessage());
            }
        }
        log.info("Reconciled {} of {} pending settlements", completed, pending.size());
        return completed;
    }

    @Transactional(readOnly = true)
    public Optional<SettlementResult> getSettlement(UUID negotiationId) {
        return settlementRepository.findByNegotiationId(negotiationId).map(SettlementResult::from);
    }

    /**
     * Phase one. Returns the pending settlement id, or null when credit settlement is disabled.
     */
    private UUID releaseReservation(UUID negotiationId, String validatorDid, String usefulnessProofId) {
        NegotiationSession session = negotiationRepository.findByIdForUpdate(negotiationId)
                .orElseThrow(() -> new NegotiationNotFoundException(negotiationId));

        if (session.getState() != NegotiationState.ACCEPTED) {
            throw new InvalidStateTransitionException(session.getState(), "settle");
        }
        if (!brokerConfig.isCreditLedgerEnabled()) {
            log.warn("Credit ledger disabled, skipping settlement of negotiation {}", negotiationId);
            return null;
        }

        long reserved = session.getCurrentProposal() == null ? 0L : session.getCurrentProposal().reservedCredits();
        if (reserved <= 0) {
            throw new SettlementException("No credits reserved for this negotiation", null);
        }

        Instant now = Instant.now(clock);
        creditLedgerService.release(session.getInitiatorDid(), reserved, reserved, session.getIntentId());
        session.markSettled(reserved, now);
        negotiationRepository.save(session);

        SettlementRecord record = settlementRepository.save(SettlementRecord.pending(
                negotiationId,
                session.getIntentId(),
                session.getInitiatorDid(),
                session.getResponderDid(),
                brokerConfig.getBrokerDid(),
                validatorDid,
                usefulnessProofId,
                reserved,
                session.getIncentiveSplit(),
                now));

        log.info("Released {} units from {} for negotiation {}, settlement {} pending distribution",
                reserved, session.getInitiatorDid(), negotiationId, record.getId());
        return record.getId();
    }

    /**
     * Phase two. Completes the record or leaves it pending with the failure recorded.
     */
    private SettlementResult distributePending(UUID settlementId) {
        try {
            return txTemplate.execute(status -> {
                SettlementRecord record = settlementRepository.findByIdForUpdate(settlementId)
                        .orElseThrow(() -> new SettlementException("Settlement not found: " + settlementId, settlementId));
                if (!record.isPending()) {
                    return SettlementResult.from(record);
                }

                DistributionResult result = distributionService.distribute(new DistributionParams(
                        record.getIntentId(),
                        record.getTotalAmount(),
                        record.getAgentDid(),
                        record.getBrokerDid(),
                        record.getValidatorDid(),
                        record.getIncentiveSplit(),
                        record.getUsefulnessProofId()));

                var distributed = result.distributed();
                record.complete(distributed.agent(), distributed.broker(), distributed.validator(),
                        distributed.pool(), Instant.now(clock));
                SettlementRecord saved = settlementRepository.save(record);

                log.info("Settlement {} for negotiation {} distributed: agent={} broker={} validator={} pool={}",
                        settlementId, record.getNegotiationId(), distributed.agent(), distributed.broker(),
                        distributed.validator(), distributed.pool());
                return SettlementResult.from(saved);
            });
        } catch (RuntimeException e) {
            log.error("Settlement {} released but not distributed", settlementId, e);
            recordFailure(settlementId, e);
            throw new SettlementException(
                    "Credits released but distribution failed for settlement " + settlementId + ": " + e.getMessage(),
                    settlementId, e);
        }
    }

    private void recordFailure(UUID settlementId, RuntimeException cause) {
        try {
            txTemplate.executeWithoutResult(status -> settlementRepository.findByIdForUpdate(settlementId)
                    .ifPresent(record -> {
                        record.recordFailure(cause.getMessage());
                        settlementRepository.save(record);
                    }));
        } catch (RuntimeException e) {
            log.error("Could not record distribution failure for settlement {}", settlementId, e);
            cause.addSuppressed(e);
        }
    }

    public record SettlementResult(
            UUID negotiationId,
            UUID settlementId,
            Status status,
            long totalAmount,
            long agentAmount,
            long brokerAmount,
            long validatorAmount,
            long poolAmount,
            String agentDid,
            String brokerDid,
            String validatorDid,
            int attempts,
            String lastError,
            Instant distributedAt
    ) {
        public enum Status {
            SKIPPED, PENDING_DISTRIBUTION, COMPLETED
        }

        static SettlementResult skipped(UUID negotiationId) {
            return new SettlementResult(negotiationId, null, Status.SKIPPED,
                    0L, 0L, 0L, 0L, 0L, null, null, null, 0, null, null);
        }

        static SettlementResult from(SettlementRecord record) {
            return new SettlementResult(
                    record.getNegotiationId(),
                    record.getId(),
                    record.getStatus() == SettlementStatus.COMPLETED ? Status.COMPLETED : Status.PENDING_DISTRIBUTION,
                    record.getTotalAmount(),
                    record.getAgentAmount(),
                    record.getBrokerAmount(),
                    record.getValidatorAmount(),
                    record.getPoolAmount(),
                    record.getAgentDid(),
                    record.getBrokerDid(),
                    record.getValidatorDid(),
                    record.getAttempts(),
                    record.getLastError(),
                    record.getDistributedAt()
            );
        }
    }

    /**
     * Settlement failure. Carries the settlement id when credits were already released.
     */
    public static class SettlementException extends RuntimeException {
        private final UUID settlementId;

        public SettlementException(String message, UUID settlementId) {
            super(message);
            this.settlementId = settlementId;
        }

        public SettlementException(String message, UUID settlementId, Throwable cause) {
            super(message, cause);
            this.settlementId = settlementId;
        }

        public UUID getSettlementId() { return settlementId; }
    }
}
