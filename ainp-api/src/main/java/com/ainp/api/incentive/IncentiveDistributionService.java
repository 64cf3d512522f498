package com.ainp.api.incentive;

import com.ainp.api.common.ValidationException;
import com.ainp.api.credit.CreditLedgerService;
import com.ainp.core.domain.AgentUsefulness;
import com.ainp.core.domain.IncentiveSplit;
import com.ainp.core.repository.AgentUsefulnessRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Pays out settled credits according to an incentive split, and distributes
 * usefulness reward pools in proportion to cached usefulness scores.
 *
 * All amounts are atomic units. Shares are floored; the split remainder goes to the pool,
 * which is accounted for but not credited to any account.
 */
@Service
public class IncentiveDistributionService {

    private static final Logger log = LoggerFactory.getLogger(IncentiveDistributionService.class);

    public static final String USEFULNESS_REWARD_INTENT = "usefulness_reward";
    public static final double DEFAULT_MIN_SCORE = 10.0;

    private final CreditLedgerService creditLedgerService;
    private final AgentUsefulnessRepository usefulnessRepository;

    public IncentiveDistributionService(
            CreditLedgerService creditLedgerService,
            AgentUsefulnessRepository usefulnessRepository) {
        this.creditLedgerService = creditLedgerService;
        this.usefulnessRepository = usefulnessRepository;
    }

    /**
     * Splits {@code totalAmount} between agent, broker, validator and pool.
     * The agent is always credited; broker and validator only when present with a non-zero share.
     */
    @Transactional
    public DistributionResult distribute(DistributionParams params) {
        IncentiveSplit split = params.incentiveSplit();
        if (split == null || !split.sumsToOne()) {
            throw new ValidationException("Invalid incentive split: totals "
                    + (split == null ? "null" : split.total()) + ", expected 1.0");
        }
        if (!split.isValid()) {
            throw new ValidationException("Invalid incentive split: fractions must be non-negative");
        }
        if (params.totalAmount() < 0) {
            throw new ValidationException("total_amount must be non-negative");
        }
        if (params.agentDid() == null || params.agentDid().isBlank()) {
            throw new ValidationException("agent_did is required");
        }

        Distributed distributed = allocate(params.totalAmount(), split);

        creditLedgerService.earn(params.agentDid(), distributed.agent(), params.intentId(), params.usefulnessProofId());
        log.info("Credits distributed to agent {}: {} (intent {}, proof {})",
                params.agentDid(), distributed.agent(), params.intentId(), params.usefulnessProofId());

        if (hasText(params.brokerDid()) && distributed.broker() > 0) {
            creditLedgerService.earn(params.brokerDid(), distributed.broker(), params.intentId(), null);
            log.info("Credits distributed to broker {}: {} (intent {})",
                    params.brokerDid(), distributed.broker(), params.intentId());
        }

        if (hasText(params.validatorDid()) && distributed.validator() > 0) {
            creditLedgerService.earn(params.validatorDid(), distributed.validator(), params.intentId(), null);
            log.info("Credits distributed to validator {}: {} (intent {})",
                    params.validatorDid(), distributed.validator(), params.intentId());
        }

        if (distributed.pool() > 0) {
            log.info("Pool amount allocated for intent {}: {}", params.intentId(), distributed.pool());
        }

        return new DistributionResult(
                params.intentId(),
                params.totalAmount(),
                distributed,
                new Recipients(params.agentDid(), params.brokerDid(), params.validatorDid()));
    }

    /**
     * Shares {@code rewardPool} among agents whose cached score is at least {@code minScore},
     * each receiving floor(pool * score / total score). The flooring shortfall stays undistributed.
     */
    @Transactional
    public UsefulnessRewardResult distributeUsefulnessRewards(long rewardPool, double minScore) {
        if (rewardPool < 0) {
            throw new ValidationException("reward_pool must be non-negative");
        }

        List<AgentUsefulness> eligible = usefulnessRepository.findEligible(minScore);
        if (eligible.isEmpty()) {
            log.info("No agents eligible for usefulness rewards (min score {})", minScore);
            return UsefulnessRewardResult.empty();
        }

        BigDecimal totalScore = eligible.stream()
                .map(u -> BigDecimal.valueOf(u.getUsefulnessScoreCached()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalScore.signum() == 0) {
            log.info("Usefulness scores sum to zero, nothing distributed");
            return UsefulnessRewardResult.empty();
        }

        BigDecimal pool = BigDecimal.valueOf(rewardPool);
        List<UsefulnessRecipient> recipients = new ArrayList<>();
        long totalDistributed = 0L;
        for (AgentUsefulness usefulness : eligible) {
            long amount = pool.multiply(BigDecimal.valueOf(usefulness.getUsefulnessScoreCached()))
                    .divide(totalScore, 0, RoundingMode.FLOOR)
                    .longValueExact();
            if (amount == 0) {
                continue;
            }
            creditLedgerService.earn(usefulness.getAgentDid(), amount, USEFULNESS_REWARD_INTENT, null);
            recipients.add(new UsefulnessRecipient(
                    usefulness.getAgentDid(), usefulness.getUsefulnessScoreCached(), amount));
            totalDistributed += amount;
        }

        log.info("Distributed {} of {} usefulness reward units to {} agents",
                totalDistributed, rewardPool, recipients.size());
        return new UsefulnessRewardResult(totalDistributed, recipients);
    }

    /**
     * Floors each share against the total. Broker and validator shares are capped at what is
     * left so the four amounts always add up to {@code total}, even for a split summing to
     * slightly above 1.0 within tolerance.
     */
    static Distributed allocate(long total, IncentiveSplit split) {
        long agent = Math.min(floorShare(total, split.agent()), total);
        long broker = Math.min(floorShare(total, split.broker()), total - agent);
        long validator = Math.min(floorShare(total, split.validator()), total - agent - broker);
        long pool = total - agent - broker - validator;
        return new Distributed(agent, broker, validator, pool);
    }

    private static long floorShare(long total, double fraction) {
        return BigDecimal.valueOf(total)
                .multiply(BigDecimal.valueOf(fraction))
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public record DistributionParams(
            String intentId,
            long totalAmount,
            String agentDid,
            String brokerDid,
            String validatorDid,
            IncentiveSplit incentiveSplit,
            String usefulnessProofId
    ) {}

    public record Distributed(long agent, long broker, long validator, long pool) {
        public long total() {
            return agent + broker + validator + pool;
        }
    }

    public record Recipients(String agentDid, String brokerDid, String validatorDid) {}

    public record DistributionResult(
            String intentId,
            long totalAmount,
            Distributed distributed,
            Recipients recipients
    ) {}

    public record UsefulnessRecipient(String agentDid, double score, long amount) {}

    public record UsefulnessRewardResult(long totalDistributed, List<UsefulnessRecipient> recipients) {
        static UsefulnessRewardResult empty() {
            return new UsefulnessRewardResult(0L, List.of());
        }
    }
}
