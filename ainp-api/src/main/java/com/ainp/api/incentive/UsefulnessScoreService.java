package com.ainp.api.incentive;

import com.ainp.api.common.ValidationException;
import com.ainp.core.domain.AgentUsefulness;
import com.ainp.core.repository.AgentUsefulnessRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Maintains the per-agent usefulness score cache used for reward distribution.
 */
@Service
public class UsefulnessScoreService {

    private static final Logger log = LoggerFactory.getLogger(UsefulnessScoreService.class);

    private final AgentUsefulnessRepository usefulnessRepository;
    private final Clock clock;

    public UsefulnessScoreService(AgentUsefulnessRepository usefulnessRepository, Clock clock) {
        this.usefulnessRepository = usefulnessRepository;
        this.clock = clock;
    }

    /**
     * Stores the latest aggregated score, clamped to [0, 100].
     */
    @Transactional
    public UsefulnessDto recordScore(String agentDid, double score) {
        if (agentDid == null || agentDid.isBlank()) {
            throw new ValidationException("agent_did is required");
        }
        if (Double.isNaN(score)) {
            throw new ValidationException("score must be a number");
        }

        Instant now = Instant.now(clock);
        AgentUsefulness usefulness = usefulnessRepository.findById(agentDid)
                .orElseGet(() -> AgentUsefulness.create(agentDid, now));
        usefulness.recordScore(score, now);
        AgentUsefulness saved = usefulnessRepository.save(usefulness);

        log.debug("Usefulness score for {} set to {}", agentDid, saved.getUsefulnessScoreCached());
        return UsefulnessDto.from(saved);
    }

    @Transactional(readOnly = true)
    public Optional<UsefulnessDto> getScore(String agentDid) {
        return usefulnessRepository.findById(agentDid).map(UsefulnessDto::from);
    }

    public record UsefulnessDto(String agentDid, double usefulnessScore, long totalProofs, Instant updatedAt) {
        static UsefulnessDto from(AgentUsefulness usefulness) {
            return new UsefulnessDto(
                    usefulness.getAgentDid(),
                    usefulness.getUsefulnessScoreCached(),
                    usefulness.getTotalProofs(),
                    usefulness.getUpdatedAt());
        }
    }
}
