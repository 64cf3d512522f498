package com.ainp.core.repository;

import com.ainp.core.domain.AgentUsefulness;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AgentUsefulnessRepository extends JpaRepository<AgentUsefulness, String> {

    /**
     * Agents eligible for usefulness rewards, highest score first.
     */
    @Query("SELECT u FROM AgentUsefulness u WHERE u.usefulnessScoreCached >= :minScore " +
           "ORDER BY u.usefulnessScoreCached DESC, u.agentDid ASC")
    List<AgentUsefulness> findEligible(@Param("minScore") double minScore);
}
