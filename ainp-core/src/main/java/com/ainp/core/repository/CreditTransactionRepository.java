package com.ainp.core.repository;

import com.ainp.core.domain.CreditTransaction;
import com.ainp.core.domain.CreditTransaction.TransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Append-only transaction log. Entries are inserted, never updated or deleted.
 */
@Repository
public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, Long> {

    /**
     * Newest first; id breaks ties between entries written in the same instant.
     */
    @Query(value = "SELECT * FROM credit_transactions WHERE agent_did = :agentDid " +
                   "ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset",
           nativeQuery = true)
    List<CreditTransaction> findHistory(
            @Param("agentDid") String agentDid,
            @Param("limit") int limit,
            @Param("offset") int offset);

    List<CreditTransaction> findByIntentIdOrderByIdAsc(String intentId);

    List<CreditTransaction> findByAgentDidAndTxTypeOrderByIdAsc(String agentDid, TransactionType txType);
}
