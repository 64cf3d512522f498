package com.ainp.core.repository;

import com.ainp.core.domain.CreditAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface CreditAccountRepository extends JpaRepository<CreditAccount, String> {

    /**
     * Loads an account with an exclusive row lock for a read-check-write.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM CreditAccount a WHERE a.agentDid = :agentDid")
    Optional<CreditAccount> findForUpdate(@Param("agentDid") String agentDid);

    /**
     * Inserts a fresh account unless one already exists. Concurrent callers for the same
     * DID see exactly one insert succeed; the others get 0 and leave their transaction usable.
     *
     * @return 1 if this call created the account, 0 otherwise
     */
    @Modifying
    @Query(value = """
            INSERT INTO credit_accounts (agent_did, balance, reserved, earned, spent, created_at, updated_at, version)
            VALUES (:agentDid, :balance, 0, 0, 0, :now, :now, 0)
            ON CONFLICT DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("agentDid") String agentDid, @Param("balance") long balance, @Param("now") Instant now);
}
