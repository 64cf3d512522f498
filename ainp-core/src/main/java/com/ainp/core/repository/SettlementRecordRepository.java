package com.ainp.core.repository;

import com.ainp.core.domain.SettlementRecord;
import com.ainp.core.domain.SettlementRecord.SettlementStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SettlementRecordRepository extends JpaRepository<SettlementRecord, UUID> {

    Optional<SettlementRecord> findByNegotiationId(UUID negotiationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SettlementRecord s WHERE s.id = :id")
    Optional<SettlementRecord> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT s.id FROM SettlementRecord s WHERE s.status = :status ORDER BY s.createdAt ASC")
    List<UUID> findIdsByStatus(@Param("status") SettlementStatus status);
}
