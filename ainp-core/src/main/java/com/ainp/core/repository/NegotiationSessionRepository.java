package com.ainp.core.repository;

import com.ainp.core.domain.NegotiationSession;
import com.ainp.core.domain.NegotiationSession.NegotiationState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for negotiation sessions.
 * Mutations go through {@link #findByIdForUpdate(UUID)} so rounds are appended under a row lock.
 */
@Repository
public interface NegotiationSessionRepository extends JpaRepository<NegotiationSession, UUID> {

    /**
     * Loads a session with SELECT ... FOR UPDATE.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT n FROM NegotiationSession n WHERE n.id = :id")
    Optional<NegotiationSession> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT n FROM NegotiationSession n WHERE n.initiatorDid = :did OR n.responderDid = :did " +
           "ORDER BY n.createdAt DESC")
    List<NegotiationSession> findByParticipant(@Param("did") String did);

    @Query("SELECT n FROM NegotiationSession n WHERE (n.initiatorDid = :did OR n.responderDid = :did) " +
           "AND n.state = :state ORDER BY n.createdAt DESC")
    List<NegotiationSession> findByParticipantAndState(
            @Param("did") String did,
            @Param("state") NegotiationState state);

    /**
     * Bulk update of open sessions whose expiry has been reached to EXPIRED.
     * Returns count of updated records.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE NegotiationSession n SET n.state = :expired, n.updatedAt = :now, n.version = n.version + 1 " +
           "WHERE n.state IN :openStates AND n.expiresAt <= :now")
    int markExpired(
            @Param("expired") NegotiationState expired,
            @Param("openStates") Collection<NegotiationState> openStates,
            @Param("now") Instant now);
}
