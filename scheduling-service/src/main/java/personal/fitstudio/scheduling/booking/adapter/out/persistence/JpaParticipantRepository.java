package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Spring Data JPA Repository for Participant
 */
public interface JpaParticipantRepository extends JpaRepository<ParticipantEntity, Long> {

    List<ParticipantEntity> findBySessionIdOrderByIdAsc(Long sessionId);

    boolean existsByMemberId(Long memberId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ParticipantEntity p WHERE p.sessionId = :sessionId")
    int deleteAllBySessionId(@Param("sessionId") Long sessionId);
}
