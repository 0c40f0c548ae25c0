package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for TrainingSession
 */
public interface JpaTrainingSessionRepository extends JpaRepository<TrainingSessionEntity, Long> {

    /**
     * 세션 행 락 (SELECT ... FOR UPDATE, 3초 대기)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT s FROM TrainingSessionEntity s WHERE s.id = :id")
    Optional<TrainingSessionEntity> findByIdForUpdate(@Param("id") Long id);

    /**
     * 트레이너의 겹치는 세션 (반열린 구간: s.start < end AND s.end > start)
     */
    @Query("SELECT s FROM TrainingSessionEntity s " +
            "WHERE s.trainerId = :trainerId AND s.status <> :excluded " +
            "AND s.scheduledStart < :end AND s.scheduledEnd > :start " +
            "ORDER BY s.scheduledStart")
    List<TrainingSessionEntity> findTrainerOverlapping(@Param("trainerId") Long trainerId,
                                                       @Param("start") Instant start,
                                                       @Param("end") Instant end,
                                                       @Param("excluded") SessionStatus excluded);

    @Query("SELECT s FROM TrainingSessionEntity s " +
            "WHERE s.machineId = :machineId AND s.status <> :excluded " +
            "AND s.scheduledStart < :end AND s.scheduledEnd > :start " +
            "ORDER BY s.scheduledStart")
    List<TrainingSessionEntity> findMachineOverlapping(@Param("machineId") Long machineId,
                                                       @Param("start") Instant start,
                                                       @Param("end") Instant end,
                                                       @Param("excluded") SessionStatus excluded);

    @Query("SELECT COUNT(s) FROM TrainingSessionEntity s " +
            "WHERE s.scheduledStart >= :from AND s.scheduledStart < :to " +
            "AND s.status <> :excluded AND s.sessionType IN :types")
    long countStartingBetween(@Param("from") Instant from,
                              @Param("to") Instant to,
                              @Param("excluded") SessionStatus excluded,
                              @Param("types") Collection<SessionType> types);

    @Query("SELECT s FROM TrainingSessionEntity s " +
            "WHERE s.trainerId = :trainerId AND s.status <> :excluded " +
            "AND s.scheduledStart >= :from AND s.scheduledStart < :to " +
            "ORDER BY s.scheduledStart")
    List<TrainingSessionEntity> findTrainerStartingBetween(@Param("trainerId") Long trainerId,
                                                           @Param("from") Instant from,
                                                           @Param("to") Instant to,
                                                           @Param("excluded") SessionStatus excluded);

    @Query("SELECT s FROM TrainingSessionEntity s " +
            "WHERE s.machineId = :machineId AND s.status <> :excluded " +
            "AND s.scheduledStart >= :from AND s.scheduledStart < :to " +
            "ORDER BY s.scheduledStart")
    List<TrainingSessionEntity> findMachineStartingBetween(@Param("machineId") Long machineId,
                                                           @Param("from") Instant from,
                                                           @Param("to") Instant to,
                                                           @Param("excluded") SessionStatus excluded);

    @Query("SELECT s.id FROM TrainingSessionEntity s WHERE s.status IN :statuses ORDER BY s.id")
    List<Long> findIdsByStatusIn(@Param("statuses") Collection<SessionStatus> statuses);
}
