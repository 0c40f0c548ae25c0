package personal.fitstudio.scheduling.booking.application.port.out;

import personal.fitstudio.scheduling.booking.domain.model.ResourceRef;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Training Session Repository (Output Port)
 */
public interface TrainingSessionRepository {

    Optional<TrainingSession> findById(Long sessionId);

    /**
     * 비관적 쓰기 락으로 세션 조회 (SELECT ... FOR UPDATE)
     * 락 대기 시간 초과 시 PessimisticLockingFailureException
     */
    Optional<TrainingSession> findByIdForUpdate(Long sessionId);

    TrainingSession save(TrainingSession session);

    /**
     * 자원에 묶인 취소되지 않은 세션 중 [start, end)와 겹치는 세션
     *
     * @param excludeSessionId 제외할 세션 ID (null 허용)
     */
    List<TrainingSession> findOverlapping(ResourceRef resource, Instant start, Instant end, Long excludeSessionId);

    /**
     * [from, to) 구간에 시작하는 취소되지 않은 세션 수
     */
    long countActiveStartingBetween(Instant from, Instant to, Collection<SessionType> types);

    /**
     * [from, to) 구간에 시작하는 자원의 취소되지 않은 세션 (시작 시각순)
     */
    List<TrainingSession> findActiveStartingBetween(ResourceRef resource, Instant from, Instant to);

    /**
     * 종료되지 않은 세션 ID 목록 (카운터 보정 대상)
     */
    List<Long> findNonTerminalSessionIds();

    void deleteById(Long sessionId);
}
