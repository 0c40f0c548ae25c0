package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.port.out.TrainingSessionRepository;
import personal.fitstudio.scheduling.booking.domain.model.ResourceRef;
import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Training Session Persistence Adapter
 * JPA를 사용한 세션 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrainingSessionPersistenceAdapter implements TrainingSessionRepository {

    private static final List<SessionStatus> NON_TERMINAL = List.of(SessionStatus.SCHEDULED, SessionStatus.IN_PROGRESS);

    private final JpaTrainingSessionRepository jpaSessionRepository;

    @Override
    public Optional<TrainingSession> findById(Long sessionId) {
        log.debug("Finding session by id: {}", sessionId);
        return jpaSessionRepository.findById(sessionId)
                .map(TrainingSessionEntity::toDomain);
    }

    @Override
    public Optional<TrainingSession> findByIdForUpdate(Long sessionId) {
        log.debug("Locking session row: {}", sessionId);
        return jpaSessionRepository.findByIdForUpdate(sessionId)
                .map(TrainingSessionEntity::toDomain);
    }

    @Override
    public TrainingSession save(TrainingSession session) {
        log.debug("Saving session: sessionId={}, status={}, seats={}/{}",
                session.id(), session.status(), session.currentParticipants(), session.maxParticipants());
        TrainingSessionEntity saved = jpaSessionRepository.save(TrainingSessionEntity.fromDomain(session));
        return saved.toDomain();
    }

    @Override
    public List<TrainingSession> findOverlapping(ResourceRef resource, Instant start, Instant end, Long excludeSessionId) {
        List<TrainingSessionEntity> overlapping = switch (resource.type()) {
            case TRAINER -> jpaSessionRepository.findTrainerOverlapping(
                    resource.id(), start, end, SessionStatus.CANCELLED);
            case MACHINE -> jpaSessionRepository.findMachineOverlapping(
                    resource.id(), start, end, SessionStatus.CANCELLED);
        };
        return overlapping.stream()
                .filter(entity -> excludeSessionId == null || !excludeSessionId.equals(entity.getId()))
                .map(TrainingSessionEntity::toDomain)
                .toList();
    }

    @Override
    public long countActiveStartingBetween(Instant from, Instant to, Collection<SessionType> types) {
        if (types.isEmpty()) {
            return 0;
        }
        return jpaSessionRepository.countStartingBetween(from, to, SessionStatus.CANCELLED, types);
    }

    @Override
    public List<TrainingSession> findActiveStartingBetween(ResourceRef resource, Instant from, Instant to) {
        List<TrainingSessionEntity> sessions = switch (resource.type()) {
            case TRAINER -> jpaSessionRepository.findTrainerStartingBetween(
                    resource.id(), from, to, SessionStatus.CANCELLED);
            case MACHINE -> jpaSessionRepository.findMachineStartingBetween(
                    resource.id(), from, to, SessionStatus.CANCELLED);
        };
        return sessions.stream()
                .map(TrainingSessionEntity::toDomain)
                .toList();
    }

    @Override
    public List<Long> findNonTerminalSessionIds() {
        return jpaSessionRepository.findIdsByStatusIn(NON_TERMINAL);
    }

    @Override
    public void deleteById(Long sessionId) {
        jpaSessionRepository.deleteById(sessionId);
    }
}
