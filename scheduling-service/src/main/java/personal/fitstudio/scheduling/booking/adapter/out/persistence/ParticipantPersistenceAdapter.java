package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.port.out.ParticipantRepository;
import personal.fitstudio.scheduling.booking.domain.model.Participant;

import java.util.List;

/**
 * Participant Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParticipantPersistenceAdapter implements ParticipantRepository {

    private final JpaParticipantRepository jpaParticipantRepository;

    @Override
    public List<Participant> findBySessionId(Long sessionId) {
        return jpaParticipantRepository.findBySessionIdOrderByIdAsc(sessionId)
                .stream()
                .map(ParticipantEntity::toDomain)
                .toList();
    }

    @Override
    public Participant save(Participant participant) {
        log.debug("Saving participant: participantId={}, sessionId={}, status={}, position={}",
                participant.id(), participant.sessionId(), participant.bookingStatus(), participant.waitlistPosition());
        ParticipantEntity saved = jpaParticipantRepository.save(ParticipantEntity.fromDomain(participant));
        return saved.toDomain();
    }

    @Override
    public void deleteById(Long participantId) {
        log.debug("Deleting participant: participantId={}", participantId);
        jpaParticipantRepository.deleteById(participantId);
    }

    @Override
    public void deleteBySessionId(Long sessionId) {
        int deleted = jpaParticipantRepository.deleteAllBySessionId(sessionId);
        log.debug("Deleted {} participants of session {}", deleted, sessionId);
    }

    @Override
    public boolean existsByMemberId(Long memberId) {
        return jpaParticipantRepository.existsByMemberId(memberId);
    }
}
