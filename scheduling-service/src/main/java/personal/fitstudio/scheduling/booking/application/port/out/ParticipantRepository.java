package personal.fitstudio.scheduling.booking.application.port.out;

import personal.fitstudio.scheduling.booking.domain.model.Participant;

import java.util.List;

/**
 * Participant Repository (Output Port)
 */
public interface ParticipantRepository {

    List<Participant> findBySessionId(Long sessionId);

    Participant save(Participant participant);

    void deleteById(Long participantId);

    void deleteBySessionId(Long sessionId);

    /**
     * 회원의 예약 이력 존재 여부 (상태 무관)
     */
    boolean existsByMemberId(Long memberId);
}
