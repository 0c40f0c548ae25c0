package personal.fitstudio.scheduling.booking.domain.exception;

import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.common.exception.ErrorCode;

/**
 * Participant Not Found Exception
 */
public class ParticipantNotFoundException extends BusinessException {

    public ParticipantNotFoundException(Long sessionId, Long participantId) {
        super(ErrorCode.PARTICIPANT_NOT_FOUND,
                String.format("Participant not found: sessionId=%d, participantId=%d", sessionId, participantId));
    }

    public static ParticipantNotFoundException forMember(Long sessionId, Long memberId) {
        return new ParticipantNotFoundException(
                String.format("No booking for member in session: sessionId=%d, memberId=%d", sessionId, memberId));
    }

    private ParticipantNotFoundException(String detail) {
        super(ErrorCode.PARTICIPANT_NOT_FOUND, detail);
    }
}
