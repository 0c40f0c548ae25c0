package personal.fitstudio.scheduling.booking.application.port.in;

import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;
import personal.fitstudio.scheduling.booking.domain.model.StatusChangeResult;

/**
 * Update Participant Status UseCase (Input Port)
 * 취소/노쇼 처리 및 대기 참가자 삭제, 빈 좌석은 같은 트랜잭션에서 대기 1순위에게 승급
 */
public interface UpdateParticipantStatusUseCase {

    StatusChangeResult updateParticipantStatus(Long sessionId, Long memberId, BookingStatus newStatus);

    /**
     * 참가자 ID 기준 상태 변경 (회원 ID가 없는 게스트 참가자용)
     */
    StatusChangeResult updateParticipantStatusById(Long sessionId, Long participantId, BookingStatus newStatus);

    StatusChangeResult removeWaitlistedParticipant(Long sessionId, Long participantId);
}
