package personal.fitstudio.scheduling.booking.application.port.in;

import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.StatusChangeResult;

/**
 * Manage Session UseCase (Input Port)
 * 세션 단위 관리 작업 (모두 세션 행 락 안에서 수행)
 */
public interface ManageSessionUseCase {

    /**
     * 정원 변경 (늘리면 대기자 승급, 줄여도 강등 없음)
     */
    StatusChangeResult changeCapacity(Long sessionId, int newMaxParticipants);

    /**
     * 세션 상태 변경 (CANCELLED는 활성 참가자 일괄 취소)
     */
    StatusChangeResult updateSessionStatus(Long sessionId, SessionStatus newStatus);

    RescheduleResult rescheduleSession(RescheduleSessionCommand command);

    void deleteSession(Long sessionId);
}
