package personal.fitstudio.scheduling.booking.domain.exception;

import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.common.exception.ErrorCode;

/**
 * Concurrent Booking Exception
 * 세션 단위 락 획득 실패 또는 락 대기 시간 초과 (재시도 가능)
 */
public class ConcurrentBookingException extends BusinessException {
    public ConcurrentBookingException(Long sessionId) {
        super(ErrorCode.CONCURRENT_BOOKING,
                String.format("Concurrent modification detected for session: sessionId=%d", sessionId));
    }
}
