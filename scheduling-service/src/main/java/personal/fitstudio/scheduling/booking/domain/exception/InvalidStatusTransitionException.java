package personal.fitstudio.scheduling.booking.domain.exception;

import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.common.exception.ErrorCode;

/**
 * Invalid Status Transition Exception
 * 예약/세션 상태 머신이 허용하지 않는 전이 요청
 */
public class InvalidStatusTransitionException extends BusinessException {
    public InvalidStatusTransitionException(Enum<?> current, Enum<?> requested) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Cannot transition from %s to %s", current, requested));
    }
}
