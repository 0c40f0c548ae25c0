package personal.fitstudio.scheduling.booking.domain.exception;

import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.common.exception.ErrorCode;

/**
 * Booking Validation Exception
 * 쓰기 이전 단계에서 거부되는 입력 오류 (호출자가 입력을 고쳐 재요청)
 */
public class BookingValidationException extends BusinessException {
    public BookingValidationException(String detail) {
        super(ErrorCode.BOOKING_VALIDATION_FAILED, detail);
    }
}
