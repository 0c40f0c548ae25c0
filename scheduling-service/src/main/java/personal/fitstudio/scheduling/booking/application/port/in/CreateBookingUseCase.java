package personal.fitstudio.scheduling.booking.application.port.in;

/**
 * Create Booking UseCase (Input Port)
 */
public interface CreateBookingUseCase {

    /**
     * 예약 생성
     * 분류 -> 요청 검증 -> 회원 확인 -> 트레이너 중복 검사(권고) -> 주간 한도 -> 세션 생성 + 참가자 등록
     *
     * @throws personal.fitstudio.scheduling.booking.domain.exception.BookingValidationException 요청/회원 구분 오류
     * @throws personal.fitstudio.scheduling.booking.domain.exception.MemberNotFoundException 회원 없음
     * @throws personal.fitstudio.scheduling.booking.domain.exception.WeeklyQuotaExceededException 주간 한도 초과
     * @throws personal.fitstudio.scheduling.booking.domain.exception.ConcurrentBookingException 세션 락 획득 실패 (재시도 가능)
     */
    BookingResult createBooking(CreateBookingCommand command);
}
