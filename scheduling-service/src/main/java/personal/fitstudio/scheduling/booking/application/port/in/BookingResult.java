package personal.fitstudio.scheduling.booking.application.port.in;

import personal.fitstudio.scheduling.booking.domain.model.AvailabilityCheck;
import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;

/**
 * 예약 결과
 *
 * @param participantId   참가자 ID (회원 없는 예약 불가 시간대이면 null)
 * @param availability    트레이너 중복 검사 결과 (권고용, 트레이너 미지정/기존 세션 참가 시 null)
 */
public record BookingResult(
        Long sessionId,
        Long participantId,
        Long memberId,
        BookingStatus bookingStatus,
        Integer waitlistPosition,
        AvailabilityCheck availability
) {
}
