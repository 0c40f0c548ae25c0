package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import personal.fitstudio.scheduling.booking.application.port.in.BookingResult;
import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;

/**
 * 예약 생성 응답 DTO
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookingResponse(
        Long sessionId,
        Long participantId,
        Long memberId,
        BookingStatus bookingStatus,
        Integer waitlistPosition,
        AvailabilityResponse availability
) {
    public static BookingResponse from(BookingResult result) {
        return new BookingResponse(
                result.sessionId(),
                result.participantId(),
                result.memberId(),
                result.bookingStatus(),
                result.waitlistPosition(),
                AvailabilityResponse.from(result.availability()));
    }
}
