package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;

/**
 * 참가자 상태 변경 요청 DTO
 */
public record UpdateParticipantStatusRequest(
        @NotNull(message = "변경할 예약 상태는 필수입니다.")
        BookingStatus status
) {
}
