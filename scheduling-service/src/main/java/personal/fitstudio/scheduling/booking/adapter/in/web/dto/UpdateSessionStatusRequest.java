package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;

/**
 * 세션 상태 변경 요청 DTO
 */
public record UpdateSessionStatusRequest(
        @NotNull(message = "변경할 세션 상태는 필수입니다.")
        SessionStatus status
) {
}
