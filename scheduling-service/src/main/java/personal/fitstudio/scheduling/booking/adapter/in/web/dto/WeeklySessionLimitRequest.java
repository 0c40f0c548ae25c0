package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 주간 세션 한도 변경 요청 DTO
 */
public record WeeklySessionLimitRequest(
        @NotNull(message = "주간 한도는 필수입니다.")
        @PositiveOrZero(message = "주간 한도는 0 이상이어야 합니다.")
        Integer limit
) {
}
