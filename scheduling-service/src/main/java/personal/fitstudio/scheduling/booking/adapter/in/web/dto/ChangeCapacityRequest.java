package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * 세션 정원 변경 요청 DTO
 */
public record ChangeCapacityRequest(
        @NotNull(message = "정원은 필수입니다.")
        @Min(value = 1, message = "정원은 1명 이상이어야 합니다.")
        Integer maxParticipants
) {
}
