package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.fitstudio.scheduling.booking.application.port.in.RescheduleSessionCommand;

import java.time.Instant;

/**
 * 세션 일정 변경 요청 DTO (트레이너/머신은 생략 시 유지)
 */
public record RescheduleSessionRequest(
        @NotNull(message = "시작 시각은 필수입니다.")
        Instant scheduledStart,

        @NotNull(message = "종료 시각은 필수입니다.")
        Instant scheduledEnd,

        Long trainerId,
        Long machineId
) {
    public RescheduleSessionCommand toCommand(Long sessionId) {
        return new RescheduleSessionCommand(sessionId, scheduledStart, scheduledEnd, trainerId, machineId);
    }
}
