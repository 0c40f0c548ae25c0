package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import personal.fitstudio.scheduling.booking.application.port.in.RescheduleResult;

/**
 * 세션 일정 변경 응답 DTO
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RescheduleResponse(
        SessionResponse session,
        AvailabilityResponse availability
) {
    public static RescheduleResponse from(RescheduleResult result) {
        return new RescheduleResponse(
                SessionResponse.from(result.session()),
                AvailabilityResponse.from(result.availability()));
    }
}
