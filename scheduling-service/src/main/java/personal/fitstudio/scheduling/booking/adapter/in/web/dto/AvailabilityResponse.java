package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import personal.fitstudio.scheduling.booking.domain.model.AvailabilityCheck;

import java.util.List;

/**
 * 자원 중복 검사 응답 DTO
 */
public record AvailabilityResponse(
        boolean available,
        String message,
        List<SessionResponse> conflicts
) {
    public static AvailabilityResponse from(AvailabilityCheck check) {
        if (check == null) {
            return null;
        }
        return new AvailabilityResponse(
                check.available(),
                check.message(),
                check.conflicts().stream().map(SessionResponse::from).toList());
    }
}
