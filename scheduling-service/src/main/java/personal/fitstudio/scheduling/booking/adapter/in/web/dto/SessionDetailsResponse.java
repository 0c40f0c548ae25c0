package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import personal.fitstudio.scheduling.booking.domain.model.SessionDetails;

import java.util.List;

/**
 * 세션 상세 응답 DTO (확정 -> 대기 순번 -> 그 외)
 */
public record SessionDetailsResponse(
        SessionResponse session,
        List<ParticipantResponse> participants
) {
    public static SessionDetailsResponse from(SessionDetails details) {
        return new SessionDetailsResponse(
                SessionResponse.from(details.session()),
                details.participants().stream().map(ParticipantResponse::from).toList());
    }
}
