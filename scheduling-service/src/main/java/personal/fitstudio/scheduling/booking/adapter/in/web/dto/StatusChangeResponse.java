package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import personal.fitstudio.scheduling.booking.domain.model.StatusChangeResult;

import java.util.List;

/**
 * 상태 변경 응답 DTO
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusChangeResponse(
        ParticipantResponse participant,
        List<ParticipantResponse> promoted,
        SessionResponse session
) {
    public static StatusChangeResponse from(StatusChangeResult result) {
        return new StatusChangeResponse(
                result.participant() != null ? ParticipantResponse.from(result.participant()) : null,
                result.promoted().stream().map(ParticipantResponse::from).toList(),
                SessionResponse.from(result.session()));
    }
}
