package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;
import personal.fitstudio.scheduling.booking.domain.model.GuestDetails;
import personal.fitstudio.scheduling.booking.domain.model.Participant;

import java.time.Instant;

/**
 * 세션 참가자 응답 DTO
 */
public record ParticipantResponse(
        Long participantId,
        Long sessionId,
        Long memberId,
        String guestFirstName,
        String guestLastName,
        String guestGymName,
        BookingStatus bookingStatus,
        Integer waitlistPosition,
        Instant createdAt
) {
    public static ParticipantResponse from(Participant participant) {
        GuestDetails guest = participant.guest();
        return new ParticipantResponse(
                participant.id(),
                participant.sessionId(),
                participant.memberId(),
                guest != null ? guest.firstName() : null,
                guest != null ? guest.lastName() : null,
                guest != null ? guest.gymName() : null,
                participant.bookingStatus(),
                participant.waitlistPosition(),
                participant.createdAt()
        );
    }
}
