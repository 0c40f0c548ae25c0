package personal.fitstudio.scheduling.booking.application.port.in;

import personal.fitstudio.scheduling.booking.domain.model.GuestDetails;
import personal.fitstudio.scheduling.booking.domain.model.NewMemberDetails;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;

import java.time.Instant;

/**
 * Create Booking Command
 * sessionId가 있으면 기존 세션 참가, 없으면 세션 생성 후 참가
 * 필드 검증은 BookingService의 VALIDATE_REQUEST 단계에서 수행
 */
public record CreateBookingCommand(
        Long sessionId,
        SessionType sessionType,
        Long machineId,
        Long trainerId,
        Instant scheduledStart,
        Instant scheduledEnd,
        Integer maxParticipants,
        String notes,
        Long memberId,
        NewMemberDetails newMember,
        GuestDetails guest
) {
    public static final int DEFAULT_MAX_PARTICIPANTS = 1;

    public boolean joinsExistingSession() {
        return sessionId != null;
    }

    public int maxParticipantsOrDefault() {
        return maxParticipants != null ? maxParticipants : DEFAULT_MAX_PARTICIPANTS;
    }
}
