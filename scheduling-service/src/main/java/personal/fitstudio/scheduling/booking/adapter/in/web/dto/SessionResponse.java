package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.time.Instant;

/**
 * 세션 응답 DTO
 */
public record SessionResponse(
        Long sessionId,
        Long machineId,
        Long trainerId,
        Instant scheduledStart,
        Instant scheduledEnd,
        SessionStatus status,
        SessionType sessionType,
        int maxParticipants,
        int currentParticipants,
        String notes,
        Instant createdAt
) {
    public static SessionResponse from(TrainingSession session) {
        return new SessionResponse(
                session.id(),
                session.machineId(),
                session.trainerId(),
                session.scheduledStart(),
                session.scheduledEnd(),
                session.status(),
                session.sessionType(),
                session.maxParticipants(),
                session.currentParticipants(),
                session.notes(),
                session.createdAt()
        );
    }
}
