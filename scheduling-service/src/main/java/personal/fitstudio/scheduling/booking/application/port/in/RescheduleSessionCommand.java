package personal.fitstudio.scheduling.booking.application.port.in;

import java.time.Instant;

/**
 * Reschedule Session Command
 *
 * @param trainerId null이면 기존 트레이너 유지
 * @param machineId null이면 기존 머신 유지
 */
public record RescheduleSessionCommand(
        Long sessionId,
        Instant scheduledStart,
        Instant scheduledEnd,
        Long trainerId,
        Long machineId
) {
}
