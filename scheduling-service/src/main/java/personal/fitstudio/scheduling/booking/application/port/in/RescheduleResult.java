package personal.fitstudio.scheduling.booking.application.port.in;

import personal.fitstudio.scheduling.booking.domain.model.AvailabilityCheck;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

/**
 * @param availability 변경된 일정의 트레이너 중복 검사 결과 (권고용, 트레이너 없으면 null)
 */
public record RescheduleResult(
        TrainingSession session,
        AvailabilityCheck availability
) {
}
