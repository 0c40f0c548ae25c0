package personal.fitstudio.scheduling.booking.application.port.in;

import personal.fitstudio.scheduling.booking.domain.model.AvailabilityCheck;
import personal.fitstudio.scheduling.booking.domain.model.ResourceRef;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Check Availability UseCase (Input Port)
 */
public interface CheckAvailabilityUseCase {

    /**
     * 자원 중복 예약 검사 (예외 없이 항상 결과 반환)
     */
    AvailabilityCheck checkAvailability(ResourceRef resource, Instant start, Instant end, Long excludeSessionId);

    List<TrainingSession> getDaySchedule(ResourceRef resource, LocalDate date);
}
