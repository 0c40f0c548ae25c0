package personal.fitstudio.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.fitstudio.scheduling.booking.application.port.in.CheckAvailabilityUseCase;
import personal.fitstudio.scheduling.booking.domain.model.AvailabilityCheck;
import personal.fitstudio.scheduling.booking.domain.model.ResourceRef;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;
import personal.fitstudio.scheduling.booking.domain.service.IntervalConflictChecker;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Availability Query Service
 * 자원 중복 검사/하루 일정 조회 (읽기 전용)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityQueryService implements CheckAvailabilityUseCase {

    private final IntervalConflictChecker conflictChecker;

    @Override
    public AvailabilityCheck checkAvailability(ResourceRef resource, Instant start, Instant end, Long excludeSessionId) {
        return conflictChecker.checkAvailability(resource, start, end, excludeSessionId);
    }

    @Override
    public List<TrainingSession> getDaySchedule(ResourceRef resource, LocalDate date) {
        List<TrainingSession> sessions = conflictChecker.getDaySchedule(resource, date);
        log.debug("Found {} sessions for {} on {}", sessions.size(), resource, date);
        return sessions;
    }
}
