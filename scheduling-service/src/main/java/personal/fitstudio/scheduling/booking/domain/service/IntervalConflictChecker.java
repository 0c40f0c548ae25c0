package personal.fitstudio.scheduling.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.config.SchedulingProperties;
import personal.fitstudio.scheduling.booking.application.port.out.TrainingSessionRepository;
import personal.fitstudio.scheduling.booking.domain.exception.BookingValidationException;
import personal.fitstudio.scheduling.booking.domain.model.AvailabilityCheck;
import personal.fitstudio.scheduling.booking.domain.model.ResourceRef;
import personal.fitstudio.scheduling.booking.domain.model.TimeInterval;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;

/**
 * Interval Conflict Checker
 * 트레이너/머신 중복 예약 검사 (권고용, 예약을 막지 않음)
 * 입력 오류나 저장소 장애 시 예외 대신 "확인 불가" 결과로 완화
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntervalConflictChecker {

    private final TrainingSessionRepository sessionRepository;
    private final SchedulingProperties properties;

    public AvailabilityCheck checkAvailability(ResourceRef resource, Instant start, Instant end, Long excludeSessionId) {
        if (resource == null || !resource.isWellFormed()) {
            log.warn("Availability check skipped, resource is missing: resource={}", resource);
            return AvailabilityCheck.unverified();
        }
        TimeInterval interval = new TimeInterval(start, end);
        if (!interval.isWellFormed()) {
            log.warn("Availability check skipped, malformed interval: resource={}, start={}, end={}",
                    resource, start, end);
            return AvailabilityCheck.unverified();
        }

        try {
            // 저장소 결과를 한 번 더 걸러 반열린 구간 규칙을 보장
            List<TrainingSession> conflicts = sessionRepository
                    .findOverlapping(resource, start, end, excludeSessionId)
                    .stream()
                    .filter(session -> !session.isCancelled())
                    .filter(session -> excludeSessionId == null || !excludeSessionId.equals(session.id()))
                    .filter(resource::isBoundTo)
                    .filter(session -> interval.overlaps(session.interval()))
                    .sorted(Comparator.comparing(TrainingSession::scheduledStart))
                    .toList();

            log.debug("Availability checked: resource={}, start={}, end={}, conflicts={}",
                    resource, start, end, conflicts.size());
            return AvailabilityCheck.of(resource.type(), conflicts);

        } catch (Exception e) {
            log.error("Availability check failed, returning unverified result: resource={}, start={}, end={}",
                    resource, start, end, e);
            return AvailabilityCheck.unverified();
        }
    }

    /**
     * 자원의 하루 일정 (스튜디오 현지 날짜 기준, 취소 제외, 시작 시각순)
     */
    public List<TrainingSession> getDaySchedule(ResourceRef resource, LocalDate date) {
        if (resource == null || !resource.isWellFormed() || date == null) {
            throw new BookingValidationException("Resource and date are required");
        }
        ZoneId zone = properties.studio().zone();
        Instant from = date.atStartOfDay(zone).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(zone).toInstant();

        return sessionRepository.findActiveStartingBetween(resource, from, to);
    }
}
