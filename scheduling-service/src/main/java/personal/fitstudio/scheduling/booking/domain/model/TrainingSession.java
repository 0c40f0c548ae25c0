package personal.fitstudio.scheduling.booking.domain.model;

import personal.fitstudio.scheduling.booking.domain.exception.BookingValidationException;
import personal.fitstudio.scheduling.booking.domain.exception.InvalidStatusTransitionException;

import java.time.Instant;

/**
 * Training Session Domain Model
 * 하나의 머신(필수)과 트레이너(선택)에 묶인 시간 블록 (불변)
 * currentParticipants는 WaitlistStateMachine만 변경
 */
public record TrainingSession(
        Long id,
        Long machineId,
        Long trainerId,
        Instant scheduledStart,
        Instant scheduledEnd,
        SessionStatus status,
        SessionType sessionType,
        int maxParticipants,
        int currentParticipants,
        String notes,
        Instant createdAt) {

    public TrainingSession {
        if (machineId == null) {
            throw new BookingValidationException("Machine ID cannot be null");
        }
        if (scheduledStart == null || scheduledEnd == null) {
            throw new BookingValidationException("Session start and end time are required");
        }
        if (!scheduledEnd.isAfter(scheduledStart)) {
            throw new BookingValidationException("Session end time must be later than start time");
        }
        if (status == null) {
            throw new BookingValidationException("Session status cannot be null");
        }
        if (sessionType == null) {
            throw new BookingValidationException("Session type cannot be null");
        }
        if (maxParticipants < 1) {
            throw new BookingValidationException("Max participants must be at least 1");
        }
        if (currentParticipants < 0) {
            throw new BookingValidationException("Current participants cannot be negative");
        }
    }

    /**
     * 세션 생성 (정적 팩토리 메서드)
     *
     * @return 새로운 세션 (SCHEDULED, 참가자 0명)
     */
    public static TrainingSession create(Long machineId, Long trainerId, TimeInterval interval,
                                         SessionType sessionType, int maxParticipants, String notes) {
        return new TrainingSession(
                null,
                machineId,
                trainerId,
                interval.start(),
                interval.end(),
                SessionStatus.SCHEDULED,
                sessionType,
                maxParticipants,
                0,
                notes,
                Instant.now());
    }

    public TimeInterval interval() {
        return new TimeInterval(scheduledStart, scheduledEnd);
    }

    /**
     * 신규 확정 가능 여부
     * 정원이 현재 확정 인원 아래로 줄어든 경우에도 false
     */
    public boolean hasOpenSeat() {
        return currentParticipants < maxParticipants;
    }

    public boolean isCancelled() {
        return status == SessionStatus.CANCELLED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public TrainingSession withCurrentParticipants(int count) {
        return new TrainingSession(id, machineId, trainerId, scheduledStart, scheduledEnd,
                status, sessionType, maxParticipants, count, notes, createdAt);
    }

    public TrainingSession withMaxParticipants(int newMax) {
        return new TrainingSession(id, machineId, trainerId, scheduledStart, scheduledEnd,
                status, sessionType, newMax, currentParticipants, notes, createdAt);
    }

    /**
     * 세션 상태 전이 (단방향)
     */
    public TrainingSession transitionTo(SessionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStatusTransitionException(status, next);
        }
        return new TrainingSession(id, machineId, trainerId, scheduledStart, scheduledEnd,
                next, sessionType, maxParticipants, currentParticipants, notes, createdAt);
    }

    /**
     * 일정/자원 변경
     */
    public TrainingSession reschedule(TimeInterval interval, Long newTrainerId, Long newMachineId) {
        if (isTerminal()) {
            throw new BookingValidationException(
                    String.format("Cannot reschedule session in %s status. Session ID: %d", status, id));
        }
        return new TrainingSession(id, newMachineId, newTrainerId, interval.start(), interval.end(),
                status, sessionType, maxParticipants, currentParticipants, notes, createdAt);
    }
}
