package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 예약 처리 단계 (실패 응답에 단계명을 포함)
 */
public enum BookingStep {
    CLASSIFY,
    VALIDATE_REQUEST,
    RESOLVE_MEMBER,
    CHECK_AVAILABILITY,
    CHECK_QUOTA,
    ACQUIRE_LOCK,
    CREATE_SESSION,
    ADMIT_PARTICIPANT,
    TRANSITION
}
