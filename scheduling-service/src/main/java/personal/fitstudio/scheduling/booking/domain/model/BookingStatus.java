package personal.fitstudio.scheduling.booking.domain.model;

/**
 * Booking Status Enum
 * 세션 참가자 예약 상태
 */
public enum BookingStatus {
    /**
     * 좌석 확보 (current_participants 집계 대상)
     */
    CONFIRMED,

    /**
     * 대기열 (waitlist_position 보유)
     */
    WAITLISTED,

    /**
     * 취소
     */
    CANCELLED,

    /**
     * 노쇼
     */
    NO_SHOW;

    public boolean isActive() {
        return this == CONFIRMED || this == WAITLISTED;
    }

    /**
     * 명시적 상태 변경 허용 여부
     * 대기 -> 확정 전환은 승급(promotion)으로만 발생하므로 여기서 허용하지 않음
     */
    public boolean canTransitionTo(BookingStatus next) {
        return switch (this) {
            case CONFIRMED -> next == CANCELLED || next == NO_SHOW;
            case WAITLISTED -> next == CANCELLED;
            case CANCELLED, NO_SHOW -> false;
        };
    }
}
