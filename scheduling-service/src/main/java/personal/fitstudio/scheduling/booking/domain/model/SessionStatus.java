package personal.fitstudio.scheduling.booking.domain.model;

/**
 * Session Status Enum
 * SCHEDULED -> IN_PROGRESS -> COMPLETED 순으로만 진행, 종료 전에는 언제든 CANCELLED 가능
 */
public enum SessionStatus {
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(SessionStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == CANCELLED) {
            return true;
        }
        return next.ordinal() > this.ordinal();
    }
}
