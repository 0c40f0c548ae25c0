package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 주간 사용률 표시 단계 (엔진 판단에는 사용하지 않음)
 */
public enum CapacityTier {
    NOMINAL,
    WARNING,
    CRITICAL;

    public static CapacityTier of(int percentage) {
        if (percentage >= 95) {
            return CRITICAL;
        }
        if (percentage >= 80) {
            return WARNING;
        }
        return NOMINAL;
    }
}
