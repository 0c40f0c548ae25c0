package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 주간 스튜디오 한도 조회 결과
 *
 * @param currentCount 구간 내 집계 대상 세션 수 (취소 제외)
 * @param maxAllowed   주간 한도
 * @param canBook      currentCount < maxAllowed
 * @param percentage   사용률 (초과 시 100 이상 그대로 보고)
 */
public record StudioQuota(
        long currentCount,
        int maxAllowed,
        boolean canBook,
        int percentage
) {
    public static StudioQuota of(long currentCount, int maxAllowed) {
        if (maxAllowed <= 0) {
            return new StudioQuota(currentCount, maxAllowed, false, 100);
        }
        int percentage = (int) Math.round((double) currentCount / maxAllowed * 100);
        return new StudioQuota(currentCount, maxAllowed, currentCount < maxAllowed, percentage);
    }

    public CapacityTier tier() {
        return CapacityTier.of(percentage);
    }
}
