package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

import personal.fitstudio.scheduling.booking.domain.model.CapacityTier;
import personal.fitstudio.scheduling.booking.domain.model.StudioQuota;

/**
 * 주간 스튜디오 한도 응답 DTO
 */
public record StudioQuotaResponse(
        long currentCount,
        int maxAllowed,
        boolean canBook,
        int percentage,
        CapacityTier tier
) {
    public static StudioQuotaResponse from(StudioQuota quota) {
        return new StudioQuotaResponse(
                quota.currentCount(),
                quota.maxAllowed(),
                quota.canBook(),
                quota.percentage(),
                quota.tier());
    }
}
