package personal.fitstudio.scheduling.booking.domain.exception;

import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.common.exception.ErrorCode;
import personal.fitstudio.scheduling.booking.domain.model.StudioQuota;

/**
 * Weekly Quota Exceeded Exception
 * 주간 스튜디오 세션 한도 도달 시 발생
 */
public class WeeklyQuotaExceededException extends BusinessException {

    private final transient StudioQuota quota;

    public WeeklyQuotaExceededException(StudioQuota quota) {
        super(ErrorCode.WEEKLY_QUOTA_EXCEEDED,
                String.format("Weekly studio session limit reached: %d/%d",
                        quota.currentCount(), quota.maxAllowed()));
        this.quota = quota;
    }

    public StudioQuota getQuota() {
        return quota;
    }
}
