package personal.fitstudio.scheduling.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Scheduling 설정 Properties
 * application.yml의 scheduling.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "scheduling")
public record SchedulingProperties(
        Studio studio,
        Quota quota,
        Lock lock,
        Outbox outbox,
        Reconciliation reconciliation
) {
    public record Studio(
            String zoneId  // 주간 한도/일정 조회의 달력 기준
    ) {
        public ZoneId zone() {
            return ZoneId.of(zoneId);
        }
    }

    public record Quota(
            int defaultWeeklyLimit  // studio_settings에 값이 없을 때 사용
    ) {}

    public record Lock(
            String strategy,  // none | redis
            int ttlSeconds
    ) {}

    public record Outbox(
            boolean enabled,
            long publishIntervalMs,
            int maxRetryCount,
            long sendTimeoutMs
    ) {}

    public record Reconciliation(
            boolean enabled,
            long intervalMs
    ) {}
}
