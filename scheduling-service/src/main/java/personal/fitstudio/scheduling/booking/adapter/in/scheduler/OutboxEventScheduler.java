package personal.fitstudio.scheduling.booking.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.port.in.PublishPendingEventsUseCase;

/**
 * Outbox Event Scheduler (Driving Adapter)
 * 주기적으로 PENDING 상태의 알림 이벤트를 발행
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduling.outbox.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxEventScheduler {

    private final PublishPendingEventsUseCase publishPendingEventsUseCase;
    private final MeterRegistry meterRegistry;

    /**
     * 이전 작업 완료 후 publish-interval-ms(기본 500ms)마다 실행
     */
    @Scheduled(fixedDelayString = "${scheduling.outbox.publish-interval-ms:500}")
    public void schedulePublishing() {
        int publishedCount = publishPendingEventsUseCase.publishPendingEvents();
        if (publishedCount > 0) {
            Counter.builder("scheduler.outbox.published")
                    .description("Number of waitlist notification events published to Kafka")
                    .register(meterRegistry)
                    .increment(publishedCount);
            log.debug("Scheduled publishing completed. Count: {}", publishedCount);
        }
    }
}
