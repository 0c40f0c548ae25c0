package personal.fitstudio.scheduling.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.fitstudio.scheduling.booking.application.config.SchedulingProperties;
import personal.fitstudio.scheduling.booking.application.port.in.PublishPendingEventsUseCase;
import personal.fitstudio.scheduling.booking.application.port.out.NotificationEventPublisher;
import personal.fitstudio.scheduling.booking.application.port.out.OutboxEventRepository;
import personal.fitstudio.scheduling.booking.domain.model.NotificationType;
import personal.fitstudio.scheduling.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Service
 * 대기 중인 알림 이벤트를 발행 처리하는 도메인 서비스
 * 발행 실패는 재시도 횟수만 올리고 예약에는 영향 없음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService implements PublishPendingEventsUseCase {

    public static final String TOPIC_WAITLIST_ASSIGNED = "session.waitlist.assigned";
    public static final String TOPIC_WAITLIST_PROMOTED = "session.waitlist.promoted";

    private final OutboxEventRepository outboxEventRepository;
    private final NotificationEventPublisher eventPublisher;
    private final SchedulingProperties properties;

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents();
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                String topic = mapEventTypeToTopic(event.eventType());

                // Key: sessionId (같은 세션의 알림 순서 보장)
                String key = String.valueOf(event.aggregateId());

                log.debug("Publishing event: id={}, type={}, topic={}", event.id(), event.eventType(), topic);
                eventPublisher.publishRaw(topic, key, event.payload());

                outboxEventRepository.save(event.markAsPublished());
                publishedCount++;

            } catch (Exception e) {
                log.error("Failed to publish event: id={}, retryCount={}", event.id(), event.retryCount(), e);

                OutboxEvent retriedEvent = event.incrementRetryCount();
                if (retriedEvent.retryCount() >= properties.outbox().maxRetryCount()) {
                    log.warn("Outbox event marked as failed: id={}, type={}", event.id(), event.eventType());
                    retriedEvent = retriedEvent.markAsFailed();
                }
                outboxEventRepository.save(retriedEvent);
            }
        }
        return publishedCount;
    }

    private String mapEventTypeToTopic(String eventType) {
        return switch (NotificationType.valueOf(eventType)) {
            case WAITLIST_ASSIGNED -> TOPIC_WAITLIST_ASSIGNED;
            case WAITLIST_PROMOTED -> TOPIC_WAITLIST_PROMOTED;
        };
    }
}
