package personal.fitstudio.scheduling.booking.domain.model;

import java.time.Instant;

/**
 * Outbox Event Domain Model
 * 알림 이벤트를 예약과 같은 트랜잭션에 기록하고 스케줄러가 발행
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        Instant createdAt,
        Instant publishedAt,
        int retryCount
) {
    public OutboxEvent markAsPublished() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, Instant.now(), retryCount);
    }

    public OutboxEvent incrementRetryCount() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                status, createdAt, publishedAt, retryCount + 1);
    }

    public OutboxEvent markAsFailed() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.FAILED, createdAt, publishedAt, retryCount);
    }

    public enum OutboxEventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }
}
