package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.common.exception.ErrorCode;
import personal.fitstudio.scheduling.booking.domain.model.NotificationEvent;

import java.time.Instant;

/**
 * Outbox Event Factory (Adapter Layer)
 * NotificationEvent를 OutboxEventEntity로 변환하는 팩토리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    public static final String AGGREGATE_TYPE = "TRAINING_SESSION";

    private final ObjectMapper objectMapper;

    public OutboxEventEntity createNotificationEvent(NotificationEvent event) {
        try {
            WaitlistNotificationPayload payload = new WaitlistNotificationPayload(
                    event.type().name(),
                    event.sessionId(),
                    event.memberId(),
                    event.position(),
                    Instant.now().toString());

            return OutboxEventEntity.create(
                    AGGREGATE_TYPE,
                    event.sessionId(),
                    event.type().name(),
                    objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: sessionId={}, type={}", event.sessionId(), event.type(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event");
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record WaitlistNotificationPayload(
            String type,
            Long sessionId,
            Long memberId,
            Integer position,
            String occurredAt) {
    }
}
