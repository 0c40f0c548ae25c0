package personal.fitstudio.scheduling.booking.adapter.out.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.config.SchedulingProperties;
import personal.fitstudio.scheduling.booking.application.port.out.NotificationEventPublisher;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Notification Kafka Publisher (Adapter Layer)
 * Outbox Service에 의해 호출되며, 전송 결과를 기다려 실패를 Outbox 재시도로 넘김
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationKafkaPublisher implements NotificationEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final SchedulingProperties properties;

    @Override
    public void publishRaw(String topic, String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", topic, key);
        try {
            kafkaTemplate.send(topic, key, payload)
                    .get(properties.outbox().sendTimeoutMs(), TimeUnit.MILLISECONDS);
            log.debug("Raw event published: topic={}, key={}", topic, key);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing to Kafka: topic=" + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Kafka publish failed: topic=" + topic + ", key=" + key, e);
        }
    }
}
