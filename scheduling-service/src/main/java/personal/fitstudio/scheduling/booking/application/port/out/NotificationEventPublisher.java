package personal.fitstudio.scheduling.booking.application.port.out;

/**
 * Notification Event Publisher (Output Port)
 * 메시지 브로커 발행 인터페이스
 */
public interface NotificationEventPublisher {

    /**
     * 이미 직렬화된 JSON Payload를 그대로 발행
     * 브로커 응답을 기다리며 실패 시 예외 발생
     *
     * @param topic   발행할 Kafka 토픽
     * @param key     메시지 키 (순서 보장용, sessionId)
     * @param payload 메시지 본문 (JSON String)
     */
    void publishRaw(String topic, String key, String payload);
}
