package personal.fitstudio.scheduling.booking.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.adapter.out.persistence.JpaOutboxEventRepository;
import personal.fitstudio.scheduling.booking.adapter.out.persistence.OutboxEventFactory;
import personal.fitstudio.scheduling.booking.application.port.out.BookingNotificationPort;
import personal.fitstudio.scheduling.booking.domain.model.NotificationEvent;

/**
 * Waitlist Notification Event Adapter
 * Outbox 패턴을 사용한 대기열 알림 발행 구현체 (예약 트랜잭션에 참여)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WaitlistNotificationEventAdapter implements BookingNotificationPort {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publish(NotificationEvent event) {
        jpaOutboxEventRepository.save(outboxEventFactory.createNotificationEvent(event));
        log.debug("Notification event recorded: type={}, sessionId={}, memberId={}, position={}",
                event.type(), event.sessionId(), event.memberId(), event.position());
    }
}
