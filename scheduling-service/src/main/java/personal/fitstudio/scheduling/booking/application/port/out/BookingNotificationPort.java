package personal.fitstudio.scheduling.booking.application.port.out;

import personal.fitstudio.scheduling.booking.domain.model.NotificationEvent;

/**
 * Booking Notification Port
 * 대기열 알림 이벤트 기록 (Outbox 패턴, 호출한 트랜잭션에 참여)
 */
public interface BookingNotificationPort {

    void publish(NotificationEvent event);
}
