package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 알림 이벤트 (발행 후 재시도/소유는 알림 측 책임)
 *
 * @param position 대기 순번 (WAITLIST_ASSIGNED에서만 존재)
 */
public record NotificationEvent(
        NotificationType type,
        Long sessionId,
        Long memberId,
        Integer position
) {
    public static NotificationEvent waitlistAssigned(Long sessionId, Long memberId, int position) {
        return new NotificationEvent(NotificationType.WAITLIST_ASSIGNED, sessionId, memberId, position);
    }

    public static NotificationEvent waitlistPromoted(Long sessionId, Long memberId) {
        return new NotificationEvent(NotificationType.WAITLIST_PROMOTED, sessionId, memberId, null);
    }
}
