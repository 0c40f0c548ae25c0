package personal.fitstudio.scheduling.booking.domain.model;

public enum NotificationType {
    WAITLIST_ASSIGNED,
    WAITLIST_PROMOTED
}
