package personal.fitstudio.scheduling.booking.adapter.in.web.dto;

public record WeeklySessionLimitResponse(int limit) {
}
