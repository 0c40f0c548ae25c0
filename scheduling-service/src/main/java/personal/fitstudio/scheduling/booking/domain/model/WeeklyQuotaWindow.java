package personal.fitstudio.scheduling.booking.domain.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 주간 한도 집계 구간 (월요일 00:00:00.000 ~ 일요일 23:59:59.999, 스튜디오 현지 달력 기준)
 * 저장하지 않는 파생 값
 *
 * @param monday    구간 시작 요일의 날짜
 * @param start     월요일 00:00 (포함)
 * @param nextStart 다음 주 월요일 00:00 (미포함)
 */
public record WeeklyQuotaWindow(LocalDate monday, Instant start, Instant nextStart) {

    public static WeeklyQuotaWindow containing(LocalDate date, ZoneId zone) {
        // 일요일(0) -> -6일, 그 외 -> 1 - weekday
        int weekday = date.getDayOfWeek().getValue() % 7;
        int offset = weekday == 0 ? -6 : 1 - weekday;
        LocalDate monday = date.plusDays(offset);
        return new WeeklyQuotaWindow(
                monday,
                monday.atStartOfDay(zone).toInstant(),
                monday.plusWeeks(1).atStartOfDay(zone).toInstant());
    }

    public static WeeklyQuotaWindow containing(Instant instant, ZoneId zone) {
        return containing(instant.atZone(zone).toLocalDate(), zone);
    }

    /**
     * 일요일 23:59:59.999
     */
    public Instant end() {
        return nextStart.minusMillis(1);
    }

    public LocalDate sunday() {
        return monday.with(DayOfWeek.SUNDAY);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(nextStart);
    }

    public WeeklyQuotaWindow next(ZoneId zone) {
        return containing(monday.plusWeeks(1), zone);
    }
}
