package personal.fitstudio.scheduling.booking.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 반열린 구간 [start, end)
 * 한쪽의 end와 다른 쪽의 start가 같으면 겹치지 않음
 */
public record TimeInterval(Instant start, Instant end) {

    public boolean isWellFormed() {
        return start != null && end != null && end.isAfter(start);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return otherStart.isBefore(end) && otherEnd.isAfter(start);
    }

    public boolean overlaps(TimeInterval other) {
        return overlaps(other.start, other.end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
