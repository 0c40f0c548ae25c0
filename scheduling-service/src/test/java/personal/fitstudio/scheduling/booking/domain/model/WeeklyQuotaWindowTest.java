package personal.fitstudio.scheduling.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WeeklyQuotaWindow 단위 테스트")
class WeeklyQuotaWindowTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "2025-01-13, 2025-01-13",   // 월요일
            "2025-01-15, 2025-01-13",   // 수요일
            "2025-01-18, 2025-01-13",   // 토요일
            "2025-01-19, 2025-01-13",   // 일요일은 앞 주 월요일
            "2025-01-20, 2025-01-20"
    })
    @DisplayName("날짜가 속한 주의 월요일을 찾는다")
    void containing_FindsMonday(LocalDate date, LocalDate expectedMonday) {
        WeeklyQuotaWindow window = WeeklyQuotaWindow.containing(date, ZoneOffset.UTC);

        assertThat(window.monday()).isEqualTo(expectedMonday);
        assertThat(window.sunday()).isEqualTo(expectedMonday.plusDays(6));
    }

    @Test
    @DisplayName("일요일 마지막 밀리초와 다음 월요일 첫 밀리초는 인접한 서로 다른 구간에 속한다")
    void weekBoundary_DisjointAndAdjacent() {
        // given
        WeeklyQuotaWindow week = WeeklyQuotaWindow.containing(LocalDate.of(2025, 1, 15), BERLIN);
        Instant lastMillis = week.end();
        Instant firstMillisOfNext = lastMillis.plusMillis(1);

        // when
        WeeklyQuotaWindow lastWindow = WeeklyQuotaWindow.containing(lastMillis, BERLIN);
        WeeklyQuotaWindow nextWindow = WeeklyQuotaWindow.containing(firstMillisOfNext, BERLIN);

        // then
        assertThat(lastWindow).isEqualTo(week);
        assertThat(nextWindow).isEqualTo(week.next(BERLIN));
        assertThat(lastWindow.nextStart()).isEqualTo(nextWindow.start());
        assertThat(lastWindow.contains(firstMillisOfNext)).isFalse();
        assertThat(nextWindow.contains(lastMillis)).isFalse();
    }

    @Test
    @DisplayName("구간 경계는 스튜디오 현지 자정 기준이다")
    void boundary_UsesStudioZone() {
        WeeklyQuotaWindow window = WeeklyQuotaWindow.containing(LocalDate.of(2025, 1, 15), BERLIN);

        // 베를린 겨울 시간 UTC+1
        assertThat(window.start()).isEqualTo(Instant.parse("2025-01-12T23:00:00Z"));
        assertThat(window.end()).isEqualTo(Instant.parse("2025-01-19T22:59:59.999Z"));
    }

    @Test
    @DisplayName("서머타임 전환 주도 월요일 자정부터 다음 월요일 자정까지다")
    void daylightSavingWeek() {
        WeeklyQuotaWindow window = WeeklyQuotaWindow.containing(LocalDate.of(2025, 3, 30), BERLIN);

        assertThat(window.monday()).isEqualTo(LocalDate.of(2025, 3, 24));
        assertThat(window.start()).isEqualTo(Instant.parse("2025-03-23T23:00:00Z"));
        assertThat(window.nextStart()).isEqualTo(Instant.parse("2025-03-30T22:00:00Z"));
    }
}
