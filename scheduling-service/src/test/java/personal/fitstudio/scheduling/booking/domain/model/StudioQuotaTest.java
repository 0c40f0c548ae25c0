package personal.fitstudio.scheduling.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StudioQuota 단위 테스트")
class StudioQuotaTest {

    @ParameterizedTest(name = "{0}/{1} -> canBook={2}, {3}%, {4}")
    @CsvSource({
            "0, 50, true, 0, NOMINAL",
            "39, 50, true, 78, NOMINAL",
            "40, 50, true, 80, WARNING",
            "48, 50, true, 96, CRITICAL",
            "49, 50, true, 98, CRITICAL",
            "50, 50, false, 100, CRITICAL",
            "60, 50, false, 120, CRITICAL"
    })
    @DisplayName("사용률과 예약 가능 여부를 계산한다")
    void of(long count, int limit, boolean canBook, int percentage, CapacityTier tier) {
        StudioQuota quota = StudioQuota.of(count, limit);

        assertThat(quota.canBook()).isEqualTo(canBook);
        assertThat(quota.percentage()).isEqualTo(percentage);
        assertThat(quota.tier()).isEqualTo(tier);
    }

    @Test
    @DisplayName("한도가 0이면 예약할 수 없다")
    void zeroLimit() {
        StudioQuota quota = StudioQuota.of(0, 0);

        assertThat(quota.canBook()).isFalse();
        assertThat(quota.percentage()).isEqualTo(100);
    }
}
