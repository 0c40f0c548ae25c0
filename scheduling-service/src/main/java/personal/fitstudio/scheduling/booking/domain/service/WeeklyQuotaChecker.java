package personal.fitstudio.scheduling.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.config.SchedulingProperties;
import personal.fitstudio.scheduling.booking.application.port.out.StudioSettingsRepository;
import personal.fitstudio.scheduling.booking.application.port.out.TrainingSessionRepository;
import personal.fitstudio.scheduling.booking.domain.model.CapacityTier;
import personal.fitstudio.scheduling.booking.domain.model.StudioQuota;
import personal.fitstudio.scheduling.booking.domain.model.WeeklyQuotaWindow;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Weekly Quota Checker
 * 월~일 주간 구간의 스튜디오 전체 세션 수를 한도와 비교
 * 동시 예약 간 읽기 불일치(read skew)는 허용 (한도는 운영 목표치)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeeklyQuotaChecker {

    private final TrainingSessionRepository sessionRepository;
    private final StudioSettingsRepository settingsRepository;
    private final SchedulingProperties properties;

    public StudioQuota checkStudioQuota(LocalDate date) {
        return check(WeeklyQuotaWindow.containing(date, properties.studio().zone()));
    }

    /**
     * 세션 시작 시각이 속한 주의 한도 조회
     */
    public StudioQuota checkStudioQuota(Instant sessionStart) {
        return check(WeeklyQuotaWindow.containing(sessionStart, properties.studio().zone()));
    }

    public int currentWeeklyLimit() {
        return settingsRepository.findWeeklySessionLimit()
                .orElse(properties.quota().defaultWeeklyLimit());
    }

    private StudioQuota check(WeeklyQuotaWindow window) {
        long count = sessionRepository.countActiveStartingBetween(
                window.start(), window.nextStart(), SessionTypePolicy.capacityCountingTypes());
        StudioQuota quota = StudioQuota.of(count, currentWeeklyLimit());

        if (quota.tier() != CapacityTier.NOMINAL) {
            log.info("Studio weekly usage is {}: week={}, count={}, limit={}, percentage={}",
                    quota.tier(), window.monday(), quota.currentCount(), quota.maxAllowed(), quota.percentage());
        } else {
            log.debug("Studio weekly usage: week={}, count={}, limit={}",
                    window.monday(), quota.currentCount(), quota.maxAllowed());
        }
        return quota;
    }
}
