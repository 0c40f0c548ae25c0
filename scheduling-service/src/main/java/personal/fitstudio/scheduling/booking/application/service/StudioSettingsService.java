package personal.fitstudio.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.fitstudio.scheduling.booking.application.port.in.StudioQuotaUseCase;
import personal.fitstudio.scheduling.booking.application.port.out.StudioSettingsRepository;
import personal.fitstudio.scheduling.booking.domain.exception.BookingValidationException;
import personal.fitstudio.scheduling.booking.domain.model.StudioQuota;
import personal.fitstudio.scheduling.booking.domain.service.WeeklyQuotaChecker;

import java.time.LocalDate;

/**
 * Studio Settings Service
 * 주간 스튜디오 한도 조회 및 변경
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudioSettingsService implements StudioQuotaUseCase {

    private final WeeklyQuotaChecker quotaChecker;
    private final StudioSettingsRepository settingsRepository;

    @Override
    @Transactional(readOnly = true)
    public StudioQuota checkStudioQuota(LocalDate date) {
        if (date == null) {
            throw new BookingValidationException("Date is required");
        }
        return quotaChecker.checkStudioQuota(date);
    }

    @Override
    @Transactional(readOnly = true)
    public int getWeeklySessionLimit() {
        return quotaChecker.currentWeeklyLimit();
    }

    @Override
    @Transactional
    public void updateWeeklySessionLimit(int limit) {
        if (limit < 0) {
            throw new BookingValidationException("Weekly session limit cannot be negative");
        }
        int previous = quotaChecker.currentWeeklyLimit();
        settingsRepository.saveWeeklySessionLimit(limit);
        log.info("Weekly session limit updated: {} -> {}", previous, limit);
    }
}
