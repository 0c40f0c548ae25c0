package personal.fitstudio.scheduling.booking.application.port.in;

import personal.fitstudio.scheduling.booking.domain.model.StudioQuota;

import java.time.LocalDate;

/**
 * Studio Quota UseCase (Input Port)
 * 주간 스튜디오 한도 조회 및 관리자 변경
 */
public interface StudioQuotaUseCase {

    StudioQuota checkStudioQuota(LocalDate date);

    int getWeeklySessionLimit();

    void updateWeeklySessionLimit(int limit);
}
