package personal.fitstudio.scheduling.booking.application.port.out;

import java.util.OptionalInt;

/**
 * Studio Settings Repository (Output Port)
 */
public interface StudioSettingsRepository {

    /**
     * @return 저장된 주간 세션 한도 (없으면 empty, 기본값은 설정에서 결정)
     */
    OptionalInt findWeeklySessionLimit();

    void saveWeeklySessionLimit(int limit);
}
