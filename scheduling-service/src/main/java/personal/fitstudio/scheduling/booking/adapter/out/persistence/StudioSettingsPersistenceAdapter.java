package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.port.out.StudioSettingsRepository;

import java.util.OptionalInt;

/**
 * Studio Settings Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class StudioSettingsPersistenceAdapter implements StudioSettingsRepository {

    private final JpaStudioSettingsRepository jpaStudioSettingsRepository;

    @Override
    public OptionalInt findWeeklySessionLimit() {
        return jpaStudioSettingsRepository.findById(StudioSettingsEntity.SINGLETON_ID)
                .map(settings -> OptionalInt.of(settings.getWeeklySessionLimit()))
                .orElse(OptionalInt.empty());
    }

    @Override
    public void saveWeeklySessionLimit(int limit) {
        jpaStudioSettingsRepository.findById(StudioSettingsEntity.SINGLETON_ID)
                .ifPresentOrElse(
                        settings -> settings.updateWeeklySessionLimit(limit),
                        () -> jpaStudioSettingsRepository.save(StudioSettingsEntity.create(limit)));
    }
}
