package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for StudioSettings
 */
public interface JpaStudioSettingsRepository extends JpaRepository<StudioSettingsEntity, Long> {
}
