package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Studio Settings JPA Entity
 * 스튜디오 단일 설정 행 (id = 1)
 */
@Entity
@Table(name = "studio_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StudioSettingsEntity {

    public static final Long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "weekly_session_limit", nullable = false)
    private int weeklySessionLimit;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static StudioSettingsEntity create(int weeklySessionLimit) {
        StudioSettingsEntity entity = new StudioSettingsEntity();
        entity.id = SINGLETON_ID;
        entity.weeklySessionLimit = weeklySessionLimit;
        entity.updatedAt = Instant.now();
        return entity;
    }

    /**
     * 한도 변경 (영속성 컨텍스트 내에서 사용)
     */
    public void updateWeeklySessionLimit(int limit) {
        this.weeklySessionLimit = limit;
        this.updatedAt = Instant.now();
    }
}
