package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.time.Instant;

/**
 * Training Session JPA Entity
 * 세션 테이블 매핑 (시각은 UTC)
 */
@Entity
@Table(name = "training_sessions",
        indexes = {
                @Index(name = "idx_trainer_start", columnList = "trainer_id, scheduled_start"),
                @Index(name = "idx_machine_start", columnList = "machine_id, scheduled_start"),
                @Index(name = "idx_start_status", columnList = "scheduled_start, status")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TrainingSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "machine_id", nullable = false)
    private Long machineId;

    @Column(name = "trainer_id")
    private Long trainerId;

    @Column(name = "scheduled_start", nullable = false)
    private Instant scheduledStart;

    @Column(name = "scheduled_end", nullable = false)
    private Instant scheduledEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SessionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_type", nullable = false, length = 20)
    private SessionType sessionType;

    @Column(name = "max_participants", nullable = false)
    private int maxParticipants;

    @Column(name = "current_participants", nullable = false)
    private int currentParticipants;

    @Column(length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * 도메인 모델로부터 엔티티 생성 (ID가 있으면 업데이트)
     */
    public static TrainingSessionEntity fromDomain(TrainingSession session) {
        TrainingSessionEntity entity = new TrainingSessionEntity();
        entity.id = session.id();
        entity.machineId = session.machineId();
        entity.trainerId = session.trainerId();
        entity.scheduledStart = session.scheduledStart();
        entity.scheduledEnd = session.scheduledEnd();
        entity.status = session.status();
        entity.sessionType = session.sessionType();
        entity.maxParticipants = session.maxParticipants();
        entity.currentParticipants = session.currentParticipants();
        entity.notes = session.notes();
        entity.createdAt = session.createdAt();
        return entity;
    }

    public TrainingSession toDomain() {
        return new TrainingSession(id, machineId, trainerId, scheduledStart, scheduledEnd,
                status, sessionType, maxParticipants, currentParticipants, notes, createdAt);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
