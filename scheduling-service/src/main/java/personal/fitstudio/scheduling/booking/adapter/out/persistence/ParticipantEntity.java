package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;
import personal.fitstudio.scheduling.booking.domain.model.GuestDetails;
import personal.fitstudio.scheduling.booking.domain.model.Participant;

import java.time.Instant;

/**
 * Participant JPA Entity
 * 세션 참가자 테이블 매핑 (게스트 정보는 컬럼으로 내장)
 */
@Entity
@Table(name = "training_session_members",
        indexes = {
                @Index(name = "idx_session_status", columnList = "session_id, booking_status"),
                @Index(name = "idx_member_id", columnList = "member_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ParticipantEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "member_id")
    private Long memberId;

    @Column(name = "guest_first_name", length = 100)
    private String guestFirstName;

    @Column(name = "guest_last_name", length = 100)
    private String guestLastName;

    @Column(name = "guest_gym_name", length = 100)
    private String guestGymName;

    @Enumerated(EnumType.STRING)
    @Column(name = "booking_status", nullable = false, length = 20)
    private BookingStatus bookingStatus;

    @Column(name = "waitlist_position")
    private Integer waitlistPosition;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static ParticipantEntity fromDomain(Participant participant) {
        ParticipantEntity entity = new ParticipantEntity();
        entity.id = participant.id();
        entity.sessionId = participant.sessionId();
        entity.memberId = participant.memberId();
        GuestDetails guest = participant.guest();
        if (guest != null) {
            entity.guestFirstName = guest.firstName();
            entity.guestLastName = guest.lastName();
            entity.guestGymName = guest.gymName();
        }
        entity.bookingStatus = participant.bookingStatus();
        entity.waitlistPosition = participant.waitlistPosition();
        entity.createdAt = participant.createdAt();
        return entity;
    }

    public Participant toDomain() {
        GuestDetails guest = guestFirstName == null && guestLastName == null && guestGymName == null
                ? null
                : new GuestDetails(guestFirstName, guestLastName, guestGymName);
        return new Participant(id, sessionId, memberId, guest, bookingStatus, waitlistPosition, createdAt);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
