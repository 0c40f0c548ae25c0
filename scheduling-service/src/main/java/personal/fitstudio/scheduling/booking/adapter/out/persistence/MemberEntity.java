package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.fitstudio.scheduling.booking.domain.model.Member;
import personal.fitstudio.scheduling.booking.domain.model.MemberType;
import personal.fitstudio.scheduling.booking.domain.model.NewMemberDetails;

import java.time.Instant;

/**
 * Member JPA Entity
 * 예약 검증에 필요한 회원 디렉터리 (이메일 유일)
 */
@Entity
@Table(name = "members",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_member_email", columnNames = "email")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MemberEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(length = 30)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "member_type", nullable = false, length = 20)
    private MemberType memberType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static MemberEntity create(String firstName, String lastName, String email, String phone,
                                      MemberType memberType) {
        MemberEntity entity = new MemberEntity();
        entity.firstName = firstName;
        entity.lastName = lastName;
        entity.email = email;
        entity.phone = phone;
        entity.memberType = memberType;
        return entity;
    }

    public static MemberEntity trial(NewMemberDetails details) {
        return create(details.firstName(), details.lastName(), details.email(), details.phone(), MemberType.TRIAL);
    }

    public Member toDomain() {
        return new Member(id, firstName, lastName, email, memberType);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
