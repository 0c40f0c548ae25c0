package personal.fitstudio.scheduling.booking.application.port.out;

import personal.fitstudio.scheduling.booking.domain.model.Member;
import personal.fitstudio.scheduling.booking.domain.model.NewMemberDetails;

import java.util.Optional;

/**
 * Member Directory (Output Port)
 */
public interface MemberRepository {

    Optional<Member> findById(Long memberId);

    Optional<Member> findByEmail(String email);

    /**
     * 체험 회원 생성
     * 이메일 중복 시 DataIntegrityViolationException
     */
    Member createTrialMember(NewMemberDetails details);
}
