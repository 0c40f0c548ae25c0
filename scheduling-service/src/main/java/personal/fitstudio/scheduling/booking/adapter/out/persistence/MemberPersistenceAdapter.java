package personal.fitstudio.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.port.out.MemberRepository;
import personal.fitstudio.scheduling.booking.domain.model.Member;
import personal.fitstudio.scheduling.booking.domain.model.NewMemberDetails;

import java.util.Optional;

/**
 * Member Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MemberPersistenceAdapter implements MemberRepository {

    private final JpaMemberRepository jpaMemberRepository;

    @Override
    public Optional<Member> findById(Long memberId) {
        log.debug("Finding member by id: {}", memberId);
        return jpaMemberRepository.findById(memberId)
                .map(MemberEntity::toDomain);
    }

    @Override
    public Optional<Member> findByEmail(String email) {
        return jpaMemberRepository.findByEmail(email)
                .map(MemberEntity::toDomain);
    }

    @Override
    public Member createTrialMember(NewMemberDetails details) {
        // 이메일 유니크 제약 위반을 트랜잭션 안에서 바로 드러내기 위해 flush
        MemberEntity saved = jpaMemberRepository.saveAndFlush(MemberEntity.trial(details));
        return saved.toDomain();
    }
}
