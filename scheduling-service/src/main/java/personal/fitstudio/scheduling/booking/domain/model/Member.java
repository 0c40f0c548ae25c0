package personal.fitstudio.scheduling.booking.domain.model;

/**
 * Member Domain Model
 * 예약 검증에 필요한 최소한의 회원 정보 (프로필 관리는 범위 밖)
 */
public record Member(
        Long id,
        String firstName,
        String lastName,
        String email,
        MemberType memberType
) {
    public boolean is(MemberType type) {
        return memberType == type;
    }
}
