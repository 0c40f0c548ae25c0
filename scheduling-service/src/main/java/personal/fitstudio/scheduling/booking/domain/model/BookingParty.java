package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 예약 주체 (회원 검증을 마친 결과)
 *
 * @param memberId     기존 회원 ID (체험 회원을 새로 만들 경우 null)
 * @param trialMember  트랜잭션 안에서 생성할 체험 회원 정보
 * @param guest        게스트 정보 (타 지점 회원)
 */
public record BookingParty(
        Long memberId,
        NewMemberDetails trialMember,
        GuestDetails guest
) {
    public static BookingParty member(Long memberId) {
        return new BookingParty(memberId, null, null);
    }

    public static BookingParty newTrialMember(NewMemberDetails details) {
        return new BookingParty(null, details, null);
    }

    public static BookingParty guest(GuestDetails guest) {
        return new BookingParty(null, null, guest);
    }

    public static BookingParty none() {
        return new BookingParty(null, null, null);
    }

    public boolean createsMember() {
        return trialMember != null;
    }

    /**
     * 참가자 행을 만들 대상이 없는 경우 (회원 없는 예약 불가 시간대)
     */
    public boolean isEmpty() {
        return memberId == null && trialMember == null && guest == null;
    }
}
