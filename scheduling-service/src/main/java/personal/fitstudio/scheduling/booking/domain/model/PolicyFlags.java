package personal.fitstudio.scheduling.booking.domain.model;

/**
 * Session Type 분류 결과
 *
 * @param requiresExistingMember 기존 회원 ID 필수 여부
 * @param createsMember          예약 시 신규 회원 생성 여부
 * @param bypassesWeeklyQuota    주간 스튜디오 한도 검사 생략 여부
 * @param countsTowardsCapacity  주간 스튜디오 한도 집계 대상 여부
 * @param requiredMemberType     요구되는 회원 구분 (null이면 제한 없음)
 * @param guestFieldsInline      게스트 정보를 예약에 직접 기록하는지 여부
 */
public record PolicyFlags(
        boolean requiresExistingMember,
        boolean createsMember,
        boolean bypassesWeeklyQuota,
        boolean countsTowardsCapacity,
        MemberType requiredMemberType,
        boolean guestFieldsInline
) {
}
