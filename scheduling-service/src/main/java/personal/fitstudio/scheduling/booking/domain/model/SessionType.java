package personal.fitstudio.scheduling.booking.domain.model;

/**
 * Session Type Enum
 * 세션 분류 (닫힌 열거형, 분류 규칙은 SessionTypePolicy 참조)
 */
public enum SessionType {
    /** 체험 세션 - 예약 시 체험 회원 생성 */
    TRIAL,
    /** 일반 회원 세션 */
    MEMBER,
    /** 계약 세션 - 체험 회원 전용 */
    CONTRACTUAL,
    /** 타 지점 회원 (게스트 정보 직접 입력) */
    MULTI_SITE,
    /** 제휴/협업 회원 세션 */
    COLLABORATION,
    /** 보강 세션 */
    MAKEUP,
    /** 예약 불가 시간대 (타임 블로커) */
    NON_BOOKABLE
}
