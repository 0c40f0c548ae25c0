package personal.fitstudio.scheduling.booking.domain.model;

/**
 * Member Type Enum
 * 회원 구분
 */
public enum MemberType {
    TRIAL,
    FULL,
    COLLABORATION
}
