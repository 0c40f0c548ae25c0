package personal.fitstudio.scheduling.booking.domain.service;

import personal.fitstudio.scheduling.booking.domain.model.MemberType;
import personal.fitstudio.scheduling.booking.domain.model.PolicyFlags;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Session Type Policy
 * 세션 분류별 예약 규칙 표 (규칙은 이 클래스에만 존재)
 *
 * | type          | 기존 회원 | 회원 생성 | 주간 한도 생략 | 한도 집계 |
 * | TRIAL         | X         | O         | O              | O         |
 * | MEMBER        | O         | X         | X              | O         |
 * | CONTRACTUAL   | O (TRIAL) | X         | O              | O         |
 * | MULTI_SITE    | X (게스트)| X         | O              | O         |
 * | COLLABORATION | O (COLLAB)| X         | O              | O         |
 * | MAKEUP        | O         | X         | O              | O         |
 * | NON_BOOKABLE  | X         | X         | O              | X         |
 */
public final class SessionTypePolicy {

    private static final Map<SessionType, PolicyFlags> POLICIES = new EnumMap<>(SessionType.class);

    static {
        POLICIES.put(SessionType.TRIAL,
                new PolicyFlags(false, true, true, true, null, false));
        POLICIES.put(SessionType.MEMBER,
                new PolicyFlags(true, false, false, true, null, false));
        POLICIES.put(SessionType.CONTRACTUAL,
                new PolicyFlags(true, false, true, true, MemberType.TRIAL, false));
        POLICIES.put(SessionType.MULTI_SITE,
                new PolicyFlags(false, false, true, true, null, true));
        POLICIES.put(SessionType.COLLABORATION,
                new PolicyFlags(true, false, true, true, MemberType.COLLABORATION, false));
        POLICIES.put(SessionType.MAKEUP,
                new PolicyFlags(true, false, true, true, null, false));
        POLICIES.put(SessionType.NON_BOOKABLE,
                new PolicyFlags(false, false, true, false, null, false));
    }

    private SessionTypePolicy() {
    }

    public static PolicyFlags classify(SessionType type) {
        return POLICIES.get(type);
    }

    /**
     * 주간 스튜디오 한도 집계 대상 분류
     */
    public static Set<SessionType> capacityCountingTypes() {
        return Arrays.stream(SessionType.values())
                .filter(type -> POLICIES.get(type).countsTowardsCapacity())
                .collect(Collectors.toUnmodifiableSet());
    }
}
