package personal.fitstudio.scheduling.booking.domain.model;

import java.util.List;

/**
 * 자원 중복 예약 검사 결과 (권고용, 예약을 막지 않음)
 */
public record AvailabilityCheck(
        boolean available,
        List<TrainingSession> conflicts,
        String message
) {
    public static final String UNVERIFIED_MESSAGE = "Unable to verify availability - please check manually";

    public AvailabilityCheck {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static AvailabilityCheck of(ResourceType resourceType, List<TrainingSession> conflicts) {
        if (conflicts.isEmpty()) {
            return new AvailabilityCheck(true, conflicts,
                    String.format("%s is available", resourceType.label()));
        }
        return new AvailabilityCheck(false, conflicts,
                String.format("%s has %d conflicting session(s) during this time",
                        resourceType.label(), conflicts.size()));
    }

    /**
     * 검사 불가 시 허용 쪽으로 완화한 결과
     */
    public static AvailabilityCheck unverified() {
        return new AvailabilityCheck(true, List.of(), UNVERIFIED_MESSAGE);
    }
}
