package personal.fitstudio.scheduling.booking.domain.model;

import java.util.Comparator;
import java.util.List;

/**
 * 세션 상세 (확정 참가자, 대기 순번, 그 외 순으로 정렬)
 */
public record SessionDetails(
        TrainingSession session,
        List<Participant> participants
) {
    private static final Comparator<Participant> ROSTER_ORDER = Comparator
            .comparingInt(SessionDetails::rank)
            .thenComparing(p -> p.waitlistPosition() == null ? 0 : p.waitlistPosition())
            .thenComparing(Participant::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public static SessionDetails of(TrainingSession session, List<Participant> participants) {
        return new SessionDetails(session, participants.stream().sorted(ROSTER_ORDER).toList());
    }

    private static int rank(Participant participant) {
        return switch (participant.bookingStatus()) {
            case CONFIRMED -> 0;
            case WAITLISTED -> 1;
            case NO_SHOW -> 2;
            case CANCELLED -> 3;
        };
    }
}
