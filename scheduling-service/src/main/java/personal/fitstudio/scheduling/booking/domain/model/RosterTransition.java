package personal.fitstudio.scheduling.booking.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * 상태 머신 전이 결과
 * 인덱스로 참가자를 가리키므로 저장 이후 조회하면 ID가 채워진 참가자를 반환
 */
public record RosterTransition(
        SessionRoster roster,
        int subjectIndex,
        Participant removedSubject,
        List<Integer> promotedIndexes
) {
    public RosterTransition {
        promotedIndexes = List.copyOf(promotedIndexes);
    }

    public static RosterTransition of(SessionRoster roster, int subjectIndex, List<Integer> promotedIndexes) {
        return new RosterTransition(roster, subjectIndex, null, promotedIndexes);
    }

    public static RosterTransition removal(SessionRoster roster, Participant removed) {
        return new RosterTransition(roster, -1, removed, List.of());
    }

    public static RosterTransition sessionWide(SessionRoster roster, List<Integer> promotedIndexes) {
        return new RosterTransition(roster, -1, null, promotedIndexes);
    }

    public Optional<Participant> subject() {
        if (subjectIndex >= 0) {
            return Optional.of(roster.participantAt(subjectIndex));
        }
        return Optional.ofNullable(removedSubject);
    }

    public List<Participant> promoted() {
        return promotedIndexes.stream().map(roster::participantAt).toList();
    }

    public TrainingSession session() {
        return roster.session();
    }
}
