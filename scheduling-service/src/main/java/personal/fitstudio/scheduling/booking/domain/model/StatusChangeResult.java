package personal.fitstudio.scheduling.booking.domain.model;

import java.util.List;

/**
 * 상태 변경 결과
 *
 * @param participant 변경 대상 참가자 (세션 단위 변경이면 null)
 * @param promoted    같은 트랜잭션에서 승급된 대기 참가자
 * @param session     변경 후 세션
 */
public record StatusChangeResult(
        Participant participant,
        List<Participant> promoted,
        TrainingSession session
) {
    public StatusChangeResult {
        promoted = List.copyOf(promoted);
    }

    public static StatusChangeResult from(RosterTransition transition) {
        return new StatusChangeResult(
                transition.subject().orElse(null),
                transition.promoted(),
                transition.session());
    }
}
