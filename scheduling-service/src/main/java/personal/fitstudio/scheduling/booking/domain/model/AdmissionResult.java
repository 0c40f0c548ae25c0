package personal.fitstudio.scheduling.booking.domain.model;

/**
 * 참가자 등록 결과
 *
 * @param participant 등록된 참가자 (예약 불가 세션을 회원 없이 만든 경우 null)
 */
public record AdmissionResult(
        TrainingSession session,
        Participant participant,
        Long memberId
) {
}
