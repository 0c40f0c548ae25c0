package personal.fitstudio.scheduling.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.scheduling.booking.application.port.out.BookingNotificationPort;
import personal.fitstudio.scheduling.booking.application.port.out.MemberRepository;
import personal.fitstudio.scheduling.booking.application.port.out.ParticipantRepository;
import personal.fitstudio.scheduling.booking.application.port.out.TrainingSessionRepository;
import personal.fitstudio.scheduling.booking.domain.exception.ParticipantNotFoundException;
import personal.fitstudio.scheduling.booking.domain.exception.SessionNotFoundException;
import personal.fitstudio.scheduling.booking.domain.model.AdmissionResult;
import personal.fitstudio.scheduling.booking.domain.model.BookingParty;
import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;
import personal.fitstudio.scheduling.booking.domain.model.BookingStep;
import personal.fitstudio.scheduling.booking.domain.model.Member;
import personal.fitstudio.scheduling.booking.domain.model.RosterTransition;
import personal.fitstudio.scheduling.booking.domain.model.SessionRoster;
import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.StatusChangeResult;
import personal.fitstudio.scheduling.booking.domain.model.TimeInterval;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.util.List;
import java.util.function.Function;

/**
 * Booking Domain Service (Transaction Manager)
 * 세션/참가자 저장소를 변경하는 트랜잭션 전용 서비스
 * 기존 세션은 항상 비관적 행 락(SELECT ... FOR UPDATE)을 잡은 뒤 WaitlistStateMachine에 위임
 * 승급/순번 재정렬/알림 기록은 모두 요청 트랜잭션 안에서 처리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private final TrainingSessionRepository sessionRepository;
    private final ParticipantRepository participantRepository;
    private final MemberRepository memberRepository;
    private final BookingNotificationPort notificationPort;
    private final WaitlistStateMachine stateMachine;

    /**
     * 세션 생성 + 첫 참가자 등록 (하나의 트랜잭션)
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public AdmissionResult createSessionWithParticipant(TrainingSession draft, BookingParty party) {
        Long memberId = resolveMemberId(party);

        TrainingSession session;
        try {
            session = sessionRepository.save(draft);
        } catch (BusinessException e) {
            throw e.atStep(BookingStep.CREATE_SESSION.name());
        }
        log.info("Session created: sessionId={}, type={}, machineId={}, trainerId={}, start={}",
                session.id(), session.sessionType(), session.machineId(), session.trainerId(), session.scheduledStart());

        if (party.isEmpty()) {
            return new AdmissionResult(session, null, null);
        }
        return admit(SessionRoster.of(session, List.of()), memberId, party);
    }

    /**
     * 기존 세션에 참가자 등록
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public AdmissionResult joinSession(Long sessionId, BookingParty party) {
        SessionRoster roster = lockRoster(sessionId);
        Long memberId = resolveMemberId(party);
        return admit(roster, memberId, party);
    }

    /**
     * 회원 기준 참가자 상태 변경
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public StatusChangeResult changeMemberStatus(Long sessionId, Long memberId, BookingStatus newStatus) {
        return changeStatus(sessionId, newStatus, roster -> roster.findIndexByMember(memberId)
                .orElseThrow(() -> ParticipantNotFoundException.forMember(sessionId, memberId)));
    }

    /**
     * 참가자 ID 기준 상태 변경 (게스트 참가자 포함)
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public StatusChangeResult changeParticipantStatus(Long sessionId, Long participantId, BookingStatus newStatus) {
        return changeStatus(sessionId, newStatus, roster -> roster.findIndexById(participantId)
                .orElseThrow(() -> new ParticipantNotFoundException(sessionId, participantId)));
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public StatusChangeResult removeWaitlistedParticipant(Long sessionId, Long participantId) {
        SessionRoster roster = lockRoster(sessionId);
        int index = roster.findIndexById(participantId)
                .orElseThrow(() -> new ParticipantNotFoundException(sessionId, participantId));

        RosterTransition transition = stateMachine.removeWaitlisted(roster, index);
        persist(roster);

        log.info("Waitlisted participant removed: sessionId={}, participantId={}", sessionId, participantId);
        return StatusChangeResult.from(transition);
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public StatusChangeResult changeCapacity(Long sessionId, int newMax) {
        SessionRoster roster = lockRoster(sessionId);
        int previousMax = roster.session().maxParticipants();

        RosterTransition transition = stateMachine.changeCapacity(roster, newMax);
        persist(roster);

        log.info("Session capacity changed: sessionId={}, {} -> {}, promoted={}",
                sessionId, previousMax, newMax, transition.promotedIndexes().size());
        return StatusChangeResult.from(transition);
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public StatusChangeResult updateSessionStatus(Long sessionId, SessionStatus newStatus) {
        SessionRoster roster = lockRoster(sessionId);
        SessionStatus previous = roster.session().status();

        RosterTransition transition = stateMachine.changeSessionStatus(roster, newStatus);
        persist(roster);

        log.info("Session status changed: sessionId={}, {} -> {}", sessionId, previous, newStatus);
        return StatusChangeResult.from(transition);
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TrainingSession rescheduleSession(Long sessionId, TimeInterval interval, Long trainerId, Long machineId) {
        TrainingSession session = sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));

        TrainingSession rescheduled = session.reschedule(
                interval,
                trainerId != null ? trainerId : session.trainerId(),
                machineId != null ? machineId : session.machineId());
        TrainingSession saved = sessionRepository.save(rescheduled);

        log.info("Session rescheduled: sessionId={}, start={}, end={}, trainerId={}, machineId={}",
                sessionId, saved.scheduledStart(), saved.scheduledEnd(), saved.trainerId(), saved.machineId());
        return saved;
    }

    /**
     * 세션 삭제 (참가자 먼저 삭제)
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void deleteSession(Long sessionId) {
        sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));

        participantRepository.deleteBySessionId(sessionId);
        sessionRepository.deleteById(sessionId);
        log.info("Session deleted: sessionId={}", sessionId);
    }

    /**
     * 카운터/대기 순번 보정
     *
     * @return 보정이 발생했으면 true
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public boolean reconcile(Long sessionId) {
        SessionRoster roster = lockRoster(sessionId);
        boolean drifted = stateMachine.reconcile(roster);
        if (drifted) {
            persist(roster);
        }
        return drifted;
    }

    private StatusChangeResult changeStatus(Long sessionId, BookingStatus newStatus,
                                            Function<SessionRoster, Integer> locator) {
        SessionRoster roster = lockRoster(sessionId);
        int index = locator.apply(roster);
        BookingStatus previous = roster.participantAt(index).bookingStatus();

        RosterTransition transition;
        try {
            transition = stateMachine.changeStatus(roster, index, newStatus);
        } catch (BusinessException e) {
            throw e.atStep(BookingStep.TRANSITION.name());
        }
        persist(roster);

        StatusChangeResult result = StatusChangeResult.from(transition);
        log.info("Participant status changed: sessionId={}, participantId={}, {} -> {}, promoted={}",
                sessionId, result.participant().id(), previous, newStatus, result.promoted().size());
        return result;
    }

    private AdmissionResult admit(SessionRoster roster, Long memberId, BookingParty party) {
        RosterTransition transition;
        try {
            transition = stateMachine.admit(roster, memberId, party.guest());
        } catch (BusinessException e) {
            throw e.atStep(BookingStep.ADMIT_PARTICIPANT.name());
        }
        persist(roster);

        AdmissionResult result = new AdmissionResult(
                transition.session(), transition.subject().orElse(null), memberId);
        log.info("Participant admitted: sessionId={}, participantId={}, memberId={}, status={}",
                result.session().id(), result.participant().id(), memberId, result.participant().bookingStatus());
        return result;
    }

    private Long resolveMemberId(BookingParty party) {
        if (!party.createsMember()) {
            return party.memberId();
        }
        Member created = memberRepository.createTrialMember(party.trialMember());
        log.info("Trial member created: memberId={}", created.id());
        return created.id();
    }

    private SessionRoster lockRoster(Long sessionId) {
        TrainingSession session = sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return SessionRoster.of(session, participantRepository.findBySessionId(sessionId));
    }

    /**
     * 변경 사항 저장: 삭제 -> 참가자 -> 세션 -> 알림(Outbox) 순
     */
    private void persist(SessionRoster roster) {
        roster.removedParticipants().forEach(participant -> participantRepository.deleteById(participant.id()));
        roster.clearRemoved();
        roster.flushParticipants(participantRepository::save);
        roster.flushSession(sessionRepository::save);
        roster.drainEvents().forEach(notificationPort::publish);
    }
}
