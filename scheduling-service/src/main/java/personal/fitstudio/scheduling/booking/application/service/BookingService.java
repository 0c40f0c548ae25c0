package personal.fitstudio.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.fitstudio.common.exception.BusinessException;
import personal.fitstudio.scheduling.booking.application.port.in.BookingResult;
import personal.fitstudio.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.fitstudio.scheduling.booking.application.port.in.CreateBookingUseCase;
import personal.fitstudio.scheduling.booking.application.port.in.GetSessionUseCase;
import personal.fitstudio.scheduling.booking.application.port.in.ManageSessionUseCase;
import personal.fitstudio.scheduling.booking.application.port.in.RescheduleResult;
import personal.fitstudio.scheduling.booking.application.port.in.RescheduleSessionCommand;
import personal.fitstudio.scheduling.booking.application.port.in.UpdateParticipantStatusUseCase;
import personal.fitstudio.scheduling.booking.application.port.out.MemberRepository;
import personal.fitstudio.scheduling.booking.application.port.out.ParticipantRepository;
import personal.fitstudio.scheduling.booking.application.port.out.SessionLockRepository;
import personal.fitstudio.scheduling.booking.application.port.out.TrainingSessionRepository;
import personal.fitstudio.scheduling.booking.domain.exception.BookingValidationException;
import personal.fitstudio.scheduling.booking.domain.exception.ConcurrentBookingException;
import personal.fitstudio.scheduling.booking.domain.exception.MemberNotFoundException;
import personal.fitstudio.scheduling.booking.domain.exception.SessionNotFoundException;
import personal.fitstudio.scheduling.booking.domain.exception.WeeklyQuotaExceededException;
import personal.fitstudio.scheduling.booking.domain.model.AdmissionResult;
import personal.fitstudio.scheduling.booking.domain.model.AvailabilityCheck;
import personal.fitstudio.scheduling.booking.domain.model.BookingParty;
import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;
import personal.fitstudio.scheduling.booking.domain.model.BookingStep;
import personal.fitstudio.scheduling.booking.domain.model.GuestDetails;
import personal.fitstudio.scheduling.booking.domain.model.Member;
import personal.fitstudio.scheduling.booking.domain.model.NewMemberDetails;
import personal.fitstudio.scheduling.booking.domain.model.Participant;
import personal.fitstudio.scheduling.booking.domain.model.PolicyFlags;
import personal.fitstudio.scheduling.booking.domain.model.ResourceRef;
import personal.fitstudio.scheduling.booking.domain.model.SessionDetails;
import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;
import personal.fitstudio.scheduling.booking.domain.model.StatusChangeResult;
import personal.fitstudio.scheduling.booking.domain.model.StudioQuota;
import personal.fitstudio.scheduling.booking.domain.model.TimeInterval;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;
import personal.fitstudio.scheduling.booking.domain.service.BookingManager;
import personal.fitstudio.scheduling.booking.domain.service.IntervalConflictChecker;
import personal.fitstudio.scheduling.booking.domain.service.SessionTypePolicy;
import personal.fitstudio.scheduling.booking.domain.service.WeeklyQuotaChecker;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Booking Application Service (Orchestrator)
 * 정책 분류, 회원 확인, 중복/한도 검사를 조합하고 저장은 BookingManager에 위임
 * 실패 시 어느 단계에서 실패했는지 예외에 기록
 *
 * 트랜잭션은 BookingManager가 소유 (락 대기 초과/커밋 실패를 여기서 ConcurrentBookingException으로 변환)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements
        CreateBookingUseCase,
        UpdateParticipantStatusUseCase,
        ManageSessionUseCase,
        GetSessionUseCase {

    static final Duration MIN_SESSION_DURATION = Duration.ofMinutes(15);
    static final Duration MAX_SESSION_DURATION = Duration.ofHours(8);

    private final TrainingSessionRepository sessionRepository;
    private final ParticipantRepository participantRepository;
    private final MemberRepository memberRepository;
    private final SessionLockRepository sessionLockRepository;
    private final IntervalConflictChecker conflictChecker;
    private final WeeklyQuotaChecker quotaChecker;
    private final BookingManager bookingManager;

    @Override
    public BookingResult createBooking(CreateBookingCommand command) {
        log.info("Creating booking: sessionId={}, type={}, memberId={}, trainerId={}, machineId={}",
                command.sessionId(), command.sessionType(), command.memberId(), command.trainerId(), command.machineId());

        if (command.joinsExistingSession()) {
            return joinExistingSession(command);
        }

        // 1. 분류
        PolicyFlags policy = runStep(BookingStep.CLASSIFY, () -> classify(command.sessionType()));

        // 2. 요청 검증 (시간 구간, 정원, 머신)
        TrainingSession draft = runStep(BookingStep.VALIDATE_REQUEST, () -> validateNewSession(command));

        // 3. 회원 확인 (체험 회원은 저장 트랜잭션에서 생성)
        BookingParty party = runStep(BookingStep.RESOLVE_MEMBER, () -> resolveParty(command, policy));

        // 4. 트레이너 중복 검사 (권고용, 결과만 첨부)
        AvailabilityCheck availability = runStep(BookingStep.CHECK_AVAILABILITY,
                () -> checkTrainer(draft.trainerId(), draft.scheduledStart(), draft.scheduledEnd(), null));

        // 5. 주간 스튜디오 한도
        if (!policy.bypassesWeeklyQuota()) {
            runStep(BookingStep.CHECK_QUOTA, () -> ensureWeeklyQuota(draft.scheduledStart()));
        }

        // 6. 세션 생성 + 참가자 등록 (하나의 트랜잭션)
        AdmissionResult admission = runStep(BookingStep.CREATE_SESSION,
                () -> inTransaction(null, () -> bookingManager.createSessionWithParticipant(draft, party)));

        BookingResult result = toResult(admission, availability);
        log.info("Booking created: sessionId={}, participantId={}, status={}, waitlistPosition={}",
                result.sessionId(), result.participantId(), result.bookingStatus(), result.waitlistPosition());
        return result;
    }

    @Override
    public StatusChangeResult updateParticipantStatus(Long sessionId, Long memberId, BookingStatus newStatus) {
        log.info("Updating participant status: sessionId={}, memberId={}, newStatus={}", sessionId, memberId, newStatus);
        runStep(BookingStep.VALIDATE_REQUEST, () -> requireId(memberId, "Member ID"));
        runStep(BookingStep.VALIDATE_REQUEST, () -> requireStatus(newStatus));

        return runStep(BookingStep.TRANSITION, () -> withSessionLock(sessionId,
                () -> bookingManager.changeMemberStatus(sessionId, memberId, newStatus)));
    }

    @Override
    public StatusChangeResult updateParticipantStatusById(Long sessionId, Long participantId, BookingStatus newStatus) {
        log.info("Updating participant status: sessionId={}, participantId={}, newStatus={}",
                sessionId, participantId, newStatus);
        runStep(BookingStep.VALIDATE_REQUEST, () -> requireId(participantId, "Participant ID"));
        runStep(BookingStep.VALIDATE_REQUEST, () -> requireStatus(newStatus));

        return runStep(BookingStep.TRANSITION, () -> withSessionLock(sessionId,
                () -> bookingManager.changeParticipantStatus(sessionId, participantId, newStatus)));
    }

    @Override
    public StatusChangeResult removeWaitlistedParticipant(Long sessionId, Long participantId) {
        log.info("Removing waitlisted participant: sessionId={}, participantId={}", sessionId, participantId);
        return runStep(BookingStep.TRANSITION, () -> withSessionLock(sessionId,
                () -> bookingManager.removeWaitlistedParticipant(sessionId, participantId)));
    }

    @Override
    public StatusChangeResult changeCapacity(Long sessionId, int newMaxParticipants) {
        log.info("Changing session capacity: sessionId={}, newMax={}", sessionId, newMaxParticipants);
        return runStep(BookingStep.TRANSITION, () -> withSessionLock(sessionId,
                () -> bookingManager.changeCapacity(sessionId, newMaxParticipants)));
    }

    @Override
    public StatusChangeResult updateSessionStatus(Long sessionId, SessionStatus newStatus) {
        log.info("Updating session status: sessionId={}, newStatus={}", sessionId, newStatus);
        runStep(BookingStep.VALIDATE_REQUEST, () -> {
            if (newStatus == null) {
                throw new BookingValidationException("Session status is required");
            }
            return newStatus;
        });

        return runStep(BookingStep.TRANSITION, () -> withSessionLock(sessionId,
                () -> bookingManager.updateSessionStatus(sessionId, newStatus)));
    }

    @Override
    public RescheduleResult rescheduleSession(RescheduleSessionCommand command) {
        log.info("Rescheduling session: sessionId={}, start={}, end={}",
                command.sessionId(), command.scheduledStart(), command.scheduledEnd());
        TimeInterval interval = runStep(BookingStep.VALIDATE_REQUEST,
                () -> validateInterval(command.scheduledStart(), command.scheduledEnd()));

        TrainingSession rescheduled = runStep(BookingStep.TRANSITION, () -> withSessionLock(command.sessionId(),
                () -> bookingManager.rescheduleSession(
                        command.sessionId(), interval, command.trainerId(), command.machineId())));

        AvailabilityCheck availability = checkTrainer(rescheduled.trainerId(),
                rescheduled.scheduledStart(), rescheduled.scheduledEnd(), rescheduled.id());
        return new RescheduleResult(rescheduled, availability);
    }

    @Override
    public void deleteSession(Long sessionId) {
        log.info("Deleting session: sessionId={}", sessionId);
        runStep(BookingStep.TRANSITION, () -> withSessionLock(sessionId, () -> {
            bookingManager.deleteSession(sessionId);
            return sessionId;
        }));
    }

    @Override
    @Transactional(readOnly = true)
    public SessionDetails getSession(Long sessionId) {
        log.debug("Getting session: sessionId={}", sessionId);
        TrainingSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return SessionDetails.of(session, participantRepository.findBySessionId(sessionId));
    }

    // ========== 기존 세션 참가 ==========

    private BookingResult joinExistingSession(CreateBookingCommand command) {
        Long sessionId = command.sessionId();

        TrainingSession session = runStep(BookingStep.CLASSIFY, () -> sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId)));
        PolicyFlags policy = runStep(BookingStep.CLASSIFY, () -> classify(session.sessionType()));

        runStep(BookingStep.VALIDATE_REQUEST, () -> validateJoin(command, session));
        BookingParty party = runStep(BookingStep.RESOLVE_MEMBER, () -> resolveParty(command, policy));

        AdmissionResult admission = runStep(BookingStep.ADMIT_PARTICIPANT,
                () -> withSessionLock(sessionId, () -> bookingManager.joinSession(sessionId, party)));

        BookingResult result = toResult(admission, null);
        log.info("Booking joined existing session: sessionId={}, participantId={}, status={}, waitlistPosition={}",
                sessionId, result.participantId(), result.bookingStatus(), result.waitlistPosition());
        return result;
    }

    private TrainingSession validateJoin(CreateBookingCommand command, TrainingSession session) {
        if (command.sessionType() != null && command.sessionType() != session.sessionType()) {
            throw new BookingValidationException(String.format(
                    "Session type mismatch: requested=%s, session=%s", command.sessionType(), session.sessionType()));
        }
        if (session.sessionType() == SessionType.NON_BOOKABLE) {
            throw new BookingValidationException(
                    String.format("Session is not bookable. Session ID: %d", session.id()));
        }
        if (session.isTerminal()) {
            throw new BookingValidationException(
                    String.format("Cannot book into %s session. Session ID: %d", session.status(), session.id()));
        }
        return session;
    }

    // ========== 단계별 검증 ==========

    private PolicyFlags classify(SessionType sessionType) {
        if (sessionType == null) {
            throw new BookingValidationException("Session type is required");
        }
        return SessionTypePolicy.classify(sessionType);
    }

    private TrainingSession validateNewSession(CreateBookingCommand command) {
        if (command.machineId() == null) {
            throw new BookingValidationException("Machine ID is required");
        }
        TimeInterval interval = validateInterval(command.scheduledStart(), command.scheduledEnd());
        if (command.maxParticipantsOrDefault() < 1) {
            throw new BookingValidationException("Max participants must be at least 1");
        }
        return TrainingSession.create(
                command.machineId(),
                command.trainerId(),
                interval,
                command.sessionType(),
                command.maxParticipantsOrDefault(),
                command.notes());
    }

    static TimeInterval validateInterval(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new BookingValidationException("Session start and end time are required");
        }
        if (!end.isAfter(start)) {
            throw new BookingValidationException("Session end time must be later than start time");
        }
        Duration duration = Duration.between(start, end);
        if (duration.compareTo(MIN_SESSION_DURATION) < 0) {
            throw new BookingValidationException("Session must be at least 15 minutes long");
        }
        if (duration.compareTo(MAX_SESSION_DURATION) > 0) {
            throw new BookingValidationException("Session cannot be longer than 8 hours");
        }
        return new TimeInterval(start, end);
    }

    private BookingParty resolveParty(CreateBookingCommand command, PolicyFlags policy) {
        if (policy.guestFieldsInline()) {
            GuestDetails guest = command.guest();
            if (guest == null || !guest.isComplete()) {
                throw new BookingValidationException(
                        "Guest first name, last name and gym name are required for multi-site sessions");
            }
            return BookingParty.guest(guest);
        }

        if (policy.createsMember()) {
            return resolveTrialMember(command.newMember());
        }

        if (policy.requiresExistingMember()) {
            if (command.memberId() == null) {
                throw new BookingValidationException("Member ID is required for this session type");
            }
            Member member = memberRepository.findById(command.memberId())
                    .orElseThrow(() -> new MemberNotFoundException(command.memberId()));
            if (policy.requiredMemberType() != null && !member.is(policy.requiredMemberType())) {
                throw new BookingValidationException(String.format(
                        "Session type requires a %s member. memberId=%d, memberType=%s",
                        policy.requiredMemberType(), member.id(), member.memberType()));
            }
            return BookingParty.member(member.id());
        }

        // 예약 불가 시간대: 회원이 지정된 경우에만 연결
        if (command.memberId() != null) {
            Member member = memberRepository.findById(command.memberId())
                    .orElseThrow(() -> new MemberNotFoundException(command.memberId()));
            return BookingParty.member(member.id());
        }
        return BookingParty.none();
    }

    private BookingParty resolveTrialMember(NewMemberDetails details) {
        if (details == null || !details.isComplete()) {
            throw new BookingValidationException(
                    "First name, last name, email and phone are required for trial sessions");
        }

        Optional<Member> existing = memberRepository.findByEmail(details.email());
        if (existing.isEmpty()) {
            return BookingParty.newTrialMember(details);
        }

        // 예약 이력이 없는 회원만 재사용
        Member member = existing.get();
        if (participantRepository.existsByMemberId(member.id())) {
            throw new BookingValidationException(String.format(
                    "A member with this email already has bookings. memberId=%d", member.id()));
        }
        log.info("Reusing existing member without bookings for trial session: memberId={}", member.id());
        return BookingParty.member(member.id());
    }

    private AvailabilityCheck checkTrainer(Long trainerId, Instant start, Instant end, Long excludeSessionId) {
        if (trainerId == null) {
            return null;
        }
        AvailabilityCheck availability = conflictChecker.checkAvailability(
                ResourceRef.trainer(trainerId), start, end, excludeSessionId);
        if (!availability.available()) {
            log.warn("Trainer double booking (advisory): trainerId={}, start={}, conflicts={}",
                    trainerId, start, availability.conflicts().size());
        }
        return availability;
    }

    private StudioQuota ensureWeeklyQuota(Instant sessionStart) {
        StudioQuota quota = quotaChecker.checkStudioQuota(sessionStart);
        if (!quota.canBook()) {
            log.warn("Weekly studio quota reached: count={}, limit={}", quota.currentCount(), quota.maxAllowed());
            throw new WeeklyQuotaExceededException(quota);
        }
        return quota;
    }

    private Long requireId(Long id, String name) {
        if (id == null) {
            throw new BookingValidationException(name + " is required");
        }
        return id;
    }

    private BookingStatus requireStatus(BookingStatus newStatus) {
        if (newStatus == null) {
            throw new BookingValidationException("Booking status is required");
        }
        return newStatus;
    }

    // ========== 실행 래퍼 ==========

    private <T> T runStep(BookingStep step, Supplier<T> action) {
        try {
            return action.get();
        } catch (BusinessException e) {
            throw e.atStep(step.name());
        }
    }

    /**
     * Fail-Fast 세션 락 (전략이 none이면 항상 통과) 후 트랜잭션 실행
     */
    private <T> T withSessionLock(Long sessionId, Supplier<T> action) {
        String owner = UUID.randomUUID().toString();
        if (!sessionLockRepository.tryLock(sessionId, owner)) {
            log.warn("Session lock busy: sessionId={}, strategy={}", sessionId, sessionLockRepository.getStrategyName());
            throw new ConcurrentBookingException(sessionId).atStep(BookingStep.ACQUIRE_LOCK.name());
        }
        try {
            return inTransaction(sessionId, action);
        } finally {
            sessionLockRepository.unlock(sessionId, owner);
        }
    }

    private <T> T inTransaction(Long sessionId, Supplier<T> action) {
        try {
            return action.get();
        } catch (PessimisticLockingFailureException e) {
            // 행 락 대기 초과, 데드락 (부분 반영 없이 롤백됨)
            log.warn("Session row lock not acquired: sessionId={}, cause={}", sessionId, e.getMessage());
            throw new ConcurrentBookingException(sessionId).atStep(BookingStep.ACQUIRE_LOCK.name());
        } catch (DataIntegrityViolationException e) {
            log.error("Concurrent booking detected: sessionId={}", sessionId, e);
            throw new ConcurrentBookingException(sessionId);
        }
    }

    private BookingResult toResult(AdmissionResult admission, AvailabilityCheck availability) {
        Participant participant = admission.participant();
        return new BookingResult(
                admission.session().id(),
                participant != null ? participant.id() : null,
                admission.memberId(),
                participant != null ? participant.bookingStatus() : null,
                participant != null ? participant.waitlistPosition() : null,
                availability);
    }
}
