package personal.fitstudio.scheduling.booking.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.domain.exception.BookingValidationException;
import personal.fitstudio.scheduling.booking.domain.model.BookingStatus;
import personal.fitstudio.scheduling.booking.domain.model.GuestDetails;
import personal.fitstudio.scheduling.booking.domain.model.NotificationEvent;
import personal.fitstudio.scheduling.booking.domain.model.Participant;
import personal.fitstudio.scheduling.booking.domain.model.RosterTransition;
import personal.fitstudio.scheduling.booking.domain.model.SessionRoster;
import personal.fitstudio.scheduling.booking.domain.model.SessionStatus;
import personal.fitstudio.scheduling.booking.domain.model.TrainingSession;

import java.util.ArrayList;
import java.util.List;

/**
 * Capacity & Waitlist State Machine
 * 참가자 상태, 세션 정원 카운터, 대기 순번을 변경하는 유일한 컴포넌트
 * 저장소에 접근하지 않고 SessionRoster만 변경 (저장은 BookingManager 담당)
 *
 * 불변식:
 * - session.currentParticipants == CONFIRMED 참가자 수
 * - 대기 순번은 항상 {1..k}
 */
@Slf4j
@Component
public class WaitlistStateMachine {

    /**
     * 참가자 등록
     * 빈 좌석이 있으면 CONFIRMED, 없으면 마지막 순번 뒤에 WAITLISTED
     */
    public RosterTransition admit(SessionRoster roster, Long memberId, GuestDetails guest) {
        TrainingSession session = roster.session();
        if (session.isTerminal()) {
            throw new BookingValidationException(
                    String.format("Cannot book into %s session. Session ID: %d", session.status(), session.id()));
        }
        if (memberId != null && roster.findActiveIndexByMember(memberId).isPresent()) {
            throw new BookingValidationException(
                    String.format("Member already has an active booking for this session. sessionId=%d, memberId=%d",
                            session.id(), memberId));
        }

        if (session.hasOpenSeat()) {
            int index = roster.add(Participant.confirmed(session.id(), memberId, guest));
            roster.updateSession(session.withCurrentParticipants(session.currentParticipants() + 1));
            log.debug("Participant confirmed: sessionId={}, memberId={}, seats={}/{}",
                    session.id(), memberId, session.currentParticipants() + 1, session.maxParticipants());
            return RosterTransition.of(roster, index, List.of());
        }

        int position = roster.nextWaitlistPosition();
        int index = roster.add(Participant.waitlisted(session.id(), memberId, guest, position));
        roster.record(NotificationEvent.waitlistAssigned(session.id(), memberId, position));
        log.debug("Participant waitlisted: sessionId={}, memberId={}, position={}", session.id(), memberId, position);
        return RosterTransition.of(roster, index, List.of());
    }

    /**
     * 참가자 상태 변경
     * CONFIRMED 이탈 시 좌석을 반납하고 대기 1순위를 승급 (종료된 세션은 승급 없음)
     * WAITLISTED 취소 시 뒤 순번을 당김 (승급 없음)
     */
    public RosterTransition changeStatus(SessionRoster roster, int index, BookingStatus newStatus) {
        Participant current = roster.participantAt(index);
        Participant updated = current.transitionTo(newStatus);
        roster.replace(index, updated);

        if (current.isConfirmed()) {
            releaseSeat(roster);
            if (roster.session().isTerminal()) {
                return RosterTransition.of(roster, index, List.of());
            }
            List<Integer> promoted = fillOpenSeats(roster);
            return RosterTransition.of(roster, index, promoted);
        }

        closeGap(roster, current.waitlistPosition());
        return RosterTransition.of(roster, index, List.of());
    }

    /**
     * 대기 참가자 관리자 삭제 (물리 삭제)
     */
    public RosterTransition removeWaitlisted(SessionRoster roster, int index) {
        Participant current = roster.participantAt(index);
        if (!current.isWaitlisted()) {
            throw new BookingValidationException(String.format(
                    "Only waitlisted participants can be removed, cancel the booking instead. participantId=%d, status=%s",
                    current.id(), current.bookingStatus()));
        }
        roster.remove(index);
        closeGap(roster, current.waitlistPosition());
        return RosterTransition.removal(roster, current);
    }

    /**
     * 정원 변경
     * 늘어나면 순번대로 승급, 확정 인원 아래로 줄어들면 강등 없이 신규 확정만 막음
     */
    public RosterTransition changeCapacity(SessionRoster roster, int newMax) {
        TrainingSession session = roster.session();
        if (session.isTerminal()) {
            throw new BookingValidationException(
                    String.format("Cannot change capacity of %s session. Session ID: %d", session.status(), session.id()));
        }
        if (newMax < 1) {
            throw new BookingValidationException("Max participants must be at least 1");
        }

        roster.updateSession(session.withMaxParticipants(newMax));
        if (newMax < session.currentParticipants()) {
            log.warn("Capacity lowered below confirmed count, no demotion: sessionId={}, confirmed={}, newMax={}",
                    session.id(), session.currentParticipants(), newMax);
        }
        return RosterTransition.sessionWide(roster, fillOpenSeats(roster));
    }

    /**
     * 세션 상태 변경
     * CANCELLED는 활성 참가자를 일괄 취소 (승급/알림 없음)
     */
    public RosterTransition changeSessionStatus(SessionRoster roster, SessionStatus newStatus) {
        TrainingSession updated = roster.session().transitionTo(newStatus);
        if (newStatus != SessionStatus.CANCELLED) {
            roster.updateSession(updated);
            return RosterTransition.sessionWide(roster, List.of());
        }

        roster.updateSession(updated.withCurrentParticipants(0));
        List<Integer> active = roster.activeIndexes();
        for (int index : active) {
            roster.replace(index, roster.participantAt(index).cancelWithSession());
        }
        int cancelled = active.size();
        log.info("Session cancelled: sessionId={}, cancelledParticipants={}", updated.id(), cancelled);
        return RosterTransition.sessionWide(roster, List.of());
    }

    /**
     * 카운터 재계산 및 대기 순번 재정렬
     * 보정 후 빈 좌석이 생기면 대기 순번대로 승급
     *
     * @return 보정이 발생했으면 true
     */
    public boolean reconcile(SessionRoster roster) {
        TrainingSession session = roster.session();
        boolean drifted = false;

        int confirmed = roster.confirmedCount();
        if (confirmed != session.currentParticipants()) {
            log.warn("Participant counter drift corrected: sessionId={}, stored={}, actual={}",
                    session.id(), session.currentParticipants(), confirmed);
            roster.updateSession(session.withCurrentParticipants(confirmed));
            drifted = true;
        }

        List<Integer> waitlist = roster.waitlistIndexes();
        for (int i = 0; i < waitlist.size(); i++) {
            int index = waitlist.get(i);
            Participant participant = roster.participantAt(index);
            if (participant.waitlistPosition() != i + 1) {
                log.warn("Waitlist position drift corrected: sessionId={}, participantId={}, stored={}, actual={}",
                        session.id(), participant.id(), participant.waitlistPosition(), i + 1);
                roster.replace(index, participant.withWaitlistPosition(i + 1));
                drifted = true;
            }
        }

        if (!roster.session().isTerminal()) {
            List<Integer> promoted = fillOpenSeats(roster);
            if (!promoted.isEmpty()) {
                log.warn("Stranded waitlist promoted during reconciliation: sessionId={}, promoted={}",
                        session.id(), promoted.size());
                drifted = true;
            }
        }
        return drifted;
    }

    private void releaseSeat(SessionRoster roster) {
        TrainingSession session = roster.session();
        roster.updateSession(session.withCurrentParticipants(Math.max(0, session.currentParticipants() - 1)));
    }

    private List<Integer> fillOpenSeats(SessionRoster roster) {
        List<Integer> promoted = new ArrayList<>();
        while (roster.session().hasOpenSeat()) {
            Integer head = roster.waitlistHeadIndex().orElse(null);
            if (head == null) {
                break;
            }
            Participant next = roster.participantAt(head);
            roster.replace(head, next.promote());
            TrainingSession session = roster.session();
            roster.updateSession(session.withCurrentParticipants(session.currentParticipants() + 1));
            closeGap(roster, next.waitlistPosition());
            roster.record(NotificationEvent.waitlistPromoted(session.id(), next.memberId()));
            promoted.add(head);
            log.info("Waitlisted participant promoted: sessionId={}, participantId={}, memberId={}",
                    session.id(), next.id(), next.memberId());
        }
        return promoted;
    }

    /**
     * vacated 순번보다 뒤의 대기자를 한 칸씩 당김
     */
    private void closeGap(SessionRoster roster, int vacated) {
        for (int index : roster.waitlistIndexes()) {
            Participant participant = roster.participantAt(index);
            if (participant.waitlistPosition() > vacated) {
                roster.replace(index, participant.withWaitlistPosition(participant.waitlistPosition() - 1));
            }
        }
    }
}
