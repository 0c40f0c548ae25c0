package personal.fitstudio.scheduling.booking.domain.model;

import personal.fitstudio.scheduling.booking.domain.exception.BookingValidationException;
import personal.fitstudio.scheduling.booking.domain.exception.InvalidStatusTransitionException;

import java.time.Instant;

/**
 * Participant Domain Model
 * 세션과 회원(또는 게스트)의 예약 관계 (불변)
 * waitlistPosition은 WAITLISTED 상태에서만 존재
 */
public record Participant(
        Long id,
        Long sessionId,
        Long memberId,
        GuestDetails guest,
        BookingStatus bookingStatus,
        Integer waitlistPosition,
        Instant createdAt) {

    public Participant {
        if (sessionId == null) {
            throw new BookingValidationException("Session ID cannot be null");
        }
        if (bookingStatus == null) {
            throw new BookingValidationException("Booking status cannot be null");
        }
        if (bookingStatus == BookingStatus.WAITLISTED) {
            if (waitlistPosition == null || waitlistPosition < 1) {
                throw new IllegalStateException("Waitlisted participant requires a position >= 1");
            }
        } else if (waitlistPosition != null) {
            throw new IllegalStateException(
                    String.format("Waitlist position must be null in %s status", bookingStatus));
        }
    }

    public static Participant confirmed(Long sessionId, Long memberId, GuestDetails guest) {
        return new Participant(null, sessionId, memberId, guest, BookingStatus.CONFIRMED, null, Instant.now());
    }

    public static Participant waitlisted(Long sessionId, Long memberId, GuestDetails guest, int position) {
        return new Participant(null, sessionId, memberId, guest, BookingStatus.WAITLISTED, position, Instant.now());
    }

    /**
     * 대기열 승급 (WAITLISTED -> CONFIRMED)
     */
    public Participant promote() {
        if (bookingStatus != BookingStatus.WAITLISTED) {
            throw new InvalidStatusTransitionException(bookingStatus, BookingStatus.CONFIRMED);
        }
        return withStatus(BookingStatus.CONFIRMED, null);
    }

    /**
     * 명시적 상태 변경 (CONFIRMED -> CANCELLED/NO_SHOW, WAITLISTED -> CANCELLED)
     */
    public Participant transitionTo(BookingStatus next) {
        if (!bookingStatus.canTransitionTo(next)) {
            throw new InvalidStatusTransitionException(bookingStatus, next);
        }
        return withStatus(next, null);
    }

    /**
     * 세션 취소에 따른 일괄 취소 (활성 상태에서만)
     */
    public Participant cancelWithSession() {
        if (!bookingStatus.isActive()) {
            return this;
        }
        return withStatus(BookingStatus.CANCELLED, null);
    }

    /**
     * 대기 순번 변경 (앞 순번이 빠졌을 때)
     */
    public Participant withWaitlistPosition(int position) {
        if (bookingStatus != BookingStatus.WAITLISTED) {
            throw new IllegalStateException(
                    String.format("Cannot reposition participant in %s status. Participant ID: %d", bookingStatus, id));
        }
        return withStatus(BookingStatus.WAITLISTED, position);
    }

    public boolean isConfirmed() {
        return bookingStatus == BookingStatus.CONFIRMED;
    }

    public boolean isWaitlisted() {
        return bookingStatus == BookingStatus.WAITLISTED;
    }

    public boolean isActive() {
        return bookingStatus.isActive();
    }

    public boolean isGuest() {
        return memberId == null;
    }

    private Participant withStatus(BookingStatus status, Integer position) {
        return new Participant(id, sessionId, memberId, guest, status, position, createdAt);
    }
}
