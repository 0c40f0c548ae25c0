package personal.fitstudio.scheduling.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.BookingResponse;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.StatusChangeResponse;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.UpdateParticipantStatusRequest;
import personal.fitstudio.scheduling.booking.application.port.in.BookingResult;
import personal.fitstudio.scheduling.booking.application.port.in.CreateBookingUseCase;
import personal.fitstudio.scheduling.booking.application.port.in.UpdateParticipantStatusUseCase;
import personal.fitstudio.scheduling.booking.domain.model.StatusChangeResult;

/**
 * Booking API Controller
 * 예약 생성 및 참가자 상태 변경 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BookingController {

    private final CreateBookingUseCase createBookingUseCase;
    private final UpdateParticipantStatusUseCase updateParticipantStatusUseCase;

    /**
     * 예약 생성 (세션 생성 또는 기존 세션 참가)
     * POST /api/v1/bookings
     */
    @PostMapping("/bookings")
    public ResponseEntity<BookingResponse> createBooking(@Valid @RequestBody CreateBookingRequest request) {
        log.info("Create booking: sessionId={}, type={}, memberId={}",
                request.sessionId(), request.sessionType(), request.memberId());

        BookingResult result = createBookingUseCase.createBooking(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(result));
    }

    /**
     * 회원 예약 상태 변경 (취소/노쇼)
     * PATCH /api/v1/sessions/{sessionId}/members/{memberId}/status
     */
    @PatchMapping("/sessions/{sessionId}/members/{memberId}/status")
    public ResponseEntity<StatusChangeResponse> updateMemberStatus(
            @PathVariable Long sessionId,
            @PathVariable Long memberId,
            @Valid @RequestBody UpdateParticipantStatusRequest request
    ) {
        log.info("Update member status: sessionId={}, memberId={}, status={}", sessionId, memberId, request.status());

        StatusChangeResult result = updateParticipantStatusUseCase.updateParticipantStatus(
                sessionId, memberId, request.status());

        return ResponseEntity.ok(StatusChangeResponse.from(result));
    }

    /**
     * 참가자 예약 상태 변경 (게스트 참가자 포함)
     * PATCH /api/v1/sessions/{sessionId}/participants/{participantId}/status
     */
    @PatchMapping("/sessions/{sessionId}/participants/{participantId}/status")
    public ResponseEntity<StatusChangeResponse> updateParticipantStatus(
            @PathVariable Long sessionId,
            @PathVariable Long participantId,
            @Valid @RequestBody UpdateParticipantStatusRequest request
    ) {
        log.info("Update participant status: sessionId={}, participantId={}, status={}",
                sessionId, participantId, request.status());

        StatusChangeResult result = updateParticipantStatusUseCase.updateParticipantStatusById(
                sessionId, participantId, request.status());

        return ResponseEntity.ok(StatusChangeResponse.from(result));
    }

    /**
     * 대기 참가자 삭제
     * DELETE /api/v1/sessions/{sessionId}/participants/{participantId}
     */
    @DeleteMapping("/sessions/{sessionId}/participants/{participantId}")
    public ResponseEntity<StatusChangeResponse> removeWaitlistedParticipant(
            @PathVariable Long sessionId,
            @PathVariable Long participantId
    ) {
        log.info("Remove waitlisted participant: sessionId={}, participantId={}", sessionId, participantId);

        StatusChangeResult result = updateParticipantStatusUseCase.removeWaitlistedParticipant(sessionId, participantId);

        return ResponseEntity.ok(StatusChangeResponse.from(result));
    }
}
