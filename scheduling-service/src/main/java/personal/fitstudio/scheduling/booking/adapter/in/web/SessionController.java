package personal.fitstudio.scheduling.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.ChangeCapacityRequest;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.RescheduleResponse;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.RescheduleSessionRequest;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.SessionDetailsResponse;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.StatusChangeResponse;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.UpdateSessionStatusRequest;
import personal.fitstudio.scheduling.booking.application.port.in.GetSessionUseCase;
import personal.fitstudio.scheduling.booking.application.port.in.ManageSessionUseCase;

/**
 * Session API Controller
 * 세션 조회/정원/상태/일정 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final GetSessionUseCase getSessionUseCase;
    private final ManageSessionUseCase manageSessionUseCase;

    /**
     * 세션 상세 조회
     * GET /api/v1/sessions/{sessionId}
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionDetailsResponse> getSession(@PathVariable Long sessionId) {
        log.info("Get session: sessionId={}", sessionId);
        return ResponseEntity.ok(SessionDetailsResponse.from(getSessionUseCase.getSession(sessionId)));
    }

    /**
     * 정원 변경
     * PATCH /api/v1/sessions/{sessionId}/capacity
     */
    @PatchMapping("/{sessionId}/capacity")
    public ResponseEntity<StatusChangeResponse> changeCapacity(
            @PathVariable Long sessionId,
            @Valid @RequestBody ChangeCapacityRequest request
    ) {
        log.info("Change capacity: sessionId={}, maxParticipants={}", sessionId, request.maxParticipants());
        return ResponseEntity.ok(StatusChangeResponse.from(
                manageSessionUseCase.changeCapacity(sessionId, request.maxParticipants())));
    }

    /**
     * 세션 상태 변경
     * PATCH /api/v1/sessions/{sessionId}/status
     */
    @PatchMapping("/{sessionId}/status")
    public ResponseEntity<StatusChangeResponse> updateSessionStatus(
            @PathVariable Long sessionId,
            @Valid @RequestBody UpdateSessionStatusRequest request
    ) {
        log.info("Update session status: sessionId={}, status={}", sessionId, request.status());
        return ResponseEntity.ok(StatusChangeResponse.from(
                manageSessionUseCase.updateSessionStatus(sessionId, request.status())));
    }

    /**
     * 일정 변경
     * PUT /api/v1/sessions/{sessionId}/schedule
     */
    @PutMapping("/{sessionId}/schedule")
    public ResponseEntity<RescheduleResponse> rescheduleSession(
            @PathVariable Long sessionId,
            @Valid @RequestBody RescheduleSessionRequest request
    ) {
        log.info("Reschedule session: sessionId={}, start={}, end={}",
                sessionId, request.scheduledStart(), request.scheduledEnd());
        return ResponseEntity.ok(RescheduleResponse.from(
                manageSessionUseCase.rescheduleSession(request.toCommand(sessionId))));
    }

    /**
     * 세션 삭제 (참가자 포함)
     * DELETE /api/v1/sessions/{sessionId}
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable Long sessionId) {
        log.info("Delete session: sessionId={}", sessionId);
        manageSessionUseCase.deleteSession(sessionId);
        return ResponseEntity.noContent().build();
    }
}
