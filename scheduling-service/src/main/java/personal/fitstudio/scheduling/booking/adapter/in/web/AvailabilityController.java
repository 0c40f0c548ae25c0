package personal.fitstudio.scheduling.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.AvailabilityResponse;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.SessionResponse;
import personal.fitstudio.scheduling.booking.application.port.in.CheckAvailabilityUseCase;
import personal.fitstudio.scheduling.booking.domain.model.ResourceRef;
import personal.fitstudio.scheduling.booking.domain.model.ResourceType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Availability API Controller
 * 트레이너/머신 중복 검사 및 하루 일정 조회
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AvailabilityController {

    private final CheckAvailabilityUseCase checkAvailabilityUseCase;

    /**
     * 자원 중복 검사 (입력이 불완전해도 "확인 불가" 결과로 응답)
     * GET /api/v1/availability?resourceType=TRAINER&resourceId=1&start=...&end=...
     */
    @GetMapping("/availability")
    public ResponseEntity<AvailabilityResponse> checkAvailability(
            @RequestParam(required = false) ResourceType resourceType,
            @RequestParam(required = false) Long resourceId,
            @RequestParam(required = false) Instant start,
            @RequestParam(required = false) Instant end,
            @RequestParam(required = false) Long excludeSessionId
    ) {
        log.info("Check availability: resourceType={}, resourceId={}, start={}, end={}",
                resourceType, resourceId, start, end);

        ResourceRef resource = resourceType != null ? new ResourceRef(resourceType, resourceId) : null;
        return ResponseEntity.ok(AvailabilityResponse.from(
                checkAvailabilityUseCase.checkAvailability(resource, start, end, excludeSessionId)));
    }

    /**
     * 트레이너 하루 일정
     * GET /api/v1/trainers/{trainerId}/schedule?date=2025-01-15
     */
    @GetMapping("/trainers/{trainerId}/schedule")
    public ResponseEntity<List<SessionResponse>> getTrainerSchedule(
            @PathVariable Long trainerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        log.info("Get trainer schedule: trainerId={}, date={}", trainerId, date);
        return ResponseEntity.ok(toResponses(ResourceRef.trainer(trainerId), date));
    }

    /**
     * 머신 하루 일정
     * GET /api/v1/machines/{machineId}/schedule?date=2025-01-15
     */
    @GetMapping("/machines/{machineId}/schedule")
    public ResponseEntity<List<SessionResponse>> getMachineSchedule(
            @PathVariable Long machineId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        log.info("Get machine schedule: machineId={}, date={}", machineId, date);
        return ResponseEntity.ok(toResponses(ResourceRef.machine(machineId), date));
    }

    private List<SessionResponse> toResponses(ResourceRef resource, LocalDate date) {
        return checkAvailabilityUseCase.getDaySchedule(resource, date).stream()
                .map(SessionResponse::from)
                .toList();
    }
}
