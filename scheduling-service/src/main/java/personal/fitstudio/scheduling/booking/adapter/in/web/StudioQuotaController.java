package personal.fitstudio.scheduling.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.StudioQuotaResponse;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.WeeklySessionLimitRequest;
import personal.fitstudio.scheduling.booking.adapter.in.web.dto.WeeklySessionLimitResponse;
import personal.fitstudio.scheduling.booking.application.port.in.StudioQuotaUseCase;

import java.time.LocalDate;

/**
 * Studio Quota API Controller
 * 주간 스튜디오 한도 조회/변경
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/studio")
@RequiredArgsConstructor
public class StudioQuotaController {

    private final StudioQuotaUseCase studioQuotaUseCase;

    /**
     * 주간 사용량 조회
     * GET /api/v1/studio/quota?date=2025-01-15
     */
    @GetMapping("/quota")
    public ResponseEntity<StudioQuotaResponse> getQuota(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        log.info("Get studio quota: date={}", date);
        return ResponseEntity.ok(StudioQuotaResponse.from(studioQuotaUseCase.checkStudioQuota(date)));
    }

    @GetMapping("/settings/weekly-session-limit")
    public ResponseEntity<WeeklySessionLimitResponse> getWeeklySessionLimit() {
        return ResponseEntity.ok(new WeeklySessionLimitResponse(studioQuotaUseCase.getWeeklySessionLimit()));
    }

    /**
     * 주간 한도 변경 (관리자)
     * PUT /api/v1/studio/settings/weekly-session-limit
     */
    @PutMapping("/settings/weekly-session-limit")
    public ResponseEntity<WeeklySessionLimitResponse> updateWeeklySessionLimit(
            @Valid @RequestBody WeeklySessionLimitRequest request
    ) {
        log.info("Update weekly session limit: limit={}", request.limit());
        studioQuotaUseCase.updateWeeklySessionLimit(request.limit());
        return ResponseEntity.ok(new WeeklySessionLimitResponse(request.limit()));
    }
}
