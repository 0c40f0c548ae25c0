package personal.fitstudio.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.fitstudio.scheduling.booking.application.port.in.ReconcileCountersUseCase;
import personal.fitstudio.scheduling.booking.application.port.out.TrainingSessionRepository;
import personal.fitstudio.scheduling.booking.domain.service.BookingManager;

import java.util.List;

/**
 * Counter Reconciliation Service
 * 세션별로 독립된 트랜잭션에서 보정 (한 세션 실패가 다른 세션에 영향 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CounterReconciliationService implements ReconcileCountersUseCase {

    private final TrainingSessionRepository sessionRepository;
    private final BookingManager bookingManager;

    @Override
    public int reconcileCounters() {
        List<Long> sessionIds = sessionRepository.findNonTerminalSessionIds();
        int corrected = 0;

        for (Long sessionId : sessionIds) {
            try {
                if (bookingManager.reconcile(sessionId)) {
                    corrected++;
                }
            } catch (Exception e) {
                log.error("Failed to reconcile session counters: sessionId={}", sessionId, e);
            }
        }

        if (corrected > 0) {
            log.warn("Counter reconciliation corrected {} of {} sessions", corrected, sessionIds.size());
        } else {
            log.debug("Counter reconciliation found no drift: sessions={}", sessionIds.size());
        }
        return corrected;
    }
}
