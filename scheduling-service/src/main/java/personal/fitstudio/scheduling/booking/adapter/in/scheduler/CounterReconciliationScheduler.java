package personal.fitstudio.scheduling.booking.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.fitstudio.scheduling.booking.application.port.in.ReconcileCountersUseCase;

/**
 * Counter Reconciliation Scheduler (Driving Adapter)
 * 세션 참가 인원 카운터와 대기 순번을 주기적으로 재계산
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduling.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class CounterReconciliationScheduler {

    private final ReconcileCountersUseCase reconcileCountersUseCase;
    private final MeterRegistry meterRegistry;

    @Scheduled(fixedDelayString = "${scheduling.reconciliation.interval-ms:600000}",
            initialDelayString = "${scheduling.reconciliation.interval-ms:600000}")
    public void scheduleReconciliation() {
        log.debug("Counter reconciliation started");
        Timer.Sample sample = Timer.start(meterRegistry);

        int corrected = reconcileCountersUseCase.reconcileCounters();

        sample.stop(Timer.builder("scheduler.reconciliation.duration")
                .description("Time taken to reconcile participant counters of non-terminal sessions")
                .register(meterRegistry));

        // 0이 아니면 카운터가 상태 기계 밖에서 어긋났다는 신호
        Counter.builder("scheduler.reconciliation.corrected")
                .description("Number of sessions whose counter or waitlist positions were corrected")
                .register(meterRegistry)
                .increment(corrected);
    }
}
