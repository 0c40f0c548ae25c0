package personal.fitstudio.scheduling.booking.application.port.in;

/**
 * Reconcile Counters UseCase (Input Port)
 * 종료되지 않은 세션의 참가 인원 카운터와 대기 순번을 재계산
 */
public interface ReconcileCountersUseCase {

    /**
     * @return 보정된 세션 수
     */
    int reconcileCounters();
}
