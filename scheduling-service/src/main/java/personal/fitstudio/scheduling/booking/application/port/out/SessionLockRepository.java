package personal.fitstudio.scheduling.booking.application.port.out;

/**
 * Session Lock Repository (Output Port)
 * DB 행 락 앞단의 Fail-Fast 세션 락
 */
public interface SessionLockRepository {

    /**
     * 세션 락 시도
     * 실패 시 대기하지 않고 즉시 false 반환
     *
     * @param owner 락 소유자 식별값 (해제 시 소유권 검증)
     */
    boolean tryLock(Long sessionId, String owner);

    void unlock(Long sessionId, String owner);

    String getStrategyName();
}
