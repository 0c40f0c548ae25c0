package personal.fitstudio.scheduling.booking.adapter.out.redis;

import lombok.extern.slf4j.Slf4j;
import personal.fitstudio.scheduling.booking.application.port.out.SessionLockRepository;

/**
 * NoLock Adapter
 * Fail-Fast 락 없이 DB 행 락만 사용
 *
 * 사용 환경:
 * - 로컬 개발, 단일 인스턴스
 * - 테스트
 */
@Slf4j
public class NoLockAdapter implements SessionLockRepository {

    @Override
    public boolean tryLock(Long sessionId, String owner) {
        log.trace("[NoLock] Always allow: sessionId={}", sessionId);
        return true;
    }

    @Override
    public void unlock(Long sessionId, String owner) {
        // 해제할 락 없음
    }

    @Override
    public String getStrategyName() {
        return "none";
    }
}
