package personal.fitstudio.scheduling.booking.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.fitstudio.scheduling.booking.application.port.out.SessionLockRepository;

import java.time.Duration;
import java.util.Collections;

/**
 * Redis Session Lock Adapter
 * Redis SETNX 기반 세션 단위 Fail-Fast 락
 * Lua Script를 사용한 원자적 락 해제 (소유권 검증)
 *
 * 사용 환경:
 * - 다중 인스턴스 운영 환경 (DB 행 락 대기 전에 빠르게 거절)
 */
@Slf4j
@RequiredArgsConstructor
public class RedisSessionLockAdapter implements SessionLockRepository {

    private static final String SESSION_LOCK_PREFIX = "session:lock:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;
    private final Duration lockTtl;

    @Override
    public boolean tryLock(Long sessionId, String owner) {
        String key = SESSION_LOCK_PREFIX + sessionId;

        // SETNX + TTL을 원자적으로 수행 (setIfAbsent)
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key, owner, lockTtl);
        boolean locked = Boolean.TRUE.equals(success);

        log.debug("Session lock attempt: sessionId={}, success={}", sessionId, locked);
        return locked;
    }

    @Override
    public void unlock(Long sessionId, String owner) {
        String key = SESSION_LOCK_PREFIX + sessionId;

        try {
            Long result = redisTemplate.execute(releaseLockScript, Collections.singletonList(key), owner);

            if (result != null && result == 1L) {
                log.debug("Session lock released: sessionId={}", sessionId);
            } else {
                log.warn("Failed to release session lock (not owned or already expired): sessionId={}", sessionId);
            }
        } catch (Exception e) {
            // TTL로 자동 해제되므로 예외를 전파하지 않음
            log.error("Error releasing session lock: sessionId={}", sessionId, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }
}
