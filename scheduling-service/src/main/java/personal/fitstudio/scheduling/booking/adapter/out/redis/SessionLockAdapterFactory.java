package personal.fitstudio.scheduling.booking.adapter.out.redis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.fitstudio.scheduling.booking.application.config.SchedulingProperties;
import personal.fitstudio.scheduling.booking.application.port.out.SessionLockRepository;

import java.time.Duration;

/**
 * Session Lock Adapter Factory
 * 설정에 따라 SessionLockRepository 구현체를 생성
 *
 * 설정:
 * - scheduling.lock.strategy=none  -> NoLockAdapter (기본값)
 * - scheduling.lock.strategy=redis -> RedisSessionLockAdapter
 */
@Slf4j
@Configuration
public class SessionLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "scheduling.lock.strategy", havingValue = "none", matchIfMissing = true)
    public SessionLockRepository noLockAdapter() {
        log.info("Creating NoLockAdapter - session writes are serialized by DB row locks only");
        return new NoLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "scheduling.lock.strategy", havingValue = "redis")
    public SessionLockRepository redisSessionLockAdapter(
            StringRedisTemplate redisTemplate,
            RedisScript<Long> releaseLockScript,
            SchedulingProperties properties) {

        log.info("Creating RedisSessionLockAdapter - TTL: {}s", properties.lock().ttlSeconds());
        return new RedisSessionLockAdapter(
                redisTemplate,
                releaseLockScript,
                Duration.ofSeconds(properties.lock().ttlSeconds()));
    }
}
