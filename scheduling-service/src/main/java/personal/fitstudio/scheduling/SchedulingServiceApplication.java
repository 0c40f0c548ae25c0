package personal.fitstudio.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduling Service Application
 * 세션 예약, 정원/대기열, 주간 스튜디오 한도를 관리하는 서비스
 */
@EnableScheduling  // Outbox / Counter Reconciliation Scheduler 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.fitstudio.scheduling",
        "personal.fitstudio.common"  // common 모듈의 GlobalExceptionHandler 스캔
    }
)
public class SchedulingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchedulingServiceApplication.class, args);
    }
}
