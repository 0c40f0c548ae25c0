package personal.fitstudio.scheduling.booking.acceptance.support;

import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.Getter;
import lombok.Setter;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Scheduling Acceptance Test Context
 * 같은 시나리오 내의 모든 Step 클래스가 공유하는 상태
 */
@Getter
@Setter
@Component
@ScenarioScope
public class SchedulingTestContext {

    /** 마지막 HTTP API 응답 */
    private Response lastHttpResponse;

    /** 현재 시나리오의 세션 ID */
    private Long currentSessionId;

    /** 시나리오에서 부르는 회원 이름 -> 회원 ID */
    private final Map<String, Long> memberIds = new HashMap<>();

    public Long memberId(String name) {
        Long memberId = memberIds.get(name);
        if (memberId == null) {
            throw new IllegalStateException("Unknown member in scenario: " + name);
        }
        return memberId;
    }

    public void reset() {
        lastHttpResponse = null;
        currentSessionId = null;
        memberIds.clear();
    }
}
