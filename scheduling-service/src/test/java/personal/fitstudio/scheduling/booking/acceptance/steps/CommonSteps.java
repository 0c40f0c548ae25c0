package personal.fitstudio.scheduling.booking.acceptance.steps;

import io.cucumber.java.Before;
import io.cucumber.java.en.Then;
import io.cucumber.spring.ScenarioScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.fitstudio.scheduling.booking.acceptance.support.SchedulingTestAdapter;
import personal.fitstudio.scheduling.booking.acceptance.support.SchedulingTestContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 시나리오 공통 Step (초기화, 응답 검증)
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class CommonSteps {

    private final SchedulingTestAdapter schedulingAdapter;
    private final SchedulingTestContext context;

    @Before
    public void 시나리오_초기화() {
        log.info(">>> Before: 테스트 데이터 초기화");
        schedulingAdapter.clearAllData();
        context.reset();
    }

    @Then("응답 상태 코드는 {int}이다")
    public void 응답_상태_코드는_이다(int statusCode) {
        log.info(">>> Then: 응답 상태 코드 검증 - expected={}", statusCode);
        assertThat(context.getLastHttpResponse().statusCode())
                .as("response body: %s", context.getLastHttpResponse().asString())
                .isEqualTo(statusCode);
    }

    @Then("에러 코드는 {string}이고 실패 단계는 {string}이다")
    public void 에러_코드와_실패_단계를_확인한다(String code, String step) {
        log.info(">>> Then: 에러 응답 검증 - code={}, step={}", code, step);
        assertThat(context.getLastHttpResponse().jsonPath().getString("code")).isEqualTo(code);
        assertThat(context.getLastHttpResponse().jsonPath().getString("step")).isEqualTo(step);
    }
}
