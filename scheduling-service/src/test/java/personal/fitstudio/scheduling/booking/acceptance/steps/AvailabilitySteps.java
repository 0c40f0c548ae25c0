package personal.fitstudio.scheduling.booking.acceptance.steps;

import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import io.restassured.path.json.JsonPath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.fitstudio.scheduling.booking.acceptance.support.SchedulingTestAdapter;
import personal.fitstudio.scheduling.booking.acceptance.support.SchedulingTestContext;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 트레이너 중복 예약 검사 Step Definitions
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class AvailabilitySteps {

    private static final Long MACHINE_ID = 3L;

    private final SchedulingTestAdapter schedulingAdapter;
    private final SchedulingTestContext context;

    @Given("트레이너 {long}의 세션이 {string}부터 {string}까지 있다")
    public void 트레이너의_세션이_있다(Long trainerId, String start, String end) {
        log.info(">>> Given: 트레이너 {} 기존 세션 {} ~ {}", trainerId, start, end);
        Long sessionId = schedulingAdapter.createSession(MACHINE_ID, trainerId,
                Instant.parse(start), Instant.parse(end), SessionType.MEMBER);
        context.setCurrentSessionId(sessionId);
    }

    @When("트레이너 {long}의 {string}부터 {string}까지 중복 검사를 요청한다")
    public void 트레이너_중복_검사를_요청한다(Long trainerId, String start, String end) {
        log.info(">>> When: 트레이너 {} 중복 검사 {} ~ {}", trainerId, start, end);
        context.setLastHttpResponse(schedulingAdapter.checkTrainerAvailability(
                trainerId, Instant.parse(start), Instant.parse(end)));
    }

    @Then("트레이너는 예약 가능하다")
    public void 트레이너는_예약_가능하다() {
        JsonPath body = context.getLastHttpResponse().jsonPath();
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(200);
        assertThat(body.getBoolean("available")).isTrue();
        assertThat(body.getList("conflicts")).isEmpty();
        assertThat(body.getString("message")).isEqualTo("Trainer is available");
    }

    @Then("트레이너는 중복 세션 {int}건으로 예약 불가능하다")
    public void 트레이너는_예약_불가능하다(int conflicts) {
        JsonPath body = context.getLastHttpResponse().jsonPath();
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(200);
        assertThat(body.getBoolean("available")).isFalse();
        assertThat(body.getList("conflicts")).hasSize(conflicts);
        assertThat(body.getLong("conflicts[0].sessionId")).isEqualTo(context.getCurrentSessionId());
        assertThat(body.getString("message"))
                .isEqualTo(String.format("Trainer has %d conflicting session(s) during this time", conflicts));
    }
}
