package personal.fitstudio.scheduling.booking.acceptance.steps;

import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import io.restassured.path.json.JsonPath;
import io.restassured.response.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.fitstudio.scheduling.booking.acceptance.support.SchedulingTestAdapter;
import personal.fitstudio.scheduling.booking.acceptance.support.SchedulingTestContext;
import personal.fitstudio.scheduling.booking.domain.model.SessionType;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 세션 참가, 취소, 대기열 Step Definitions
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class WaitlistSteps {

    private static final Instant SESSION_START = Instant.parse("2030-01-15T09:00:00Z");
    private static final Instant SESSION_END = Instant.parse("2030-01-15T10:00:00Z");
    private static final Long MACHINE_ID = 3L;
    private static final Long TRAINER_ID = 7L;

    private final SchedulingTestAdapter schedulingAdapter;
    private final SchedulingTestContext context;

    // ==========================================
    // Given
    // ==========================================

    @Given("회원 {string}가 정원 {int}명인 회원 세션을 예약했다")
    public void 회원이_세션을_예약했다(String name, int maxParticipants) {
        log.info(">>> Given: 회원 {}가 정원 {}명 세션 예약", name, maxParticipants);
        Long memberId = memberId(name);

        Response response = schedulingAdapter.bookNewSession(SessionType.MEMBER, MACHINE_ID, TRAINER_ID,
                SESSION_START, SESSION_END, maxParticipants, memberId);
        assertThat(response.statusCode()).as(response.asString()).isEqualTo(201);
        assertThat(response.jsonPath().getString("bookingStatus")).isEqualTo("CONFIRMED");

        context.setCurrentSessionId(response.jsonPath().getLong("sessionId"));
    }

    @Given("회원 {string}가 세션에 참가했다")
    public void 회원이_세션에_참가했다(String name) {
        log.info(">>> Given: 회원 {} 세션 참가", name);
        Response response = schedulingAdapter.joinSession(context.getCurrentSessionId(), memberId(name));
        assertThat(response.statusCode()).as(response.asString()).isEqualTo(201);
    }

    // ==========================================
    // When
    // ==========================================

    @When("회원 {string}가 세션 참가를 요청한다")
    public void 회원이_세션_참가를_요청한다(String name) {
        log.info(">>> When: 회원 {} 세션 참가 요청", name);
        context.setLastHttpResponse(schedulingAdapter.joinSession(context.getCurrentSessionId(), memberId(name)));
    }

    @When("회원 {string}의 예약을 {string} 상태로 변경한다")
    public void 회원의_예약_상태를_변경한다(String name, String status) {
        log.info(">>> When: 회원 {} 예약 상태 변경 - {}", name, status);
        context.setLastHttpResponse(schedulingAdapter.changeMemberStatus(
                context.getCurrentSessionId(), context.memberId(name), status));
    }

    @When("회원 {string}의 대기 예약을 삭제한다")
    public void 회원의_대기_예약을_삭제한다(String name) {
        log.info(">>> When: 회원 {} 대기 예약 삭제", name);
        Long participantId = sessionDetails().getLong(participantPath(name, "participantId"));
        context.setLastHttpResponse(schedulingAdapter.removeParticipant(context.getCurrentSessionId(), participantId));
    }

    // ==========================================
    // Then
    // ==========================================

    @Then("예약 상태는 {string}이고 대기 순번은 {int}이다")
    public void 예약_상태와_대기_순번을_확인한다(String status, int position) {
        JsonPath body = context.getLastHttpResponse().jsonPath();
        assertThat(body.getString("bookingStatus")).isEqualTo(status);
        assertThat(body.getInt("waitlistPosition")).isEqualTo(position);
    }

    @Then("회원 {string}의 예약 상태는 {string}이다")
    public void 회원의_예약_상태를_확인한다(String name, String status) {
        assertThat(sessionDetails().getString(participantPath(name, "bookingStatus"))).isEqualTo(status);
    }

    @Then("회원 {string}의 대기 순번은 {int}이다")
    public void 회원의_대기_순번을_확인한다(String name, int position) {
        JsonPath details = sessionDetails();
        assertThat(details.getString(participantPath(name, "bookingStatus"))).isEqualTo("WAITLISTED");
        assertThat(details.getInt(participantPath(name, "waitlistPosition"))).isEqualTo(position);
    }

    @Then("세션의 확정 인원은 {int}명이다")
    public void 세션의_확정_인원을_확인한다(int count) {
        JsonPath details = sessionDetails();
        List<String> confirmed = details.getList("participants.findAll { it.bookingStatus == 'CONFIRMED' }.bookingStatus");
        assertThat(details.getInt("session.currentParticipants")).isEqualTo(count);
        assertThat(confirmed).hasSize(count);
    }

    @Then("대기 중인 참가자는 없다")
    public void 대기_중인_참가자는_없다() {
        List<Object> waitlisted = sessionDetails()
                .getList("participants.findAll { it.bookingStatus == 'WAITLISTED' }");
        assertThat(waitlisted).isEmpty();
    }

    private Long memberId(String name) {
        return context.getMemberIds().computeIfAbsent(name, schedulingAdapter::createMember);
    }

    private JsonPath sessionDetails() {
        Response response = schedulingAdapter.getSession(context.getCurrentSessionId());
        assertThat(response.statusCode()).isEqualTo(200);
        return response.jsonPath();
    }

    private String participantPath(String name, String field) {
        return String.format("participants.find { it.memberId == %d }.%s", context.memberId(name), field);
    }
}
