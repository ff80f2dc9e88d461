package personal.clinic.scheduling.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.clinic.scheduling.acceptance.support.SchedulingHttpAdapter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Booking Acceptance Test Step Definitions
 * 비즈니스 관점의 자연어로 작성된 시나리오에 매핑
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class BookingAcceptanceSteps {

    private final SchedulingHttpAdapter httpAdapter;

    // 테스트 컨텍스트 (이름 → ID)
    private final Map<String, String> patientIds = new HashMap<>();
    private final Map<String, String> appointmentIds = new HashMap<>();
    private String currentProviderId;
    private Response lastResponse;

    // ==========================================
    // Given: 사전 상태
    // ==========================================

    @Given("{string} 시간대를 제공하는 의사가 등록되어 있다")
    public void 시간대를_제공하는_의사가_등록되어_있다(String slot) {
        log.info(">>> Given: 의사 등록 - slot={}", slot);
        Response response = httpAdapter.registerProvider("Dr. Choi", "CRM-" + uniqueSuffix(), List.of(slot));
        assertThat(response.statusCode()).isEqualTo(201);
        currentProviderId = response.jsonPath().getString("data.providerId");
    }

    @And("환자 {string}가 등록되어 있다")
    public void 환자가_등록되어_있다(String patientName) {
        log.info(">>> Given: 환자 등록 - name={}", patientName);
        Response response = httpAdapter.registerPatient(patientName, "NID-" + uniqueSuffix());
        assertThat(response.statusCode()).isEqualTo(201);
        patientIds.put(patientName, response.jsonPath().getString("data.patientId"));
    }

    // ==========================================
    // When: 사용자 행동
    // ==========================================

    @When("환자 {string}가 {string} {string} 시간대를 예약한다")
    public void 환자가_시간대를_예약한다(String patientName, String date, String slot) {
        log.info(">>> When: 예약 요청 - patient={}, date={}, slot={}", patientName, date, slot);
        lastResponse = httpAdapter.book(patientIds.get(patientName), currentProviderId, date, slot);
        if (lastResponse.statusCode() == 201) {
            appointmentIds.put(patientName, lastResponse.jsonPath().getString("data.appointmentId"));
        }
    }

    @When("환자 {string}의 예약을 취소한다")
    public void 환자의_예약을_취소한다(String patientName) {
        log.info(">>> When: 예약 취소 - patient={}", patientName);
        lastResponse = httpAdapter.cancel(appointmentIds.get(patientName));
        assertThat(lastResponse.statusCode()).isEqualTo(200);
    }

    // ==========================================
    // Then: 결과 검증
    // ==========================================

    @Then("예약이 생성되고 상태는 {string}이다")
    public void 예약이_생성되고_상태는(String status) {
        assertThat(lastResponse.statusCode()).isEqualTo(201);
        assertThat(lastResponse.jsonPath().getString("result")).isEqualTo("success");
        assertThat(lastResponse.jsonPath().getString("data.status")).isEqualTo(status);
    }

    @Then("예약이 {int} 상태 코드와 {string} 사유로 거절된다")
    public void 예약이_거절된다(int statusCode, String reason) {
        assertThat(lastResponse.statusCode()).isEqualTo(statusCode);
        assertThat(lastResponse.jsonPath().getString("result")).isEqualTo("error");
        assertThat(lastResponse.jsonPath().getString("message")).isEqualTo(reason);
    }

    @Then("예약이 {int} 상태 코드로 거절되고 사유에 {string}이 포함된다")
    public void 예약이_거절되고_사유를_포함한다(int statusCode, String fragment) {
        assertThat(lastResponse.statusCode()).isEqualTo(statusCode);
        assertThat(lastResponse.jsonPath().getString("message")).contains(fragment);
    }

    @Then("{string}의 빈 시간대에 {string}이 포함되지 않는다")
    public void 빈_시간대에_포함되지_않는다(String date, String slot) {
        Response response = httpAdapter.freeSlots(currentProviderId, date);
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getList("data", String.class)).doesNotContain(slot);
    }

    private static String uniqueSuffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
