package personal.clinic.scheduling.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.BookAppointmentCommand;
import personal.clinic.scheduling.application.port.in.BookAppointmentUseCase;
import personal.clinic.scheduling.application.port.in.ChangeAppointmentStatusUseCase;
import personal.clinic.scheduling.application.port.in.GetAppointmentUseCase;
import personal.clinic.scheduling.application.port.in.RescheduleAppointmentUseCase;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.AppointmentStatus;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Appointment Controller 단위 테스트
 * Outcome → HTTP 상태/ApiResponse 매핑 검증
 */
@WebMvcTest(AppointmentController.class)
@DisplayName("Appointment API 단위 테스트")
class AppointmentControllerTest {

    private static final LocalDate DATE = LocalDate.of(2025, 11, 25);
    private static final String BOOK_BODY = """
            {"patientId": "P1", "providerId": "M1", "date": "2025-11-25", "slot": "09:00", "notes": "checkup"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BookAppointmentUseCase bookAppointmentUseCase;
    @MockBean
    private RescheduleAppointmentUseCase rescheduleAppointmentUseCase;
    @MockBean
    private ChangeAppointmentStatusUseCase changeAppointmentStatusUseCase;
    @MockBean
    private GetAppointmentUseCase getAppointmentUseCase;

    @Test
    @DisplayName("예약 성공 시 201과 scheduled 상태를 반환한다")
    void book_Created() throws Exception {
        // given
        Appointment booked = Appointment.book("P1", "M1", DATE, "09:00", "checkup");
        given(bookAppointmentUseCase.book(any(BookAppointmentCommand.class))).willReturn(Outcome.success(booked));

        // when & then
        mockMvc.perform(post("/api/v1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOK_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.appointmentId").value(booked.id()))
                .andExpect(jsonPath("$.data.status").value("scheduled"))
                .andExpect(jsonPath("$.data.date").value("2025-11-25"));
    }

    @Test
    @DisplayName("이미 예약된 시간대면 409와 거절 사유를 그대로 반환한다")
    void book_Conflict() throws Exception {
        // given
        given(bookAppointmentUseCase.book(any(BookAppointmentCommand.class)))
                .willReturn(Outcome.rejected(ErrorCode.SLOT_ALREADY_BOOKED, "slot already booked"));

        // when & then
        mockMvc.perform(post("/api/v1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOK_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.result").value("error"))
                .andExpect(jsonPath("$.message").value("slot already booked"));
    }

    @Test
    @DisplayName("저장 실패 시 500과 일반 메시지를 반환한다 (원인은 노출하지 않음)")
    void book_PersistenceFailure() throws Exception {
        // given
        given(bookAppointmentUseCase.book(any(BookAppointmentCommand.class)))
                .willReturn(Outcome.failed("Failed to save collection appointments", new IOException("disk full")));

        // when & then
        mockMvc.perform(post("/api/v1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOK_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.result").value("error"))
                .andExpect(jsonPath("$.message").value(ErrorCode.PERSISTENCE_FAILURE.getMessage()));
    }

    @Test
    @DisplayName("필수 값이 빠진 요청은 400을 반환하고 유스케이스를 호출하지 않는다")
    void book_InvalidRequest() throws Exception {
        mockMvc.perform(post("/api/v1/appointments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientId\": \"P1\", \"date\": \"2025-11-25\", \"slot\": \"09:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.result").value("error"));

        then(bookAppointmentUseCase).should(never()).book(any());
    }

    @Test
    @DisplayName("의사와 날짜로 예약 목록을 조회한다")
    void list_ByProviderAndDate() throws Exception {
        // given
        Appointment appointment = Appointment.book("P1", "M1", DATE, "09:00", "");
        given(getAppointmentUseCase.listByProviderAndDate("M1", DATE)).willReturn(List.of(appointment));

        // when & then
        mockMvc.perform(get("/api/v1/appointments")
                        .param("providerId", "M1")
                        .param("date", "2025-11-25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].slot").value("09:00"));
    }

    @Test
    @DisplayName("존재하지 않는 예약 조회는 404를 반환한다")
    void get_NotFound() throws Exception {
        given(getAppointmentUseCase.getAppointment("C404"))
                .willReturn(Outcome.rejected(ErrorCode.APPOINTMENT_NOT_FOUND, "Appointment not found: C404"));

        mockMvc.perform(get("/api/v1/appointments/C404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Appointment not found: C404"));
    }

    @Test
    @DisplayName("상태 변경 요청은 소문자 상태 값을 받는다")
    void changeStatus_Lowercase() throws Exception {
        // given
        Appointment confirmed = Appointment.book("P1", "M1", DATE, "09:00", "")
                .changeStatus(AppointmentStatus.CONFIRMED);
        given(changeAppointmentStatusUseCase.changeStatus(confirmed.id(), AppointmentStatus.CONFIRMED))
                .willReturn(Outcome.success(confirmed));

        // when & then
        mockMvc.perform(patch("/api/v1/appointments/{id}/status", confirmed.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"confirmed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("confirmed"));
    }

    @Test
    @DisplayName("알 수 없는 상태 값은 400을 반환한다")
    void changeStatus_UnknownStatus() throws Exception {
        mockMvc.perform(patch("/api/v1/appointments/{id}/status", "C1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"postponed\"}"))
                .andExpect(status().isBadRequest());

        then(changeAppointmentStatusUseCase).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("취소 요청")
    void cancel() throws Exception {
        Appointment cancelled = Appointment.book("P1", "M1", DATE, "09:00", "")
                .changeStatus(AppointmentStatus.CANCELLED);
        given(changeAppointmentStatusUseCase.cancel(cancelled.id())).willReturn(Outcome.success(cancelled));

        mockMvc.perform(post("/api/v1/appointments/{id}/cancel", cancelled.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("cancelled"));
    }
}
