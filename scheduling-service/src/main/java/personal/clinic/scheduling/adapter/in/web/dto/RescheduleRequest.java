package personal.clinic.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import personal.clinic.scheduling.application.port.in.RescheduleAppointmentCommand;

import java.time.LocalDate;

/**
 * 일정 변경 요청 DTO
 */
public record RescheduleRequest(
        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate date,

        @NotBlank(message = "시간대는 필수입니다.")
        String slot
) {
    public RescheduleAppointmentCommand toCommand(String appointmentId) {
        return new RescheduleAppointmentCommand(appointmentId, date, slot);
    }
}
