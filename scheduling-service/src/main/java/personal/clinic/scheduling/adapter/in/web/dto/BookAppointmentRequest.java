package personal.clinic.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import personal.clinic.scheduling.application.port.in.BookAppointmentCommand;

import java.time.LocalDate;

/**
 * 진료 예약 요청 DTO
 */
public record BookAppointmentRequest(
        @NotBlank(message = "환자 ID는 필수입니다.")
        String patientId,

        @NotBlank(message = "의사 ID는 필수입니다.")
        String providerId,

        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate date,

        @NotBlank(message = "시간대는 필수입니다.")
        String slot,

        String notes
) {
    public BookAppointmentCommand toCommand() {
        return new BookAppointmentCommand(patientId, providerId, date, slot, notes);
    }
}
