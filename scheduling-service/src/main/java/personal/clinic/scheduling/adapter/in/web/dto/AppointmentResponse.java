package personal.clinic.scheduling.adapter.in.web.dto;

import personal.clinic.scheduling.domain.model.Appointment;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 예약 조회/생성 응답 DTO
 */
public record AppointmentResponse(
        String appointmentId,
        String patientId,
        String providerId,
        LocalDate date,
        String slot,
        String notes,
        String status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static AppointmentResponse from(Appointment appointment) {
        return new AppointmentResponse(
                appointment.id(),
                appointment.patientId(),
                appointment.providerId(),
                appointment.date(),
                appointment.slot(),
                appointment.notes(),
                appointment.status().value(),
                appointment.createdAt(),
                appointment.updatedAt()
        );
    }
}
