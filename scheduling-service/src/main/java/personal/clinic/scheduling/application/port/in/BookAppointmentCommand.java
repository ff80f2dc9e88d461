package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Book Appointment Command
 * 진료 예약 커맨드
 */
public record BookAppointmentCommand(
        String patientId,
        String providerId,
        LocalDate date,
        String slot,
        String notes
) {
    public BookAppointmentCommand {
        if (patientId == null || patientId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Patient ID cannot be null or blank");
        }
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
        if (slot == null || slot.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot cannot be null or blank");
        }
        notes = notes == null ? "" : notes;
    }
}
