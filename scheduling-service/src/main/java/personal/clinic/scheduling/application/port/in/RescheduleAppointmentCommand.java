package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Reschedule Appointment Command
 * 일정 변경 커맨드 (같은 의사의 다른 날짜/시간대)
 */
public record RescheduleAppointmentCommand(
        String appointmentId,
        LocalDate date,
        String slot
) {
    public RescheduleAppointmentCommand {
        if (appointmentId == null || appointmentId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
        if (slot == null || slot.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot cannot be null or blank");
        }
    }
}
