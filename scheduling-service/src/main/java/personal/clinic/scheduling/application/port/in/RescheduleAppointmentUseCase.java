package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Appointment;

/**
 * Reschedule Appointment UseCase (Input Port)
 */
public interface RescheduleAppointmentUseCase {

    /**
     * 일정 변경
     * 충돌 검사에서 자기 자신은 제외한다. 취소된 예약은 변경할 수 없다.
     *
     * @return Success | Rejected(APPOINTMENT_NOT_FOUND, INVALID_STATUS, SLOT_UNAVAILABLE, SLOT_ALREADY_BOOKED) | Failed
     */
    Outcome<Appointment> reschedule(RescheduleAppointmentCommand command);
}
