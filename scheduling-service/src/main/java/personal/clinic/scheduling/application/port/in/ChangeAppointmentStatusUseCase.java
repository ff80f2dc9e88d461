package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.AppointmentStatus;

/**
 * Change Appointment Status UseCase (Input Port)
 * 상태 전이는 제한하지 않는다. CANCELLED에서 벗어나는 경우만 시간대 충돌을 검사한다.
 */
public interface ChangeAppointmentStatusUseCase {

    Outcome<Appointment> changeStatus(String appointmentId, AppointmentStatus status);

    Outcome<Appointment> cancel(String appointmentId);

    Outcome<Appointment> confirm(String appointmentId);

    Outcome<Appointment> complete(String appointmentId);
}
