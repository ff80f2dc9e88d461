package personal.clinic.scheduling.application.port.out;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Appointment;

import java.util.List;
import java.util.Optional;

/**
 * 예약 저장소 Port
 * 예약은 물리적으로 삭제하지 않는다 (취소는 상태 변경).
 */
public interface AppointmentRepository {

    List<Appointment> findAll();

    Optional<Appointment> findById(String appointmentId);

    Outcome<Appointment> save(Appointment appointment);

    Outcome<Appointment> update(Appointment appointment);
}
