package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Appointment;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Appointment UseCase (Input Port)
 * 예약 조회 유스케이스 (캐시 경유)
 */
public interface GetAppointmentUseCase {

    Outcome<Appointment> getAppointment(String appointmentId);

    List<Appointment> listAppointments();

    List<Appointment> listByPatient(String patientId);

    List<Appointment> listByProvider(String providerId);

    List<Appointment> listByProviderAndDate(String providerId, LocalDate date);

    /**
     * 특정 날짜에 비어 있는 의사의 시간대
     *
     * @return Success(시간대 목록) | Rejected(PROVIDER_NOT_FOUND)
     */
    Outcome<List<String>> freeSlots(String providerId, LocalDate date);
}
