package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Appointment;

/**
 * Book Appointment UseCase (Input Port)
 * 진료 예약 유스케이스
 */
public interface BookAppointmentUseCase {

    /**
     * 진료 예약
     * 예약 임계 구역 안에서 환자/의사 확인, 시간대 확인, 충돌 검사, 저장을 수행한다.
     *
     * @return Success(SCHEDULED 예약) |
     * Rejected(PATIENT_NOT_FOUND, PROVIDER_NOT_FOUND, SLOT_UNAVAILABLE, SLOT_ALREADY_BOOKED) |
     * Failed(저장 실패)
     */
    Outcome<Appointment> book(BookAppointmentCommand command);
}
