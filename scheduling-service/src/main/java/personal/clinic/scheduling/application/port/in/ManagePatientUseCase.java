package personal.clinic.scheduling.application.port.in;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Patient;

import java.util.List;

/**
 * Manage Patient UseCase (Input Port)
 * 환자 등록/조회/수정/삭제
 */
public interface ManagePatientUseCase {

    /**
     * @return Success | Rejected(DUPLICATE_NATIONAL_ID) | Failed
     */
    Outcome<Patient> register(RegisterPatientCommand command);

    Outcome<Patient> getPatient(String patientId);

    List<Patient> listPatients();

    /**
     * @return Success | Rejected(PATIENT_NOT_FOUND, DUPLICATE_NATIONAL_ID) | Failed
     */
    Outcome<Patient> update(String patientId, RegisterPatientCommand command);

    /**
     * 진행 중(SCHEDULED, CONFIRMED)인 예약이 있으면 삭제할 수 없다.
     *
     * @return Success | Rejected(PATIENT_NOT_FOUND, PATIENT_HAS_ACTIVE_APPOINTMENTS) | Failed
     */
    Outcome<Void> delete(String patientId);
}
