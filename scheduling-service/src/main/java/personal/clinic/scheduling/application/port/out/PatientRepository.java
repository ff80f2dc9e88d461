package personal.clinic.scheduling.application.port.out;

import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.domain.model.Patient;

import java.util.List;
import java.util.Optional;

/**
 * 환자 저장소 Port
 */
public interface PatientRepository {

    List<Patient> findAll();

    Optional<Patient> findById(String patientId);

    /**
     * 신규 환자 추가
     */
    Outcome<Patient> save(Patient patient);

    /**
     * 기존 환자 교체 (없으면 Rejected NOT_FOUND)
     */
    Outcome<Patient> update(Patient patient);

    Outcome<Void> delete(String patientId);
}
