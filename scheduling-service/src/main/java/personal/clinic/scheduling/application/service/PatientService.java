package personal.clinic.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.ManagePatientUseCase;
import personal.clinic.scheduling.application.port.in.RegisterPatientCommand;
import personal.clinic.scheduling.application.port.out.PatientRepository;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Patient;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Patient Service
 * 환자 등록/수정/삭제
 * 주민번호 중복 검사와 저장은 쓰기 락 안에서 함께 수행한다.
 * 삭제는 PatientDeletionGuard 독점 구역에서 실행되어 동시에 진행 중인 예약 생성과 겹치지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatientService implements ManagePatientUseCase {

    private final PatientRepository patientRepository;
    private final SnapshotLookupService lookups;
    private final SnapshotCache cache;
    private final PatientDeletionGuard deletionGuard;
    private final ReentrantLock writeLock = new ReentrantLock();

    @Override
    public Outcome<Patient> register(RegisterPatientCommand command) {
        writeLock.lock();
        try {
            if (nationalIdTaken(command.nationalId(), null)) {
                return duplicateNationalId(command.nationalId());
            }
            Patient patient = Patient.register(command.name(), command.nationalId(), command.phone(), command.email());
            Outcome<Patient> saved = patientRepository.save(patient);
            cache.invalidate(CacheKeys.PATIENTS);

            if (saved.isSuccess()) {
                log.info("Patient registered: patientId={}", patient.id());
            }
            return saved;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Outcome<Patient> getPatient(String patientId) {
        return lookups.patient(patientId)
                .map(Outcome::success)
                .orElseGet(() -> patientNotFound(patientId));
    }

    @Override
    public List<Patient> listPatients() {
        return lookups.patients();
    }

    @Override
    public Outcome<Patient> update(String patientId, RegisterPatientCommand command) {
        writeLock.lock();
        try {
            Optional<Patient> existing = lookups.patient(patientId);
            if (existing.isEmpty()) {
                return patientNotFound(patientId);
            }
            if (nationalIdTaken(command.nationalId(), patientId)) {
                return duplicateNationalId(command.nationalId());
            }
            Patient changed = existing.get()
                    .withDetails(command.name(), command.nationalId(), command.phone(), command.email());
            Outcome<Patient> updated = patientRepository.update(changed);
            cache.invalidate(CacheKeys.PATIENTS);

            if (updated.isSuccess()) {
                log.info("Patient updated: patientId={}", patientId);
            }
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Outcome<Void> delete(String patientId) {
        return deletionGuard.exclusively(() -> deleteExclusively(patientId));
    }

    private Outcome<Void> deleteExclusively(String patientId) {
        writeLock.lock();
        try {
            if (lookups.patient(patientId).isEmpty()) {
                return patientNotFound(patientId);
            }
            long active = lookups.appointments().stream()
                    .filter(appointment -> appointment.patientId().equals(patientId))
                    .filter(appointment -> appointment.isActive())
                    .count();
            if (active > 0) {
                log.warn("Patient deletion rejected, active appointments: patientId={}, active={}", patientId, active);
                return Outcome.rejected(ErrorCode.PATIENT_HAS_ACTIVE_APPOINTMENTS,
                        "Patient has " + active + " active appointment(s): " + patientId);
            }
            Outcome<Void> deleted = patientRepository.delete(patientId);
            cache.invalidate(CacheKeys.PATIENTS);

            if (deleted.isSuccess()) {
                log.info("Patient deleted: patientId={}", patientId);
            }
            return deleted;
        } finally {
            writeLock.unlock();
        }
    }

    private boolean nationalIdTaken(String nationalId, String excludeId) {
        return lookups.patients().stream()
                .filter(patient -> !patient.id().equals(excludeId))
                .anyMatch(patient -> patient.nationalId().equals(nationalId));
    }

    private static <T> Outcome<T> duplicateNationalId(String nationalId) {
        log.warn("Duplicate national ID: nationalId={}", nationalId);
        return Outcome.rejected(ErrorCode.DUPLICATE_NATIONAL_ID, "National ID already registered: " + nationalId);
    }

    private static <T> Outcome<T> patientNotFound(String patientId) {
        log.warn("Patient not found: patientId={}", patientId);
        return Outcome.rejected(ErrorCode.PATIENT_NOT_FOUND, "Patient not found: " + patientId);
    }
}
