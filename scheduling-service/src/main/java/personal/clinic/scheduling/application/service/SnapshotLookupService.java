package personal.clinic.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.clinic.scheduling.application.port.out.AppointmentRepository;
import personal.clinic.scheduling.application.port.out.PatientRepository;
import personal.clinic.scheduling.application.port.out.ProviderRepository;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.Patient;
import personal.clinic.scheduling.domain.model.Provider;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot Lookup Service
 * 캐시를 경유한 엔티티 조회 (미스 시 저장소에서 로드 후 적재)
 * 반환되는 목록과 엔티티는 모두 불변 스냅샷이다.
 */
@Component
@RequiredArgsConstructor
public class SnapshotLookupService {

    private final SnapshotCache cache;
    private final PatientRepository patientRepository;
    private final ProviderRepository providerRepository;
    private final AppointmentRepository appointmentRepository;

    public List<Patient> patients() {
        return cache.getOrLoad(CacheKeys.PATIENTS_ALL, () -> List.copyOf(patientRepository.findAll()));
    }

    public Optional<Patient> patient(String patientId) {
        return Optional.ofNullable(cache.getOrLoad(CacheKeys.patient(patientId),
                () -> patientRepository.findById(patientId).orElse(null)));
    }

    public List<Provider> providers() {
        return cache.getOrLoad(CacheKeys.PROVIDERS_ALL, () -> List.copyOf(providerRepository.findAll()));
    }

    public Optional<Provider> provider(String providerId) {
        return Optional.ofNullable(cache.getOrLoad(CacheKeys.provider(providerId),
                () -> providerRepository.findById(providerId).orElse(null)));
    }

    public List<Appointment> appointments() {
        return cache.getOrLoad(CacheKeys.APPOINTMENTS_ALL, () -> List.copyOf(appointmentRepository.findAll()));
    }

    public Optional<Appointment> appointment(String appointmentId) {
        return appointments().stream()
                .filter(appointment -> appointment.id().equals(appointmentId))
                .findFirst();
    }
}
