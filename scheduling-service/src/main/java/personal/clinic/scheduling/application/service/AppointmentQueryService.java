package personal.clinic.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.GetAppointmentUseCase;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.Provider;
import personal.clinic.scheduling.domain.service.SlotConflictDetector;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Appointment Query Service
 * 예약 조회 (캐시 경유, 락 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentQueryService implements GetAppointmentUseCase {

    private final SnapshotLookupService lookups;
    private final SlotConflictDetector conflictDetector;

    @Override
    public Outcome<Appointment> getAppointment(String appointmentId) {
        return lookups.appointment(appointmentId)
                .map(Outcome::success)
                .orElseGet(() -> Outcome.rejected(ErrorCode.APPOINTMENT_NOT_FOUND,
                        "Appointment not found: " + appointmentId));
    }

    @Override
    public List<Appointment> listAppointments() {
        return lookups.appointments();
    }

    @Override
    public List<Appointment> listByPatient(String patientId) {
        return filter(appointment -> appointment.patientId().equals(patientId));
    }

    @Override
    public List<Appointment> listByProvider(String providerId) {
        return filter(appointment -> appointment.providerId().equals(providerId));
    }

    @Override
    public List<Appointment> listByProviderAndDate(String providerId, LocalDate date) {
        return filter(appointment -> appointment.providerId().equals(providerId)
                && appointment.date().equals(date));
    }

    @Override
    public Outcome<List<String>> freeSlots(String providerId, LocalDate date) {
        Optional<Provider> provider = lookups.provider(providerId);
        if (provider.isEmpty()) {
            return Outcome.rejected(ErrorCode.PROVIDER_NOT_FOUND, "Provider not found: " + providerId);
        }
        List<String> free = conflictDetector.freeSlots(provider.get(), date, lookups.appointments());
        log.debug("Free slots resolved: providerId={}, date={}, free={}", providerId, date, free.size());
        return Outcome.success(free);
    }

    private List<Appointment> filter(Predicate<Appointment> condition) {
        return lookups.appointments().stream()
                .filter(condition)
                .toList();
    }
}
