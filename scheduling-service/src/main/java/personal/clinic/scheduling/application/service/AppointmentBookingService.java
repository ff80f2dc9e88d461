package personal.clinic.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.BookAppointmentCommand;
import personal.clinic.scheduling.application.port.in.BookAppointmentUseCase;
import personal.clinic.scheduling.application.port.in.RescheduleAppointmentCommand;
import personal.clinic.scheduling.application.port.in.RescheduleAppointmentUseCase;
import personal.clinic.scheduling.application.port.out.AppointmentRepository;
import personal.clinic.scheduling.application.port.out.BookingLockPort;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.Patient;
import personal.clinic.scheduling.domain.model.Provider;
import personal.clinic.scheduling.domain.service.SlotConflictDetector;

import java.time.Clock;
import java.util.Optional;

/**
 * Appointment Booking Service
 * 진료 예약 및 일정 변경 처리
 *
 * 흐름 (예약 임계 구역 안에서 실행):
 * 1. 환자/의사 조회 (캐시 경유)
 * 2. 의사 진료 시간대 확인
 * 3. 취소되지 않은 예약과의 충돌 검사
 * 4. 저장 → "appointments" 캐시 무효화
 *
 * 신규 예약은 환자 삭제와 겹치지 않도록 PatientDeletionGuard 읽기 구역에서 실행한다.
 * 생성/수정 시각은 주입된 Clock 기준.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentBookingService implements BookAppointmentUseCase, RescheduleAppointmentUseCase {

    static final String SLOT_ALREADY_BOOKED_REASON = "slot already booked";

    private final BookingLockPort bookingLock;
    private final SnapshotLookupService lookups;
    private final AppointmentRepository appointmentRepository;
    private final SnapshotCache cache;
    private final SlotConflictDetector conflictDetector;
    private final PatientDeletionGuard deletionGuard;
    private final Clock clock;

    @Override
    public Outcome<Appointment> book(BookAppointmentCommand command) {
        return bookingLock.withinBookingSection(command.providerId(),
                () -> deletionGuard.whileReferencing(() -> bookInSection(command)));
    }

    @Override
    public Outcome<Appointment> reschedule(RescheduleAppointmentCommand command) {
        Optional<Appointment> target = lookups.appointment(command.appointmentId());
        if (target.isEmpty()) {
            return appointmentNotFound(command.appointmentId());
        }
        return bookingLock.withinBookingSection(target.get().providerId(), () -> rescheduleInSection(command));
    }

    private Outcome<Appointment> bookInSection(BookAppointmentCommand command) {
        Optional<Patient> patient = lookups.patient(command.patientId());
        if (patient.isEmpty()) {
            log.warn("Booking rejected, patient not found: patientId={}", command.patientId());
            return Outcome.rejected(ErrorCode.PATIENT_NOT_FOUND, "Patient not found: " + command.patientId());
        }

        Optional<Provider> provider = lookups.provider(command.providerId());
        if (provider.isEmpty()) {
            log.warn("Booking rejected, provider not found: providerId={}", command.providerId());
            return Outcome.rejected(ErrorCode.PROVIDER_NOT_FOUND, "Provider not found: " + command.providerId());
        }

        if (!provider.get().offersSlot(command.slot())) {
            log.warn("Booking rejected, slot not offered: providerId={}, slot={}",
                    command.providerId(), command.slot());
            return slotUnavailable(command.providerId(), command.slot());
        }

        Optional<Appointment> conflict = conflictDetector.findConflict(
                lookups.appointments(), command.providerId(), command.date(), command.slot(), null);
        if (conflict.isPresent()) {
            log.warn("Booking rejected, slot already booked: providerId={}, date={}, slot={}, existingId={}",
                    command.providerId(), command.date(), command.slot(), conflict.get().id());
            return Outcome.rejected(ErrorCode.SLOT_ALREADY_BOOKED, SLOT_ALREADY_BOOKED_REASON);
        }

        Appointment appointment = Appointment.book(
                command.patientId(), command.providerId(), command.date(), command.slot(), command.notes(), clock);
        Outcome<Appointment> saved = appointmentRepository.save(appointment);
        cache.invalidate(CacheKeys.APPOINTMENTS);

        if (saved.isSuccess()) {
            log.info("Appointment booked: appointmentId={}, patientId={}, providerId={}, date={}, slot={}",
                    appointment.id(), command.patientId(), command.providerId(), command.date(), command.slot());
        }
        return saved;
    }

    private Outcome<Appointment> rescheduleInSection(RescheduleAppointmentCommand command) {
        Optional<Appointment> current = lookups.appointment(command.appointmentId());
        if (current.isEmpty()) {
            return appointmentNotFound(command.appointmentId());
        }
        Appointment appointment = current.get();
        if (appointment.isCancelled()) {
            log.warn("Reschedule rejected, appointment cancelled: appointmentId={}", appointment.id());
            return Outcome.rejected(ErrorCode.INVALID_STATUS,
                    "Cancelled appointment cannot be rescheduled: " + appointment.id());
        }

        Optional<Provider> provider = lookups.provider(appointment.providerId());
        if (provider.isEmpty()) {
            return Outcome.rejected(ErrorCode.PROVIDER_NOT_FOUND, "Provider not found: " + appointment.providerId());
        }
        if (!provider.get().offersSlot(command.slot())) {
            log.warn("Reschedule rejected, slot not offered: providerId={}, slot={}",
                    appointment.providerId(), command.slot());
            return slotUnavailable(appointment.providerId(), command.slot());
        }

        Optional<Appointment> conflict = conflictDetector.findConflict(lookups.appointments(),
                appointment.providerId(), command.date(), command.slot(), appointment.id());
        if (conflict.isPresent()) {
            log.warn("Reschedule rejected, slot already booked: appointmentId={}, date={}, slot={}",
                    appointment.id(), command.date(), command.slot());
            return Outcome.rejected(ErrorCode.SLOT_ALREADY_BOOKED, SLOT_ALREADY_BOOKED_REASON);
        }

        Outcome<Appointment> updated = appointmentRepository.update(
                appointment.reschedule(command.date(), command.slot(), clock));
        cache.invalidate(CacheKeys.APPOINTMENTS);

        if (updated.isSuccess()) {
            log.info("Appointment rescheduled: appointmentId={}, from={} {}, to={} {}",
                    appointment.id(), appointment.date(), appointment.slot(), command.date(), command.slot());
        }
        return updated;
    }

    private static Outcome<Appointment> appointmentNotFound(String appointmentId) {
        log.warn("Appointment not found: appointmentId={}", appointmentId);
        return Outcome.rejected(ErrorCode.APPOINTMENT_NOT_FOUND, "Appointment not found: " + appointmentId);
    }

    private static Outcome<Appointment> slotUnavailable(String providerId, String slot) {
        return Outcome.rejected(ErrorCode.SLOT_UNAVAILABLE,
                "Slot " + slot + " is not offered by provider " + providerId);
    }
}
