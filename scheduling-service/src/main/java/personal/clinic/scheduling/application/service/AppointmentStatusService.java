package personal.clinic.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.in.ChangeAppointmentStatusUseCase;
import personal.clinic.scheduling.application.port.out.AppointmentRepository;
import personal.clinic.scheduling.application.port.out.BookingLockPort;
import personal.clinic.scheduling.application.port.out.SnapshotCache;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.AppointmentStatus;
import personal.clinic.scheduling.domain.service.SlotConflictDetector;

import java.time.Clock;
import java.util.Optional;

/**
 * Appointment Status Service
 * 예약 상태 변경 (취소/확정/완료 포함)
 * 일정 변경과 같은 스냅샷을 덮어쓰지 않도록 해당 의사의 예약 임계 구역에서 실행한다.
 * 취소 예약의 재활성화가 환자 삭제와 겹치지 않도록 PatientDeletionGuard 읽기 구역에서 실행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentStatusService implements ChangeAppointmentStatusUseCase {

    private final BookingLockPort bookingLock;
    private final SnapshotLookupService lookups;
    private final AppointmentRepository appointmentRepository;
    private final SnapshotCache cache;
    private final SlotConflictDetector conflictDetector;
    private final PatientDeletionGuard deletionGuard;
    private final Clock clock;

    @Override
    public Outcome<Appointment> changeStatus(String appointmentId, AppointmentStatus status) {
        Optional<Appointment> target = lookups.appointment(appointmentId);
        if (target.isEmpty()) {
            return appointmentNotFound(appointmentId);
        }
        return bookingLock.withinBookingSection(target.get().providerId(),
                () -> deletionGuard.whileReferencing(() -> changeStatusInSection(appointmentId, status)));
    }

    @Override
    public Outcome<Appointment> cancel(String appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.CANCELLED);
    }

    @Override
    public Outcome<Appointment> confirm(String appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.CONFIRMED);
    }

    @Override
    public Outcome<Appointment> complete(String appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.COMPLETED);
    }

    private Outcome<Appointment> changeStatusInSection(String appointmentId, AppointmentStatus status) {
        Optional<Appointment> current = lookups.appointment(appointmentId);
        if (current.isEmpty()) {
            return appointmentNotFound(appointmentId);
        }
        Appointment appointment = current.get();

        // 취소 상태에서 벗어나면 시간대를 다시 점유한다
        if (appointment.isCancelled() && status != AppointmentStatus.CANCELLED) {
            Optional<Appointment> conflict = conflictDetector.findConflict(lookups.appointments(),
                    appointment.providerId(), appointment.date(), appointment.slot(), appointment.id());
            if (conflict.isPresent()) {
                log.warn("Status change rejected, slot re-booked: appointmentId={}, existingId={}",
                        appointmentId, conflict.get().id());
                return Outcome.rejected(ErrorCode.SLOT_ALREADY_BOOKED,
                        AppointmentBookingService.SLOT_ALREADY_BOOKED_REASON);
            }
        }

        Outcome<Appointment> updated = appointmentRepository.update(appointment.changeStatus(status, clock));
        cache.invalidate(CacheKeys.APPOINTMENTS);

        if (updated.isSuccess()) {
            log.info("Appointment status changed: appointmentId={}, from={}, to={}",
                    appointmentId, appointment.status(), status);
        }
        return updated;
    }

    private static Outcome<Appointment> appointmentNotFound(String appointmentId) {
        log.warn("Appointment not found: appointmentId={}", appointmentId);
        return Outcome.rejected(ErrorCode.APPOINTMENT_NOT_FOUND, "Appointment not found: " + appointmentId);
    }
}
