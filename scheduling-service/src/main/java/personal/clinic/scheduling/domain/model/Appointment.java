package personal.clinic.scheduling.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Appointment Domain Model
 * 진료 예약 도메인 모델 (불변)
 * 환자/의사는 ID로만 참조한다 (소유 관계 아님).
 */
public record Appointment(
        String id,
        String patientId,
        String providerId,
        LocalDate date,
        String slot,
        String notes,
        AppointmentStatus status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public Appointment {
        if (id == null || id.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment ID cannot be null or blank");
        }
        if (patientId == null || providerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Patient ID and provider ID cannot be null");
        }
        if (date == null || slot == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date and slot cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment status cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Timestamps cannot be null");
        }
        notes = notes == null ? "" : notes;
    }

    /**
     * 예약 생성 (SCHEDULED 상태, 시스템 시계 기준)
     */
    public static Appointment book(String patientId, String providerId, LocalDate date, String slot, String notes) {
        return book(patientId, providerId, date, slot, notes, Clock.systemDefaultZone());
    }

    /**
     * 예약 생성 (SCHEDULED 상태)
     * createdAt, updatedAt은 주어진 시계의 현재 시각
     */
    public static Appointment book(String patientId, String providerId, LocalDate date, String slot, String notes,
            Clock clock) {
        LocalDateTime now = LocalDateTime.now(clock);
        return new Appointment(
                EntityIds.next(EntityIds.APPOINTMENT_PREFIX),
                patientId,
                providerId,
                date,
                slot,
                notes,
                AppointmentStatus.SCHEDULED,
                now,
                now);
    }

    /**
     * 상태 변경 (전이 제한 없음, updatedAt 갱신)
     */
    public Appointment changeStatus(AppointmentStatus newStatus) {
        return changeStatus(newStatus, Clock.systemDefaultZone());
    }

    public Appointment changeStatus(AppointmentStatus newStatus, Clock clock) {
        return new Appointment(id, patientId, providerId, date, slot, notes,
                newStatus, createdAt, LocalDateTime.now(clock));
    }

    /**
     * 일정 변경 (의사는 유지)
     */
    public Appointment reschedule(LocalDate newDate, String newSlot) {
        return reschedule(newDate, newSlot, Clock.systemDefaultZone());
    }

    public Appointment reschedule(LocalDate newDate, String newSlot, Clock clock) {
        return new Appointment(id, patientId, providerId, newDate, newSlot, notes,
                status, createdAt, LocalDateTime.now(clock));
    }

    /**
     * 시간대를 점유 중인지 (취소되지 않은 예약)
     */
    public boolean isLive() {
        return status != AppointmentStatus.CANCELLED;
    }

    /**
     * 아직 진행되지 않은 예약인지 (SCHEDULED, CONFIRMED)
     */
    public boolean isActive() {
        return status == AppointmentStatus.SCHEDULED || status == AppointmentStatus.CONFIRMED;
    }

    public boolean isCancelled() {
        return status == AppointmentStatus.CANCELLED;
    }

    /**
     * (의사, 날짜, 시간대) 일치 여부
     */
    public boolean occupies(String providerId, LocalDate date, String slot) {
        return this.providerId.equals(providerId)
                && this.date.equals(date)
                && this.slot.equals(slot);
    }
}
