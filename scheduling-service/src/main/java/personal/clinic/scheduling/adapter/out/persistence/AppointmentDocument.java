package personal.clinic.scheduling.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.AppointmentStatus;

import java.time.LocalDate;

/**
 * Appointment Document
 * appointments.json 레코드 형식
 * 상태는 소문자 문자열, 누락 시 scheduled 로 간주한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppointmentDocument(
        @JsonProperty("id") String id,
        @JsonProperty("patient_id") String patientId,
        @JsonProperty("provider_id") String providerId,
        @JsonProperty("date") String date,
        @JsonProperty("slot") String slot,
        @JsonProperty("notes") String notes,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt) {

    public static AppointmentDocument fromDomain(Appointment appointment) {
        return new AppointmentDocument(
                appointment.id(),
                appointment.patientId(),
                appointment.providerId(),
                appointment.date().toString(),
                appointment.slot(),
                appointment.notes(),
                appointment.status().value(),
                DocumentTimes.format(appointment.createdAt()),
                DocumentTimes.format(appointment.updatedAt()));
    }

    public Appointment toDomain() {
        AppointmentStatus parsedStatus = status == null || status.isBlank()
                ? AppointmentStatus.SCHEDULED
                : AppointmentStatus.from(status)
                .orElseThrow(() -> new IllegalArgumentException("Unknown appointment status: " + status));
        return new Appointment(
                id,
                patientId,
                providerId,
                date == null ? null : LocalDate.parse(date),
                slot,
                notes == null ? "" : notes,
                parsedStatus,
                DocumentTimes.parseOrNow(createdAt),
                DocumentTimes.parseOrNow(updatedAt));
    }
}
