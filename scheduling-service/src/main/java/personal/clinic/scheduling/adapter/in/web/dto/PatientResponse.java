package personal.clinic.scheduling.adapter.in.web.dto;

import personal.clinic.scheduling.domain.model.Patient;

import java.time.LocalDateTime;

/**
 * 환자 응답 DTO
 */
public record PatientResponse(
        String patientId,
        String name,
        String nationalId,
        String phone,
        String email,
        LocalDateTime registeredAt
) {
    public static PatientResponse from(Patient patient) {
        return new PatientResponse(
                patient.id(),
                patient.name(),
                patient.nationalId(),
                patient.phone(),
                patient.email(),
                patient.registeredAt()
        );
    }
}
