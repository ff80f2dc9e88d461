package personal.clinic.scheduling.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import personal.clinic.scheduling.domain.model.Patient;

/**
 * Patient Document
 * patients.json 레코드 형식 (snake_case, 시각은 ISO-8601 문자열)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatientDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("national_id") String nationalId,
        @JsonProperty("phone") String phone,
        @JsonProperty("email") String email,
        @JsonProperty("registered_at") String registeredAt) {

    public static PatientDocument fromDomain(Patient patient) {
        return new PatientDocument(
                patient.id(),
                patient.name(),
                patient.nationalId(),
                patient.phone(),
                patient.email(),
                DocumentTimes.format(patient.registeredAt()));
    }

    public Patient toDomain() {
        return new Patient(
                id,
                name,
                nationalId,
                phone,
                email,
                DocumentTimes.parseOrNow(registeredAt));
    }
}
