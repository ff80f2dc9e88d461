package personal.clinic.scheduling.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import personal.clinic.scheduling.domain.model.Provider;

import java.util.List;

/**
 * Provider Document
 * providers.json 레코드 형식
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("license_code") String licenseCode,
        @JsonProperty("specialty") String specialty,
        @JsonProperty("available_slots") List<String> availableSlots,
        @JsonProperty("registered_at") String registeredAt) {

    public static ProviderDocument fromDomain(Provider provider) {
        return new ProviderDocument(
                provider.id(),
                provider.name(),
                provider.licenseCode(),
                provider.specialty(),
                provider.availableSlots(),
                DocumentTimes.format(provider.registeredAt()));
    }

    public Provider toDomain() {
        return new Provider(
                id,
                name,
                licenseCode,
                specialty,
                availableSlots == null ? List.of() : availableSlots,
                DocumentTimes.parseOrNow(registeredAt));
    }
}
