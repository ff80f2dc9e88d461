package personal.clinic.scheduling.adapter.in.web.dto;

import personal.clinic.scheduling.domain.model.Provider;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 의사 응답 DTO
 */
public record ProviderResponse(
        String providerId,
        String name,
        String licenseCode,
        String specialty,
        List<String> availableSlots,
        LocalDateTime registeredAt
) {
    public static ProviderResponse from(Provider provider) {
        return new ProviderResponse(
                provider.id(),
                provider.name(),
                provider.licenseCode(),
                provider.specialty(),
                provider.availableSlots(),
                provider.registeredAt()
        );
    }
}
